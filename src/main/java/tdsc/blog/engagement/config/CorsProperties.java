package tdsc.blog.engagement.config;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Cross-origin settings for the browser front end
 */
@Data
@Validated
@ConfigurationProperties(prefix = "blog.cors")
public class CorsProperties {

    /**
     * Allowed origin patterns; "*" allows any origin
     */
    @NotEmpty
    private List<String> allowedOrigins = List.of("*");
}
