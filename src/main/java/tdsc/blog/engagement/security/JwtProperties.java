package tdsc.blog.engagement.security;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Access token settings, bound from {@code blog.jwt.*}
 */
@Data
@Validated
@ConfigurationProperties(prefix = "blog.jwt")
public class JwtProperties {

    /**
     * HMAC signing secret. Must be at least as long as the algorithm's key size.
     */
    @NotBlank
    private String secret;

    /**
     * HS256, HS384 or HS512
     */
    @Pattern(regexp = "HS256|HS384|HS512", message = "JWT algorithm must be HS256, HS384 or HS512")
    private String algorithm = "HS256";

    /**
     * Token lifetime from issuance
     */
    @Min(1)
    private long expireMinutes = 1440;
}
