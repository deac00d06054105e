package tdsc.blog.engagement.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every engagement meter with the service name, so that
 * {@code blog.auth.*}, {@code blog.votes.*} and {@code blog.comments.*}
 * can be told apart from other services scraped by the same Prometheus.
 */
@Slf4j
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> engagementTags(
            @Value("${spring.application.name:blog-engagement}") String applicationName) {
        Tags tags = Tags.of("service", applicationName, "component", "engagement-api");
        return registry -> {
            registry.config().commonTags(tags);
            log.info("Engagement metrics tagged: {}", tags);
        };
    }
}
