package tdsc.blog.engagement.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoints; no authentication
 */
@RestController
@Tag(name = "Health", description = "Liveness checks")
public class HealthController {

    @Value("${blog.service-name:TDSC Blog Backend}")
    private String serviceName;

    @Value("${blog.database-label:MySQL}")
    private String databaseLabel;

    @GetMapping("/")
    @Operation(summary = "Service banner")
    public Map<String, Object> root() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("service", serviceName);
        response.put("version", "1.0.0");
        response.put("database", databaseLabel);
        return response;
    }

    @GetMapping("/health")
    @Operation(summary = "Liveness probe")
    public Map<String, Object> health() {
        return Map.of("status", "ok");
    }
}
