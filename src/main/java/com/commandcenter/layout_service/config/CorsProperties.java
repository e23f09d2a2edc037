package com.commandcenter.layout_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Browser origins allowed to call the layout API. A comma-separated value binds too,
 * e.g. {@code CORS_ALLOWED_ORIGINS=http://localhost:3000,https://*.example.com}.
 */
@Data
@ConfigurationProperties(prefix = "app.cors")
public class CorsProperties {

    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    // Preflight cache lifetime; the canvas re-posts on every topology change
    private long maxAgeSeconds = 1800;
}
