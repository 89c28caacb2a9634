package com.pifinance.backend.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pifinance.cors")
public class CorsProperties {

    /**
     * Allowed origins, comma-separated. {@code *} allows any origin.
     */
    private List<String> allowedOrigins = List.of("*");

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        List<String> sanitized = new ArrayList<>();
        if (allowedOrigins != null) {
            for (String origin : allowedOrigins) {
                if (origin != null && !origin.isBlank()) {
                    sanitized.add(origin.trim());
                }
            }
        }
        if (!sanitized.isEmpty()) {
            this.allowedOrigins = List.copyOf(sanitized);
        }
    }
}
