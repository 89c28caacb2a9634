package com.pifinance.backend.security;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pifinance.security")
public class ApiKeyProperties {

    /**
     * Keys accepted in the {@code X-API-Key} header. Bound from a comma-separated value.
     */
    private List<String> apiKeys = List.of("your-secret-api-key-here");

    public List<String> getApiKeys() {
        return apiKeys;
    }

    public void setApiKeys(List<String> apiKeys) {
        List<String> sanitized = new ArrayList<>();
        if (apiKeys != null) {
            for (String key : apiKeys) {
                if (key != null && !key.isBlank()) {
                    sanitized.add(key.trim());
                }
            }
        }
        this.apiKeys = List.copyOf(sanitized);
    }
}
