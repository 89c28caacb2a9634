package com.pifinance.backend.cache;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pifinance.cache")
public class PriceCacheProperties {

    private boolean enabled = true;

    /**
     * Days a symbol stays cached, and keeps being refreshed, after its last client request.
     */
    private int ttlDays = 7;

    /**
     * Minutes between two background refresh passes.
     */
    private int refreshIntervalMinutes = 30;

    /**
     * Pause between two consecutive fetches inside one refresh pass.
     */
    private Duration refreshDelay = Duration.ofMillis(500);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getTtlDays() {
        return ttlDays;
    }

    public void setTtlDays(int ttlDays) {
        this.ttlDays = ttlDays;
    }

    public int getRefreshIntervalMinutes() {
        return refreshIntervalMinutes;
    }

    public void setRefreshIntervalMinutes(int refreshIntervalMinutes) {
        this.refreshIntervalMinutes = refreshIntervalMinutes;
    }

    public Duration getRefreshDelay() {
        return refreshDelay;
    }

    public void setRefreshDelay(Duration refreshDelay) {
        if (refreshDelay != null) {
            this.refreshDelay = refreshDelay;
        }
    }
}
