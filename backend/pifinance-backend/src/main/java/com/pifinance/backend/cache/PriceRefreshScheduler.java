package com.pifinance.backend.cache;

import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs one {@link PriceCache#refreshAll()} pass per refresh interval, starting one interval after
 * startup. Only registered when the cache is enabled.
 *
 * <p>A failed pass is logged and the next one still runs after the same fixed delay; there is no
 * backoff.
 */
@Component
@ConditionalOnProperty(prefix = "pifinance.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PriceRefreshScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PriceRefreshScheduler.class);

    private final PriceCache priceCache;

    public PriceRefreshScheduler(PriceCache priceCache) {
        this.priceCache = priceCache;
    }

    @Scheduled(
            initialDelayString = "${pifinance.cache.refresh-interval-minutes:30}",
            fixedDelayString = "${pifinance.cache.refresh-interval-minutes:30}",
            timeUnit = TimeUnit.MINUTES)
    public void refresh() {
        try {
            priceCache.refreshAll();
        } catch (RuntimeException ex) {
            LOGGER.error("Cache refresh pass failed", ex);
        }
    }
}
