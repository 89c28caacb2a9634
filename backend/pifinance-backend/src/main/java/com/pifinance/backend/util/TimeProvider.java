package com.pifinance.backend.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Source of the current time and of blocking pauses, so that TTL windows and refresh pacing can be
 * exercised in tests without waiting on the wall clock.
 */
public interface TimeProvider {

    Instant now();

    /**
     * Blocks the calling thread for the given duration.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
