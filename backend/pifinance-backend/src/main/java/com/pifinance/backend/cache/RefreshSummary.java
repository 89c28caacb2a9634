package com.pifinance.backend.cache;

public record RefreshSummary(int requested, int refreshed, int failed) {

    public static RefreshSummary empty() {
        return new RefreshSummary(0, 0, 0);
    }
}
