package com.pifinance.backend.quote;

public record HistoryRequest(String symbol, String period, String interval) {}
