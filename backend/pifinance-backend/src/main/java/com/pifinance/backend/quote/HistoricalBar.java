package com.pifinance.backend.quote;

public record HistoricalBar(String date, Double open, Double high, Double low, Double close, Long volume) {}
