package com.pifinance.backend.quote;

import java.util.List;

public record PriceHistory(String symbol, String period, String interval, List<HistoricalBar> data) {}
