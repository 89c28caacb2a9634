package com.pifinance.backend.quote;

import java.util.List;

public record QuoteBatch(List<BatchQuote> quotes, int count) {}
