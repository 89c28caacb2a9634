package com.pifinance.backend.quote;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

@JsonInclude(Include.NON_NULL)
public record DividendHistory(String symbol, List<Dividend> dividends, String message) {}
