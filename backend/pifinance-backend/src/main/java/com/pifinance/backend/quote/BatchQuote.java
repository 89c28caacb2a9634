package com.pifinance.backend.quote;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

@JsonInclude(Include.NON_NULL)
public record BatchQuote(
        String symbol,
        Double price,
        String currency,
        Double change,
        Double changePercent,
        Long volume,
        String error) {

    static BatchQuote of(PriceSnapshot snapshot) {
        return new BatchQuote(
                snapshot.symbol(),
                snapshot.price(),
                snapshot.currency(),
                snapshot.change(),
                snapshot.changePercent(),
                snapshot.volume(),
                null);
    }

    static BatchQuote failed(String symbol, String error) {
        return new BatchQuote(symbol, null, null, null, null, null, error);
    }
}
