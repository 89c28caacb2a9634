package com.pifinance.backend.quote;

public class QuoteValidationException extends RuntimeException {

    public QuoteValidationException(String message) {
        super(message);
    }
}
