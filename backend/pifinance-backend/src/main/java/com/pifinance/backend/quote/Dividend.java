package com.pifinance.backend.quote;

public record Dividend(String date, double amount) {}
