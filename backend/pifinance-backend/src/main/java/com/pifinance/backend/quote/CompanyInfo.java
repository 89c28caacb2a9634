package com.pifinance.backend.quote;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

@JsonInclude(Include.NON_NULL)
public record CompanyInfo(
        String symbol,
        String name,
        String sector,
        String industry,
        String website,
        String description,
        String country,
        Long employees,
        Double marketCap) {}
