package com.pifinance.backend.quote;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class QuoteController {

    private final QuoteService quoteService;

    public QuoteController(QuoteService quoteService) {
        this.quoteService = quoteService;
    }

    @GetMapping("/quote/{symbol}")
    public PriceSnapshot getQuote(@PathVariable("symbol") String symbol) {
        return quoteService.getQuote(symbol);
    }

    @GetMapping("/quotes")
    public QuoteBatch getQuotes(@RequestParam(name = "symbols", required = false) String symbols) {
        return quoteService.getQuotes(symbols);
    }

    @GetMapping("/info/{symbol}")
    public CompanyInfo getCompanyInfo(@PathVariable("symbol") String symbol) {
        return quoteService.getCompanyInfo(symbol);
    }

    @PostMapping("/history")
    public PriceHistory getHistory(@RequestBody HistoryRequest request) {
        return quoteService.getHistory(request);
    }

    @GetMapping("/dividends/{symbol}")
    public DividendHistory getDividends(@PathVariable("symbol") String symbol) {
        return quoteService.getDividends(symbol);
    }
}
