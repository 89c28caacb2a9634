package com.pifinance.backend.cache;

import com.pifinance.backend.quote.QuoteNotFoundException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/cache")
public class CacheController {

    private final PriceCache priceCache;

    public CacheController(PriceCache priceCache) {
        this.priceCache = priceCache;
    }

    @GetMapping("/stats")
    public CacheStats getStats() {
        return priceCache.getStats();
    }

    @GetMapping("/symbols/{symbol}")
    public SymbolCacheInfo getSymbolInfo(@PathVariable("symbol") String symbol) {
        String key = PriceCache.normalizeSymbol(symbol);
        return priceCache.getSymbolInfo(key)
                .orElseThrow(() -> new QuoteNotFoundException("Symbol not cached: " + key));
    }

    @DeleteMapping("/symbols/{symbol}")
    public Map<String, Object> removeSymbol(@PathVariable("symbol") String symbol) {
        String key = PriceCache.normalizeSymbol(symbol);
        if (!priceCache.removeSymbol(key)) {
            throw new QuoteNotFoundException("Symbol not cached: " + key);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", key);
        body.put("removed", true);
        return body;
    }

    @DeleteMapping
    public Map<String, Integer> clear() {
        return Map.of("cleared", priceCache.clear());
    }

    @PostMapping("/refresh")
    public RefreshSummary refresh() {
        return priceCache.refreshAll();
    }
}
