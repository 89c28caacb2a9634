package com.pifinance.backend.cache;

import com.pifinance.backend.quote.PriceDataProvider;
import com.pifinance.backend.util.SystemTimeProvider;
import com.pifinance.backend.util.TimeProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PriceCacheProperties.class)
public class PriceCacheConfiguration {

    @Bean
    public PriceCache priceCache(
            PriceCacheProperties properties,
            PriceDataProvider priceDataProvider,
            ObjectProvider<TimeProvider> timeProvider) {
        return new PriceCache(properties, priceDataProvider, timeProvider.getIfAvailable(SystemTimeProvider::new));
    }
}
