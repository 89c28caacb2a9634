package com.pifinance.backend.quote;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(YahooFinanceProperties.class)
public class YahooFinanceConfiguration {

    @Bean
    public YahooFinanceClient yahooFinanceClient(
            RestClient.Builder restClientBuilder, ObjectMapper objectMapper, YahooFinanceProperties properties) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(properties.getTimeout())
                .withReadTimeout(properties.getTimeout());
        RestClient.Builder builder = restClientBuilder
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return new YahooFinanceClient(builder.build(), objectMapper);
    }
}
