package com.pifinance.backend.system;

import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pifinance.backend.quote.MarketDataProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
    "pifinance.security.api-keys=test-key",
    "pifinance.cors.allowed-origins=https://dashboard.example.com",
    "pifinance.cache.enabled=false"
})
@AutoConfigureMockMvc
class ServiceInfoControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MarketDataProvider marketDataProvider;

    @Test
    void shouldDescribeServiceWithoutApiKey() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name", is("Pi Finance API")))
                .andExpect(jsonPath("$.status", is("running")))
                .andExpect(jsonPath("$.authentication", is("Required - Use X-API-Key header")));
    }

    @Test
    void shouldReportHealthWithoutApiKey() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("healthy")))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void shouldAnswerCorsPreflightWithoutApiKey() throws Exception {
        mockMvc.perform(options("/quote/AAPL")
                        .header("Origin", "https://dashboard.example.com")
                        .header("Access-Control-Request-Method", "GET")
                        .header("Access-Control-Request-Headers", "X-API-Key"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "https://dashboard.example.com"))
                .andExpect(header().string("Access-Control-Allow-Credentials", "true"));
    }

    @Test
    void shouldRejectPreflightFromUnknownOrigin() throws Exception {
        mockMvc.perform(options("/quote/AAPL")
                        .header("Origin", "https://evil.example.org")
                        .header("Access-Control-Request-Method", "GET"))
                .andExpect(status().isForbidden());
    }
}
