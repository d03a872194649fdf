package com.cryptofolio.backend.controller;

import com.cryptofolio.backend.marketdata.MarketDataProvider;
import com.cryptofolio.backend.marketdata.SpotQuote;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MarketDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MarketDataProvider marketDataProvider;

    @Test
    void returnsSpotQuote() throws Exception {
        when(marketDataProvider.fetchSpotQuote("bitcoin"))
                .thenReturn(Optional.of(new SpotQuote("bitcoin", 42000.5, 1.25, Instant.parse("2024-03-05T20:00:00Z"))));

        mockMvc.perform(get("/api/market/quotes/bitcoin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price").value(42000.5))
                .andExpect(jsonPath("$.change24hPct").value(1.25));
    }

    @Test
    void unknownAssetIsNotFound() throws Exception {
        when(marketDataProvider.fetchSpotQuote("not-a-coin")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/market/quotes/not-a-coin"))
                .andExpect(status().isNotFound());
    }
}
