package com.cryptofolio.backend.controller;

import com.cryptofolio.backend.marketdata.MarketDataProvider;
import com.cryptofolio.backend.marketdata.SpotQuote;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
public class MarketDataController {

    private final MarketDataProvider marketDataProvider;

    @GetMapping("/quotes/{assetId}")
    public ResponseEntity<SpotQuote> quote(@PathVariable String assetId) {
        return marketDataProvider.fetchSpotQuote(assetId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
