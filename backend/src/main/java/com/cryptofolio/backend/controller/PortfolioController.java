package com.cryptofolio.backend.controller;

import com.cryptofolio.backend.dto.AnalysisResponse;
import com.cryptofolio.backend.dto.AssetOption;
import com.cryptofolio.backend.dto.MetricsResponse;
import com.cryptofolio.backend.dto.PortfolioRequest;
import com.cryptofolio.backend.dto.SimulationResponse;
import com.cryptofolio.backend.marketdata.MarketDataProvider;
import com.cryptofolio.backend.portfolio.AlignedPriceTable;
import com.cryptofolio.backend.portfolio.AllocationValidator;
import com.cryptofolio.backend.service.PortfolioAnalysisService;
import com.cryptofolio.backend.service.PortfolioAnalysisService.MetricsReport;
import com.cryptofolio.backend.service.PortfolioAnalysisService.PortfolioAnalysis;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Validated
@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
public class PortfolioController {

    private final PortfolioAnalysisService portfolioAnalysisService;
    private final MarketDataProvider marketDataProvider;

    @GetMapping("/assets")
    public List<AssetOption> assets() {
        return marketDataProvider.supportedAssets().entrySet().stream()
                .map(entry -> new AssetOption(entry.getKey(), entry.getValue()))
                .toList();
    }

    @PostMapping("/metrics")
    public MetricsResponse metrics(@Valid @RequestBody PortfolioRequest request) {
        MetricsReport report = portfolioAnalysisService.computeMetrics(request);
        return MetricsResponse.from(report.prices(), report.metrics(), report.assets());
    }

    @PostMapping("/simulate")
    public SimulationResponse simulate(@Valid @RequestBody PortfolioRequest request) {
        return SimulationResponse.from(portfolioAnalysisService.simulate(request));
    }

    @PostMapping("/analysis")
    public AnalysisResponse analysis(@Valid @RequestBody PortfolioRequest request) {
        PortfolioAnalysis analysis = portfolioAnalysisService.analyze(request);
        MetricsReport report = analysis.metrics();
        return new AnalysisResponse(
                MetricsResponse.from(report.prices(), report.metrics(), report.assets()),
                SimulationResponse.from(analysis.simulation()),
                growthPoints(report.prices(), analysis.individualGrowth())
        );
    }

    @GetMapping("/equal-weights")
    public List<Double> equalWeights(@RequestParam @Min(1) int count) {
        return AllocationValidator.equalWeights(count).asList();
    }

    private List<AnalysisResponse.GrowthPoint> growthPoints(AlignedPriceTable prices, double[][] growth) {
        List<AnalysisResponse.GrowthPoint> points = new ArrayList<>(growth.length);
        for (int row = 0; row < growth.length; row++) {
            Map<String, Double> byAsset = new LinkedHashMap<>();
            for (int asset = 0; asset < prices.assetCount(); asset++) {
                byAsset.put(prices.assetIds().get(asset), growth[row][asset]);
            }
            points.add(new AnalysisResponse.GrowthPoint(prices.timestamp(row), byAsset));
        }
        return points;
    }
}
