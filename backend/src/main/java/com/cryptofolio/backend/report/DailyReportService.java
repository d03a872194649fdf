package com.cryptofolio.backend.report;

import com.cryptofolio.backend.config.AnalyticsProperties;
import com.cryptofolio.backend.config.ReportProperties;
import com.cryptofolio.backend.exception.MarketDataException;
import com.cryptofolio.backend.exception.PortfolioAnalyticsException;
import com.cryptofolio.backend.marketdata.MarketDataProvider;
import com.cryptofolio.backend.marketdata.SpotQuote;
import com.cryptofolio.backend.portfolio.AlignedPriceTable;
import com.cryptofolio.backend.portfolio.MetricsResult;
import com.cryptofolio.backend.portfolio.SimulationResult;
import com.cryptofolio.backend.portfolio.WeightVector;
import com.cryptofolio.backend.service.PortfolioAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Writes the plain-text portfolio report for the configured reference allocation. One file per
 * calendar day; a second run on the same day overwrites it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyReportService {

    private static final String RULE = "----------------------------------------------------";
    private static final String BANNER = "====================================================";
    private static final DateTimeFormatter HEADER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final MarketDataProvider marketDataProvider;
    private final PortfolioAnalysisService portfolioAnalysisService;
    private final ReportProperties reportProperties;
    private final AnalyticsProperties analyticsProperties;
    private final Clock clock;

    public Path generate() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneId.of(analyticsProperties.getZone())));
        Path reportPath = reportPath(now.toLocalDate());
        try {
            Files.createDirectories(reportPath.getParent());
            try (BufferedWriter buffered = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8);
                 PrintWriter out = new PrintWriter(buffered)) {
                out.println(BANNER);
                out.println("PORTFOLIO REPORT - " + now.format(HEADER_TIME));
                out.println(BANNER);
                out.println();
                writeAssetSection(out);
                writePortfolioSection(out);
                out.println();
                out.print("[End of Portfolio Report]");
                if (out.checkError()) {
                    throw new IOException("Failed writing " + reportPath);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write report " + reportPath, e);
        }
        log.info("Portfolio report written path={}", reportPath);
        return reportPath;
    }

    Path reportPath(LocalDate date) {
        return Path.of(reportProperties.getDirectory()).resolve("portfolio_report_" + date + ".txt");
    }

    private void writeAssetSection(PrintWriter out) {
        out.println("SECTION 1: INDIVIDUAL ASSETS");
        out.println(RULE);
        for (String assetId : reportProperties.getAssets()) {
            out.println("Asset: " + assetId.toUpperCase(Locale.ROOT));
            Optional<SpotQuote> quote = quote(assetId);
            if (quote.isPresent()) {
                out.println(String.format(Locale.ROOT, " - Price: $%,.2f (%+.2f%%)",
                        quote.get().price(), quote.get().change24hPct()));
            } else {
                out.println(" - Price: unavailable");
            }
            out.println();
        }
    }

    private Optional<SpotQuote> quote(String assetId) {
        try {
            return marketDataProvider.fetchSpotQuote(assetId);
        } catch (MarketDataException e) {
            log.warn("Spot quote unavailable assetId={} reason={}", assetId, e.getMessage());
            return Optional.empty();
        }
    }

    private void writePortfolioSection(PrintWriter out) {
        out.println("SECTION 2: PORTFOLIO PERFORMANCE");
        out.println(RULE);
        List<String> assets = reportProperties.getAssets();
        WeightVector weights = WeightVector.of(reportProperties.getWeights());
        try {
            AlignedPriceTable prices = marketDataProvider.fetchAlignedSeries(assets, reportProperties.getLookbackDays());
            MetricsResult metrics = portfolioAnalysisService
                    .computeMetrics(prices, weights, analyticsProperties.getDefaultRiskFreeRate())
                    .metrics();
            SimulationResult simulation = portfolioAnalysisService.simulate(prices, weights, reportProperties.getFrequency());

            out.println("Strategy: " + reportProperties.getFrequency().name() + " rebalancing");
            out.println(String.format(Locale.ROOT, " - Annualized Return: %.2f%%", metrics.annualizedReturnPct()));
            out.println(String.format(Locale.ROOT, " - Portfolio Volatility: %.2f%%", metrics.annualizedVolatilityPct()));
            out.println(String.format(Locale.ROOT, " - Sharpe Ratio: %.2f", metrics.sharpeRatio()));
            out.println(String.format(Locale.ROOT, " - Max Drawdown: %.2f%%", metrics.maxDrawdown() * 100.0));
            out.println();
            out.println("LATEST QUANTITY ADJUSTMENTS:");
            int last = simulation.size() - 1;
            for (int asset = 0; asset < simulation.assetIds().size(); asset++) {
                out.println(String.format(Locale.ROOT, " - %s: %.4f units (%+.2f%% total drift)",
                        simulation.assetIds().get(asset).toUpperCase(Locale.ROOT),
                        simulation.quantity(last, asset),
                        simulation.quantityDriftPct(asset)));
            }
        } catch (PortfolioAnalyticsException | MarketDataException e) {
            log.warn("Portfolio section skipped assets={} reason={}", assets, e.getMessage());
            out.println("Portfolio analysis unavailable: " + e.getMessage());
        }
    }
}
