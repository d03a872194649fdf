package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.InsufficientHistoryException;
import com.cryptofolio.backend.exception.InvalidPriceException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class ReturnCalculatorTest {

    private final ReturnCalculator calculator = new ReturnCalculator();

    @Test
    void logReturnsHaveOneRowFewerThanPrices() {
        AlignedPriceTable table = AlignedPriceTable.builder("bitcoin", "ethereum")
                .row(Instant.parse("2024-01-01T00:00:00Z"), 100.0, 10.0)
                .row(Instant.parse("2024-01-02T00:00:00Z"), 110.0, 10.0)
                .row(Instant.parse("2024-01-03T00:00:00Z"), 99.0, 12.0)
                .build();

        LogReturnTable returns = calculator.logReturns(table);

        assertThat(returns.size()).isEqualTo(2);
        assertThat(returns.timestamp(0)).isEqualTo(Instant.parse("2024-01-02T00:00:00Z"));
        assertThat(returns.get(0, 0)).isCloseTo(Math.log(1.1), offset(1e-12));
        assertThat(returns.get(0, 1)).isEqualTo(0.0);
        assertThat(returns.get(1, 0)).isCloseTo(Math.log(0.9), offset(1e-12));
        assertThat(returns.get(1, 1)).isCloseTo(Math.log(1.2), offset(1e-12));
    }

    @Test
    void singleRowIsInsufficientHistory() {
        AlignedPriceTable table = AlignedPriceTable.builder("bitcoin")
                .row(Instant.parse("2024-01-01T00:00:00Z"), 100.0)
                .build();

        assertThatThrownBy(() -> calculator.logReturns(table))
                .isInstanceOfSatisfying(InsufficientHistoryException.class, e -> {
                    assertThat(e.getAvailable()).isEqualTo(1);
                    assertThat(e.getRequired()).isEqualTo(2);
                });
    }

    @Test
    void zeroPriceIsReportedWithItsPosition() {
        Instant bad = Instant.parse("2024-01-02T00:00:00Z");
        AlignedPriceTable table = AlignedPriceTable.builder("bitcoin", "ethereum")
                .row(Instant.parse("2024-01-01T00:00:00Z"), 100.0, 10.0)
                .row(bad, 101.0, 0.0)
                .build();

        assertThatThrownBy(() -> calculator.logReturns(table))
                .isInstanceOfSatisfying(InvalidPriceException.class, e -> {
                    assertThat(e.getAssetId()).isEqualTo("ethereum");
                    assertThat(e.getTimestamp()).isEqualTo(bad);
                    assertThat(e.getErrorCode()).isEqualTo("INVALID_PRICE");
                });
    }

    @Test
    void cumulativeGrowthStartsAtOne() {
        AlignedPriceTable table = AlignedPriceTable.builder("bitcoin", "ethereum")
                .row(Instant.parse("2024-01-01T00:00:00Z"), 100.0, 10.0)
                .row(Instant.parse("2024-01-02T00:00:00Z"), 150.0, 5.0)
                .build();

        double[][] growth = calculator.cumulativeGrowth(table);

        assertThat(growth[0]).containsExactly(1.0, 1.0);
        assertThat(growth[1]).containsExactly(1.5, 0.5);
    }
}
