package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.DimensionMismatchException;
import com.cryptofolio.backend.exception.InvalidPriceException;
import com.cryptofolio.backend.exception.InvalidWeightsException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class RebalancingSimulatorTest {

    private static final Instant DAY0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final WeightVector TARGET = WeightVector.of(0.5, 0.3, 0.2);

    private final RebalancingSimulator simulator = new RebalancingSimulator();

    @Test
    void portfolioStartsAtExactlyOne() {
        SimulationResult result = simulator.simulate(doublingFirstAsset(30), TARGET, RebalancingFrequency.WEEKLY);

        assertThat(result.value(0)).isEqualTo(1.0);
        assertThat(result.allocationAt(0)).containsExactly(new double[]{0.5, 0.3, 0.2}, offset(1e-12));
    }

    @Test
    void buyAndHoldKeepsQuantitiesConstant() {
        SimulationResult result = simulator.simulate(doublingFirstAsset(30), TARGET, RebalancingFrequency.NONE);

        for (int row = 1; row < result.size(); row++) {
            assertThat(result.quantitiesAt(row)).containsExactly(result.quantitiesAt(0));
        }
        assertThat(result.rebalanceTimestamps()).isEmpty();
        assertThat(result.finalValue()).isCloseTo(1.5, offset(1e-12));
        assertThat(result.quantityDriftPct(0)).isEqualTo(0.0);
    }

    @Test
    void weeklyRebalancingRestoresTargetsAndSellsTheWinner() {
        AlignedPriceTable prices = doublingFirstAsset(30);

        SimulationResult result = simulator.simulate(prices, TARGET, RebalancingFrequency.WEEKLY);

        assertThat(result.rebalanceTimestamps()).containsExactly(day(7), day(14), day(21), day(28));
        for (int row : new int[]{7, 14, 21, 28}) {
            assertThat(result.allocationAt(row)).containsExactly(new double[]{0.5, 0.3, 0.2}, offset(1e-6));
            assertThat(result.quantity(row, 0)).isLessThan(result.quantity(row - 1, 0));
            assertThat(result.quantity(row, 1)).isGreaterThan(result.quantity(row - 1, 1));
            assertThat(result.quantity(row, 2)).isGreaterThan(result.quantity(row - 1, 2));
        }
        for (int row = 1; row < result.size(); row++) {
            assertThat(result.value(row)).isGreaterThan(1.0);
        }
        assertThat(result.finalValue()).isGreaterThan(1.0).isLessThan(1.5);
        assertThat(result.quantityDriftPct(0)).isNegative();
        assertThat(result.quantityDriftPct(1)).isPositive();
        assertThat(result.maxDrawdown()).isEqualTo(0.0);
    }

    @Test
    void rebalancingDoesNotChangeValueAtTheBoundary() {
        AlignedPriceTable prices = doublingFirstAsset(30);

        SimulationResult result = simulator.simulate(prices, TARGET, RebalancingFrequency.WEEKLY);

        double marked = 0.0;
        for (int asset = 0; asset < 3; asset++) {
            marked += result.quantity(6, asset) * prices.price(7, asset);
        }
        assertThat(result.value(7)).isCloseTo(marked, offset(1e-12));
    }

    @Test
    void dailyRebalancesEveryStep() {
        SimulationResult result = simulator.simulate(doublingFirstAsset(10), TARGET, RebalancingFrequency.DAILY);

        assertThat(result.rebalanceTimestamps()).hasSize(9);
    }

    @Test
    void singleTimestampHoldsInitialCapital() {
        AlignedPriceTable prices = AlignedPriceTable.builder("a", "b", "c").row(DAY0, 100, 50, 20).build();

        SimulationResult result = simulator.simulate(prices, TARGET, RebalancingFrequency.DAILY);

        assertThat(result.values()).containsExactly(1.0);
        assertThat(result.totalReturnPct()).isEqualTo(0.0);
    }

    @Test
    void nonPositivePriceStopsTheSimulation() {
        AlignedPriceTable prices = AlignedPriceTable.builder("a", "b", "c")
                .row(day(0), 100, 50, 20)
                .row(day(1), 100, -1, 20)
                .build();

        assertThatThrownBy(() -> simulator.simulate(prices, TARGET, RebalancingFrequency.NONE))
                .isInstanceOf(InvalidPriceException.class);
    }

    @Test
    void weightsAreValidatedAgainstTheTable() {
        AlignedPriceTable prices = doublingFirstAsset(5);

        assertThatThrownBy(() -> simulator.simulate(prices, WeightVector.of(0.5, 0.6, 0.1), RebalancingFrequency.NONE))
                .isInstanceOf(InvalidWeightsException.class);
        assertThatThrownBy(() -> simulator.simulate(prices, WeightVector.of(0.5, 0.5), RebalancingFrequency.NONE))
                .isInstanceOf(DimensionMismatchException.class);
    }

    /**
     * Asset "a" rises linearly from 100 to 200; "b" and "c" stay flat.
     */
    private static AlignedPriceTable doublingFirstAsset(int days) {
        AlignedPriceTable.Builder builder = AlignedPriceTable.builder("a", "b", "c");
        for (int i = 0; i < days; i++) {
            double first = days == 1 ? 100.0 : 100.0 + 100.0 * i / (days - 1);
            builder.row(day(i), first, 50.0, 20.0);
        }
        return builder.build();
    }

    private static Instant day(int offset) {
        return DAY0.plus(offset, ChronoUnit.DAYS);
    }
}
