package com.cryptofolio.backend.portfolio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class DrawdownCalculatorTest {

    @Test
    void maxDrawdownIsMeasuredFromTheRunningPeak() {
        double[] values = {1.0, 1.2, 0.9, 1.3, 1.0};

        assertThat(DrawdownCalculator.maxDrawdown(values)).isCloseTo(-0.25, offset(1e-12));
        assertThat(DrawdownCalculator.drawdowns(values)[3]).isEqualTo(0.0);
    }

    @Test
    void risingSeriesHasNoDrawdown() {
        assertThat(DrawdownCalculator.maxDrawdown(new double[]{1.0, 1.1, 1.2})).isEqualTo(0.0);
    }

    @Test
    void emptySeriesIsRejected() {
        assertThatThrownBy(() -> DrawdownCalculator.drawdowns(new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
