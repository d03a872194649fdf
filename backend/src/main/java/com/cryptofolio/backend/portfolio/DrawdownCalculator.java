package com.cryptofolio.backend.portfolio;

public final class DrawdownCalculator {

    private DrawdownCalculator() {
    }

    /**
     * Drawdown at each point relative to the running maximum: (value - peak) / peak.
     */
    public static double[] drawdowns(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Value series cannot be null or empty");
        }
        double[] drawdowns = new double[values.length];
        double peak = values[0];
        for (int i = 0; i < values.length; i++) {
            if (values[i] > peak) {
                peak = values[i];
            }
            drawdowns[i] = (values[i] - peak) / peak;
        }
        return drawdowns;
    }

    /**
     * Most negative drawdown of the series; 0 for a series that never falls below its peak.
     */
    public static double maxDrawdown(double[] values) {
        double maxDrawdown = 0.0;
        for (double drawdown : drawdowns(values)) {
            if (drawdown < maxDrawdown) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }
}
