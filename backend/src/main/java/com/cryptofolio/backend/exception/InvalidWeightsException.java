package com.cryptofolio.backend.exception;

import java.util.Arrays;

public class InvalidWeightsException extends PortfolioAnalyticsException {

    private final double actualSum;
    private final double[] weights;

    public InvalidWeightsException(String message, double actualSum, double[] weights) {
        super("INVALID_WEIGHTS", message);
        this.actualSum = actualSum;
        this.weights = weights == null ? new double[0] : weights.clone();
    }

    public double getActualSum() {
        return actualSum;
    }

    public double[] getWeights() {
        return weights.clone();
    }

    @Override
    public String toString() {
        return super.toString() + " weights=" + Arrays.toString(weights);
    }
}
