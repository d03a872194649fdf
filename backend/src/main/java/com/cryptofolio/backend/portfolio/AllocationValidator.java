package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.DimensionMismatchException;
import com.cryptofolio.backend.exception.InvalidWeightsException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Rejects malformed target weights. Weights are never corrected here; {@link #equalWeights(int)}
 * is offered so a caller can propose a correction of its own.
 */
public class AllocationValidator {

    public static final double DEFAULT_TOLERANCE = 0.0001;

    private final double tolerance;

    public AllocationValidator() {
        this(DEFAULT_TOLERANCE);
    }

    public AllocationValidator(double tolerance) {
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a non-negative number: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public void validate(WeightVector weights) {
        if (weights == null || weights.size() == 0) {
            throw new InvalidWeightsException("At least one weight is required", 0.0, new double[0]);
        }
        double[] values = weights.toArray();
        double sum = weights.sum();
        for (int i = 0; i < values.length; i++) {
            if (!(values[i] >= 0.0 && values[i] <= 1.0)) {
                throw new InvalidWeightsException(
                        "Weight " + i + " must be within [0, 1], got " + values[i], sum, values);
            }
        }
        // compared in percentage points, like the allocation sliders
        double sumPct = sum * 100.0;
        double tolerancePct = tolerance * 100.0;
        if (sumPct < 100.0 - tolerancePct || sumPct > 100.0 + tolerancePct) {
            throw new InvalidWeightsException(
                    String.format(Locale.ROOT, "The sum of weights must equal 100%%. Current sum: %.2f%%", sumPct), sum, values);
        }
    }

    public void validate(WeightVector weights, int assetCount) {
        validate(weights);
        if (weights.size() != assetCount) {
            throw new DimensionMismatchException(assetCount, weights.size());
        }
    }

    public boolean isValid(WeightVector weights) {
        try {
            validate(weights);
            return true;
        } catch (InvalidWeightsException e) {
            return false;
        }
    }

    public static WeightVector equalWeights(int assetCount) {
        if (assetCount < 1) {
            throw new IllegalArgumentException("assetCount must be positive: " + assetCount);
        }
        double[] weights = new double[assetCount];
        Arrays.fill(weights, 1.0 / assetCount);
        return WeightVector.of(weights);
    }
}
