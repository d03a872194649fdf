package com.cryptofolio.backend.portfolio;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Target allocation, one fraction per asset in table column order. Construction does not
 * validate; {@link AllocationValidator} decides whether a vector is usable.
 */
public final class WeightVector {

    private final double[] weights;

    private WeightVector(double[] weights) {
        this.weights = weights;
    }

    public static WeightVector of(double... weights) {
        Objects.requireNonNull(weights, "weights");
        return new WeightVector(weights.clone());
    }

    public static WeightVector of(List<Double> weights) {
        Objects.requireNonNull(weights, "weights");
        double[] values = new double[weights.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = weights.get(i);
            values[i] = value == null ? Double.NaN : value;
        }
        return new WeightVector(values);
    }

    public int size() {
        return weights.length;
    }

    public double get(int index) {
        return weights[index];
    }

    public double sum() {
        double sum = 0.0;
        for (double weight : weights) {
            sum += weight;
        }
        return sum;
    }

    public double[] toArray() {
        return weights.clone();
    }

    public List<Double> asList() {
        return Arrays.stream(weights).boxed().toList();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof WeightVector other && Arrays.equals(weights, other.weights));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return Arrays.toString(weights);
    }
}
