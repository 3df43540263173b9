package com.di.scorenova.predictor;

import java.util.Arrays;

/**
 * Fixed-length, ordered numeric input handed to every {@link Predictor}.
 *
 * <p>Immutable: the backing array is copied on construction and on every read.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(double... values) {
        if (values == null) {
            throw new IllegalArgumentException("Feature values must not be null");
        }
        return new FeatureVector(values.clone());
    }

    public int length() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
