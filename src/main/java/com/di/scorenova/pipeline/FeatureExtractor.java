package com.di.scorenova.pipeline;

import com.di.scorenova.predictor.FeatureVector;

import java.util.List;

/**
 * Maps an {@link InputRecord} to a fixed-length {@link FeatureVector}.
 *
 * <p>Feature order is {@link #FEATURE_ORDER}. A missing field contributes 0.0 at
 * its position; the vector is zero-padded or truncated to {@code length}. Never
 * fails.
 */
public class FeatureExtractor {

    public static final List<String> FEATURE_ORDER =
            List.of("temperature", "vibration", "pressure", "rpm", "current");

    private final int length;

    public FeatureExtractor(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Feature length must be >= 1, got " + length);
        }
        this.length = length;
    }

    public int getLength() {
        return length;
    }

    public FeatureVector extract(InputRecord record) {
        double[] values = new double[length];
        if (record == null || record.getFields() == null) {
            return FeatureVector.of(values);
        }
        int n = Math.min(length, FEATURE_ORDER.size());
        for (int i = 0; i < n; i++) {
            Double v = record.getFields().get(FEATURE_ORDER.get(i));
            values[i] = v != null ? v : 0.0;
        }
        return FeatureVector.of(values);
    }
}
