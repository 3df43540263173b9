package com.di.scorenova.predictor;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Logistic model over a weighted sum of the features:
 * {@code score = 1 / (1 + e^-(bias + Σ wᵢ·xᵢ))}.
 *
 * <p>Reports a confidence equal to the distance of the score from the 0.5
 * decision boundary, scaled to {@code [0,1]}. Extra features beyond the weight
 * vector are ignored; missing ones contribute nothing.
 */
@Slf4j
public class LinearRiskPredictor implements Predictor {

    private final String   name;
    private final double[] weights;
    private final double   bias;

    public LinearRiskPredictor(String name, double[] weights, double bias) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Predictor name must not be blank");
        }
        if (weights == null || weights.length == 0) {
            throw new IllegalArgumentException("Predictor '" + name + "' needs at least one weight");
        }
        this.name    = name;
        this.weights = weights.clone();
        this.bias    = bias;
        log.debug("[PREDICTOR] {} weights={} bias={}", name, Arrays.toString(weights), bias);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public PredictorScore predict(FeatureVector features) {
        if (features == null) {
            throw PredictionException.permanent(name + ": feature vector is null");
        }
        double z = bias;
        int n = Math.min(weights.length, features.length());
        for (int i = 0; i < n; i++) {
            double x = features.get(i);
            if (!Double.isFinite(x)) {
                throw PredictionException.permanent(name + ": feature " + i + " is not finite (" + x + ")");
            }
            z += weights[i] * x;
        }
        double score = 1.0 / (1.0 + Math.exp(-z));
        return PredictorScore.of(score, Math.abs(score - 0.5) * 2.0);
    }
}
