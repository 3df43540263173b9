package com.di.scorenova.predictor;

/**
 * Each feature votes "at risk" when it exceeds its threshold; the score is the
 * fraction of at-risk votes. Features without a threshold do not vote.
 */
public class ThresholdVotePredictor implements Predictor {

    private final String   name;
    private final double[] thresholds;

    public ThresholdVotePredictor(String name, double[] thresholds) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Predictor name must not be blank");
        }
        if (thresholds == null || thresholds.length == 0) {
            throw new IllegalArgumentException("Predictor '" + name + "' needs at least one threshold");
        }
        this.name       = name;
        this.thresholds = thresholds.clone();
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
        int voters = Math.min(thresholds.length, features.length());
        if (voters == 0) {
            throw PredictionException.permanent(name + ": empty feature vector");
        }
        int atRisk = 0;
        for (int i = 0; i < voters; i++) {
            double x = features.get(i);
            if (Double.isNaN(x)) {
                throw PredictionException.permanent(name + ": feature " + i + " is NaN");
            }
            if (x > thresholds[i]) {
                atRisk++;
            }
        }
        return PredictorScore.of((double) atRisk / voters);
    }
}
