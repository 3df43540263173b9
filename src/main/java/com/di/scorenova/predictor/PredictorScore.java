package com.di.scorenova.predictor;

import lombok.Value;

/**
 * What a predictor returns for one feature vector: a score in {@code [0,1]} and,
 * for predictors that report it, their own confidence.
 */
@Value
public class PredictorScore {

    double score;

    /** Null when the predictor does not report a confidence. */
    Double confidence;

    public static PredictorScore of(double score) {
        return new PredictorScore(score, null);
    }

    public static PredictorScore of(double score, double confidence) {
        return new PredictorScore(score, confidence);
    }
}
