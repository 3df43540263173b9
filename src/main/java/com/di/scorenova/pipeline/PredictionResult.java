package com.di.scorenova.pipeline;

import com.di.scorenova.predictor.FeatureVector;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Ensemble output for one scored record.
 */
@Value
@Builder
public class PredictionResult {

    String recordId;
    Instant timestamp;
    FeatureVector featureVector;

    /** Predictor name to score, in registration order. */
    Map<String, Double> perPredictorScores;

    /** Arithmetic mean of {@link #perPredictorScores}. */
    double ensembleScore;

    /** {@code max(0, 1 - stddev)} of the per-predictor scores; 1.0 for a single predictor. */
    double confidence;
}
