package com.di.scorenova.predictor;

/**
 * A scoring function that turns a {@link FeatureVector} into a failure probability.
 *
 * <p>Implementations must be safe to call from several scoring threads at once.
 * A failure that cannot succeed on retry (bad input, unusable model) must be
 * signalled with {@link PredictionException#permanent(String)}; any other
 * exception is treated as transient and retried by the pipeline.
 */
public interface Predictor {

    /** Unique name; used as the key in per-predictor score maps and stored records. */
    String getName();

    PredictorScore predict(FeatureVector features);
}
