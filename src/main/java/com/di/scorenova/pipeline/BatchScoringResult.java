package com.di.scorenova.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything one {@link ScoringPipeline#processBatch} call produced.
 * {@code predictions.size() + errors.size()} always equals the input size.
 */
@Value
@Builder
public class BatchScoringResult {

    List<PredictionResult> predictions;
    List<ScoringError> errors;
    BatchSummary summary;
    Instant processedAt;
}
