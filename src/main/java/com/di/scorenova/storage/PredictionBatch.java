package com.di.scorenova.storage;

import com.di.scorenova.pipeline.PredictionResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input to {@link LakeStorageConnector#storePredictions}.
 */
@Value
@Builder
public class PredictionBatch {

    public static final String DEFAULT_MODEL_VERSION = "1.0";

    List<PredictionResult> predictions;

    /** Generated when null. Re-using a batch id overwrites the same object. */
    String batchId;

    @Builder.Default
    String modelVersion = DEFAULT_MODEL_VERSION;

    String runId;
}
