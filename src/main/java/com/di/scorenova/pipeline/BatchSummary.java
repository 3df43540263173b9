package com.di.scorenova.pipeline;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchSummary {

    int totalRecords;
    int successfulPredictions;
    int failedPredictions;

    /** Always at least 1. */
    long processingTimeMs;

    /** {@code successfulPredictions / totalRecords}. */
    double successRate;

    boolean slaCompliant;
    List<String> predictorsUsed;
    int chunkCount;
    boolean cancelled;
}
