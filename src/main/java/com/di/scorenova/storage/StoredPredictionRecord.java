package com.di.scorenova.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Flat, JSON-serialisable shape of one prediction as stored on the lake.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredPredictionRecord {

    private String              equipmentId;
    private Instant             timestamp;
    private double              failureProbability;
    private double              confidence;
    private List<Double>        features;

    /** Predictor name to score. */
    private Map<String, Double> modelPredictions;

    private Metadata            metadata;

    /* ---------------------------------------------------------------------- */

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {

        private String  batchId;
        private String  modelVersion;

        /** When the batch was written. */
        private Instant processingTime;

        /** Orchestrator run that produced the batch; null for direct writes. */
        private String  runId;
    }
}
