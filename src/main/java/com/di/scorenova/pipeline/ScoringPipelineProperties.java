package com.di.scorenova.pipeline;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning for {@link ScoringPipeline}.
 *
 * <pre>
 * scorenova:
 *   pipeline:
 *     batch-size: 1000
 *     max-concurrency: 5
 *     retry-attempts: 3
 *     retry-base-delay-ms: 100
 *     sla-threshold-minutes: 30
 *     feature-length: 5
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "scorenova.pipeline")
public class ScoringPipelineProperties {

    /** Records per chunk. Chunks run one after another. */
    private int batchSize = 1000;

    /** Upper bound on records scored concurrently within a chunk. */
    private int maxConcurrency = 5;

    /** Total attempts per predictor call, first one included. */
    private int retryAttempts = 3;

    private long retryBaseDelayMs = 100;

    private double slaThresholdMinutes = 30;

    private int featureLength = 5;
}
