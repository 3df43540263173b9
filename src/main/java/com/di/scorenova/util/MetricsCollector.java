package com.di.scorenova.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for batch scoring, scheduled executions, lake writes and alerts.
 * Every component takes it as an optional collaborator; tests pass one built on a
 * {@code SimpleMeterRegistry}.
 */
@Slf4j
@Component
public class MetricsCollector {

    // Scoring
    private final Counter batchCounter;
    private final Timer batchTimer;
    private final DistributionSummary batchSizeDistribution;
    private final Counter recordsScoredCounter;
    private final Counter recordsFailedCounter;
    private final Counter predictorRetryCounter;
    private final Counter slaBreachCounter;

    // Lake storage
    private final Counter lakeWriteCounter;
    private final Counter lakeWriteErrorCounter;
    private final DistributionSummary lakeBytesDistribution;

    // Scheduler
    private final Counter scheduledRunCounter;
    private final Counter scheduledRunErrorCounter;
    private final Counter scheduledSkipCounter;

    // Monitor
    private final Counter alertCounter;

    private final MeterRegistry meterRegistry;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.batchCounter = Counter.builder("scoring.batch.total")
                .description("Total number of scored batches")
                .register(meterRegistry);

        this.batchTimer = Timer.builder("scoring.batch.duration")
                .description("Wall-clock time to score one batch")
                .register(meterRegistry);

        this.batchSizeDistribution = DistributionSummary.builder("scoring.batch.size")
                .description("Distribution of batch sizes")
                .baseUnit("records")
                .register(meterRegistry);

        this.recordsScoredCounter = Counter.builder("scoring.records.total")
                .description("Records scored successfully")
                .tag("status", "success")
                .register(meterRegistry);

        this.recordsFailedCounter = Counter.builder("scoring.records.total")
                .description("Records that failed scoring")
                .tag("status", "error")
                .register(meterRegistry);

        this.predictorRetryCounter = Counter.builder("scoring.predictor.retries")
                .description("Predictor calls that were retried")
                .register(meterRegistry);

        this.slaBreachCounter = Counter.builder("scoring.sla.breaches")
                .description("Batches that exceeded the SLA threshold")
                .register(meterRegistry);

        this.lakeWriteCounter = Counter.builder("lake.write.total")
                .description("Prediction batches written to the lake")
                .tag("status", "success")
                .register(meterRegistry);

        this.lakeWriteErrorCounter = Counter.builder("lake.write.total")
                .description("Failed prediction batch writes")
                .tag("status", "error")
                .register(meterRegistry);

        this.lakeBytesDistribution = DistributionSummary.builder("lake.write.bytes")
                .description("Bytes written per lake object")
                .baseUnit("bytes")
                .register(meterRegistry);

        this.scheduledRunCounter = Counter.builder("scheduler.execution.total")
                .description("Scheduled job executions")
                .tag("status", "success")
                .register(meterRegistry);

        this.scheduledRunErrorCounter = Counter.builder("scheduler.execution.total")
                .description("Scheduled job executions that failed after all retries")
                .tag("status", "error")
                .register(meterRegistry);

        this.scheduledSkipCounter = Counter.builder("scheduler.execution.skipped")
                .description("Due fires skipped because the previous run was still in flight")
                .register(meterRegistry);

        this.alertCounter = Counter.builder("monitor.alerts.total")
                .description("Alerts raised by the run monitor")
                .register(meterRegistry);
    }

    // ============================================================================
    // Scoring
    // ============================================================================

    /**
     * Records a finished batch.
     *
     * @param totalRecords records in the batch
     * @param succeeded    records with a prediction
     * @param failed       records with an error
     * @param durationMs   wall-clock duration
     * @param slaCompliant whether the batch met its SLA
     */
    public void recordBatch(int totalRecords, int succeeded, int failed, long durationMs, boolean slaCompliant) {
        batchCounter.increment();
        batchTimer.record(durationMs, TimeUnit.MILLISECONDS);
        batchSizeDistribution.record(totalRecords);
        recordsScoredCounter.increment(succeeded);
        recordsFailedCounter.increment(failed);
        if (!slaCompliant) {
            slaBreachCounter.increment();
        }
        log.debug("Recorded batch: total={}, succeeded={}, failed={}, durationMs={}", totalRecords, succeeded, failed, durationMs);
    }

    public void recordPredictorRetry() {
        predictorRetryCounter.increment();
    }

    // ============================================================================
    // Lake storage
    // ============================================================================

    public void recordLakeWrite(long bytes) {
        lakeWriteCounter.increment();
        lakeBytesDistribution.record(bytes);
    }

    public void recordLakeWriteError() {
        lakeWriteErrorCounter.increment();
    }

    // ============================================================================
    // Scheduler
    // ============================================================================

    public void recordScheduledRun(boolean success) {
        if (success) {
            scheduledRunCounter.increment();
        } else {
            scheduledRunErrorCounter.increment();
        }
    }

    public void recordScheduledSkip() {
        scheduledSkipCounter.increment();
    }

    // ============================================================================
    // Monitor
    // ============================================================================

    /**
     * Counts an alert, tagged by type so dashboards can split SLA from error-rate alerts.
     */
    public void recordAlert(String type) {
        alertCounter.increment();
        Counter.builder("monitor.alerts.by.type")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
