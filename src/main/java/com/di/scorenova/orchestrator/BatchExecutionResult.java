package com.di.scorenova.orchestrator;

import com.di.scorenova.monitor.RunOutcome;
import com.di.scorenova.pipeline.BatchScoringResult;
import com.di.scorenova.storage.StoreResult;
import lombok.Builder;
import lombok.Value;

/**
 * One orchestrated execution: scoring output, lake write and the outcome reported
 * to the monitor. A failed lake write leaves {@code storeResult} null and the
 * predictions intact.
 */
@Value
@Builder
public class BatchExecutionResult {

    String runId;
    BatchScoringResult scoring;

    /** Null when storage is disabled or the write failed. */
    StoreResult storeResult;

    /** Null unless the write failed. */
    String storageError;

    RunOutcome outcome;

    public boolean isSuccess() {
        return outcome != null && outcome.isSuccess();
    }
}
