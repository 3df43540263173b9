package com.di.scorenova.monitor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of one orchestrated execution as reported to the {@link RunMonitor}.
 * {@code durationMs} and {@code slaCompliant} are recomputed by the monitor on
 * record.
 */
@Value
@Builder(toBuilder = true)
public class RunOutcome {

    /** Generated by the monitor when null. */
    String runId;

    Instant startTime;
    Instant endTime;

    int recordsProcessed;
    int recordsFailed;

    long durationMs;
    boolean slaCompliant;

    /** Null unless the lake write failed. */
    String storageError;

    /** Null unless the lake write succeeded. */
    String lakePath;

    @Builder.Default
    RunTrigger trigger = RunTrigger.MANUAL;

    /** Every record scored and the results stored. */
    public boolean isSuccess() {
        return recordsFailed == 0 && storageError == null;
    }
}
