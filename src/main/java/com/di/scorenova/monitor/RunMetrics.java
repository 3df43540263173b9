package com.di.scorenova.monitor;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregates over the retained run history. All rates are 0 when there are no runs.
 */
@Value
@Builder
public class RunMetrics {

    int totalRuns;
    double successRate;
    double averageDurationMs;
    double averageRecordsProcessed;
    double slaComplianceRate;

    /** Null when there are no runs. */
    RunOutcome lastRun;

    long uptimeMs;
}
