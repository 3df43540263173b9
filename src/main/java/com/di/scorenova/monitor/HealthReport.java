package com.di.scorenova.monitor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class HealthReport {

    HealthStatus status;

    /** Human-readable reasons; empty when healthy. */
    List<String> issues;

    long uptimeMs;

    /** End time of the most recent run, or null. */
    Instant lastRunAt;

    RunMetrics metrics;
    Instant timestamp;
}
