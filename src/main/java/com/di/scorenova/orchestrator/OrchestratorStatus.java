package com.di.scorenova.orchestrator;

import com.di.scorenova.monitor.HealthStatus;
import com.di.scorenova.monitor.RunMetrics;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Composite view across every component. Built by {@link BatchOrchestrator#getStatus()}.
 */
@Value
@Builder
public class OrchestratorStatus {

    OrchestratorState state;
    boolean initialized;
    Scheduler scheduler;
    Pipeline pipeline;
    Storage storage;
    Monitoring monitoring;

    /** Null when monitoring is disabled. */
    RunMetrics metrics;

    Instant timestamp;

    /** Problems hit while assembling this view. */
    List<String> errors;

    @Value
    @Builder
    public static class Scheduler {
        boolean enabled;
        boolean running;
        int scheduleCount;
        String scheduleId;
        Instant nextRunAt;
    }

    @Value
    @Builder
    public static class Pipeline {
        int predictorCount;
        List<String> predictorNames;
    }

    @Value
    @Builder
    public static class Storage {
        boolean enabled;
        boolean configured;
        String backend;
    }

    @Value
    @Builder
    public static class Monitoring {
        boolean enabled;
        HealthStatus health;
        int totalRuns;
    }
}
