package com.di.scorenova.orchestrator;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What {@link BatchOrchestrator#initialize()} set up.
 */
@Value
@Builder
public class InitializationReport {

    public static final String DISABLED = "disabled";

    List<String> predictors;

    /** {@code configured} or {@value #DISABLED}. */
    String storage;

    /** {@code active} or {@value #DISABLED}. */
    String monitoring;

    /** {@code scheduled} or {@value #DISABLED}. */
    String scheduling;

    /** Null when scheduling is disabled. */
    String scheduleId;

    Instant nextRunAt;

    Instant initializedAt;
}
