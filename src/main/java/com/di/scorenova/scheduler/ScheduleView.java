package com.di.scorenova.scheduler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of one registered schedule.
 */
@Value
@Builder
public class ScheduleView {

    String id;
    ScheduleFrequency frequency;
    String timeOfDay;
    String timezone;
    String cronExpression;
    ScheduleState state;
    boolean enabled;
    Instant nextRunAt;
    Instant lastRun;
    Boolean lastSuccess;
    String lastError;
    int lastAttempts;
    long runCount;
    long skippedCount;
    Instant createdAt;
}
