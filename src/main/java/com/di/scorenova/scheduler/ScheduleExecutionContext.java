package com.di.scorenova.scheduler;

import com.di.scorenova.util.CancellationToken;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Handed to a {@link ScheduledJob} on each attempt.
 */
@Value
@Builder(toBuilder = true)
public class ScheduleExecutionContext {

    String scheduleId;

    /** Stable across the retries of one fire. */
    String executionId;

    /** 1-based. */
    int attempt;

    Instant scheduledFor;

    /** Cancelled by {@link JobScheduler#stop()} and {@link JobScheduler#removeSchedule(String)}. */
    CancellationToken cancellationToken;
}
