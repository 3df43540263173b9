package com.di.scorenova.scheduler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;

/**
 * A validated recurrence produced by {@link JobScheduler#createSchedule}.
 * {@code cronExpression} and {@code nextRunAt} are derived; after registration
 * the scheduler owns the next-run instant and reports it through {@link ScheduleView}.
 */
@Value
@Builder
public class ScheduleSpec {

    ScheduleFrequency frequency;

    /** {@code HH:MM}, 24-hour. */
    String timeOfDay;

    ZoneId timezone;

    String cronExpression;

    Instant nextRunAt;

    /** {@code HHMM}, used in generated schedule ids. */
    String compactTime() {
        return timeOfDay.replace(":", "");
    }
}
