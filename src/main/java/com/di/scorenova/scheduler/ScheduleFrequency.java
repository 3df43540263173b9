package com.di.scorenova.scheduler;

import com.di.scorenova.exception.ValidationException;

import java.util.Locale;

/**
 * Supported recurrences, each mapped to a Spring six-field cron template
 * ({@code second minute hour day-of-month month day-of-week}).
 */
public enum ScheduleFrequency {

    HOURLY("0 %d * * * *"),
    DAILY("0 %d %d * * *"),
    WEEKLY("0 %d %d * * SUN");

    private final String cronTemplate;

    ScheduleFrequency(String cronTemplate) {
        this.cronTemplate = cronTemplate;
    }

    /** Hourly schedules use only the minute. */
    public String toCron(int hour, int minute) {
        return this == HOURLY
                ? String.format(cronTemplate, minute)
                : String.format(cronTemplate, minute, hour);
    }

    public static ScheduleFrequency parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Schedule frequency is required (hourly, daily or weekly)");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported schedule frequency '" + value
                    + "'; expected hourly, daily or weekly", e);
        }
    }
}
