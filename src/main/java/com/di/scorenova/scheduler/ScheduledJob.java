package com.di.scorenova.scheduler;

/**
 * Callback run on every fire of a schedule. Throwing marks the attempt failed;
 * the scheduler retries with backoff up to its configured limit.
 */
@FunctionalInterface
public interface ScheduledJob {

    void run(ScheduleExecutionContext context) throws Exception;
}
