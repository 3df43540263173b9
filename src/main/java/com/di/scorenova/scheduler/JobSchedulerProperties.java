package com.di.scorenova.scheduler;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * scorenova:
 *   scheduler:
 *     schedule-time: "02:00"
 *     timezone: UTC
 *     max-retries: 3
 *     retry-base-delay-ms: 1000
 *     poll-interval-ms: 1000
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "scorenova.scheduler")
public class JobSchedulerProperties {

    /** Time of day for the orchestrator's daily batch. */
    private String scheduleTime = "02:00";

    /** Default zone for schedules created without one. */
    private String timezone = "UTC";

    /** Total attempts per fire, first one included. */
    private int maxRetries = 3;

    private long retryBaseDelayMs = 1000;

    private long pollIntervalMs = 1000;
}
