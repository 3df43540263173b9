package com.di.scorenova.monitor;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * scorenova:
 *   monitor:
 *     sla-threshold-minutes: 30
 *     error-rate-threshold: 0.1
 *     error-rate-window: 10
 *     error-rate-min-runs: 5
 *     retention-days: 30
 *     max-history-size: 10000
 *     stale-threshold-hours: 25
 *     alerting-enabled: true
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "scorenova.monitor")
public class RunMonitorProperties {

    private double slaThresholdMinutes = 30;

    /** Fraction of failed runs in the window above which a CRITICAL alert is raised. */
    private double errorRateThreshold = 0.1;

    private int errorRateWindow = 10;

    /** The error rate is not evaluated until this many runs exist. */
    private int errorRateMinRuns = 5;

    private int retentionDays = 30;

    private int maxHistorySize = 10_000;

    private double staleThresholdHours = 25;

    /** Runs considered for the recent success rate in health checks. */
    private int healthWindow = 5;

    /** When false, alerts are still retained but not delivered to the sink. */
    private boolean alertingEnabled = true;
}
