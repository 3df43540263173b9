package com.di.scorenova.monitor;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Publishes {@link RunMonitor#getHealthStatus()} as the {@code scoring} component of
 * {@code /actuator/health}. DEGRADED maps to a custom status that Actuator treats
 * as UP unless the status order is configured otherwise.
 */
@Component("scoring")
public class ScoringHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Recent runs failing or missing the SLA");

    private final RunMonitor monitor;

    public ScoringHealthIndicator(RunMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        HealthReport report = monitor.getHealthStatus();
        Health.Builder builder = switch (report.getStatus()) {
            case HEALTHY   -> Health.up();
            case DEGRADED  -> Health.status(DEGRADED);
            case UNHEALTHY -> Health.down();
        };
        RunMetrics m = report.getMetrics();
        builder.withDetail("issues", report.getIssues());
        if (report.getLastRunAt() != null) {
            builder.withDetail("lastRunAt", report.getLastRunAt().toString());
        }
        if (m != null) {
            builder.withDetail("totalRuns", m.getTotalRuns())
                   .withDetail("successRate", m.getSuccessRate())
                   .withDetail("slaComplianceRate", m.getSlaComplianceRate());
        }
        return builder.build();
    }
}
