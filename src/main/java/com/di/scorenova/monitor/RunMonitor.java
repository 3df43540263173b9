package com.di.scorenova.monitor;

import com.di.scorenova.exception.ValidationException;
import com.di.scorenova.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * Keeps run and alert history and evaluates SLA and error-rate thresholds after
 * every recorded run.
 *
 * <p>All mutations and reads go through the instance monitor, so readers always
 * observe a history that is either before or after a whole {@link #recordRun}.
 * The alert sink is invoked outside the lock.
 */
@Slf4j
@Service
public class RunMonitor {

    private final RunMonitorProperties props;
    private final MetricsCollector     metrics;
    private final Clock                clock;
    private final Instant              startedAt;

    private final Deque<RunOutcome> runs   = new ArrayDeque<>();
    private final Deque<Alert>      alerts = new ArrayDeque<>();

    private volatile AlertSink alertSink;

    @Autowired
    public RunMonitor(RunMonitorProperties props, MetricsCollector metrics) {
        this(props, metrics, Clock.systemUTC());
    }

    public RunMonitor(RunMonitorProperties props, MetricsCollector metrics, Clock clock) {
        this.props     = props;
        this.metrics   = metrics;
        this.clock     = clock;
        this.startedAt = clock.instant();
    }

    /* ------------------------------------------------------------------ */
    /* Recording                                                            */
    /* ------------------------------------------------------------------ */

    /**
     * Appends a run, raises any alerts it trips and prunes expired history.
     *
     * @return the run id (generated when the outcome has none)
     * @throws ValidationException if the outcome or its start/end time is missing
     */
    public String recordRun(RunOutcome outcome) {
        if (outcome == null || outcome.getStartTime() == null || outcome.getEndTime() == null) {
            throw new ValidationException("Run outcome with start and end time is required");
        }
        long durationMs = Math.max(Duration.between(outcome.getStartTime(), outcome.getEndTime()).toMillis(), 1L);
        long slaMs      = slaThresholdMs();
        RunOutcome run = outcome.toBuilder()
                .runId(outcome.getRunId() != null ? outcome.getRunId() : "run_" + UUID.randomUUID())
                .durationMs(durationMs)
                .slaCompliant(durationMs <= slaMs)
                .build();

        List<Alert> raised = new ArrayList<>(2);
        synchronized (this) {
            runs.addLast(run);

            if (durationMs > slaMs) {
                raised.add(newAlert(AlertType.SLA_VIOLATION, AlertSeverity.HIGH,
                        String.format("Run %s exceeded the %s-minute SLA: %d minutes",
                                run.getRunId(), formatMinutes(props.getSlaThresholdMinutes()),
                                Math.round(durationMs / 60_000d)),
                        run.getRunId(), durationMs, slaMs));
            }

            List<RunOutcome> window = lastRuns(Math.max(1, props.getErrorRateWindow()));
            if (window.size() >= props.getErrorRateMinRuns()) {
                long failed = window.stream().filter(r -> !r.isSuccess()).count();
                double errorRate = (double) failed / window.size();
                if (errorRate > props.getErrorRateThreshold()) {
                    raised.add(newAlert(AlertType.HIGH_ERROR_RATE, AlertSeverity.CRITICAL,
                            String.format("High error rate detected: %d%% over last %d runs",
                                    Math.round(errorRate * 100), window.size()),
                            null, errorRate, props.getErrorRateThreshold()));
                }
            }

            alerts.addAll(raised);
            prune();
        }

        log.info("[MONITOR] Recorded run {}: {} processed, {} failed, {} ms, sla={}{}",
                 run.getRunId(), run.getRecordsProcessed(), run.getRecordsFailed(), durationMs,
                 run.isSlaCompliant() ? "met" : "MISSED",
                 run.getStorageError() != null ? ", storage error: " + run.getStorageError() : "");
        raised.forEach(this::deliver);
        return run.getRunId();
    }

    private Alert newAlert(AlertType type, AlertSeverity severity, String message,
                           String runId, double observed, double threshold) {
        return Alert.builder()
                .id("alert_" + UUID.randomUUID().toString().substring(0, 12))
                .type(type)
                .severity(severity)
                .message(message)
                .triggeringRunId(runId)
                .timestamp(clock.instant())
                .observedValue(observed)
                .threshold(threshold)
                .build();
    }

    private void deliver(Alert alert) {
        log.warn("[ALERT] {} {}: {}", alert.getSeverity(), alert.getType(), alert.getMessage());
        if (metrics != null) {
            metrics.recordAlert(alert.getType().name());
        }
        AlertSink sink = alertSink;
        if (!props.isAlertingEnabled() || sink == null) {
            return;
        }
        try {
            sink.onAlert(alert);
        } catch (Exception e) {
            log.error("[MONITOR] Alert sink failed for {}: {}", alert.getId(), e.getMessage(), e);
        }
    }

    /** Drops entries older than the retention window, then caps each history. Caller holds the lock. */
    private void prune() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(props.getRetentionDays()));
        int before = runs.size() + alerts.size();

        for (Iterator<RunOutcome> it = runs.iterator(); it.hasNext(); ) {
            if (it.next().getEndTime().isBefore(cutoff)) it.remove();
        }
        for (Iterator<Alert> it = alerts.iterator(); it.hasNext(); ) {
            if (it.next().getTimestamp().isBefore(cutoff)) it.remove();
        }
        int cap = Math.max(1, props.getMaxHistorySize());
        while (runs.size() > cap) runs.removeFirst();
        while (alerts.size() > cap) alerts.removeFirst();

        int pruned = before - runs.size() - alerts.size();
        if (pruned > 0) {
            log.debug("[MONITOR] Pruned {} history entries older than {}", pruned, cutoff);
        }
    }

    /* ------------------------------------------------------------------ */
    /* Alerts                                                               */
    /* ------------------------------------------------------------------ */

    /** Replaces the current sink; null removes it. */
    public void setAlertSink(AlertSink sink) {
        this.alertSink = sink;
    }

    public AlertSink getAlertSink() {
        return alertSink;
    }

    /** Most recent alerts, newest first. A non-positive limit means 50. */
    public synchronized List<Alert> getAlerts(int limit) {
        int n = limit > 0 ? limit : 50;
        List<Alert> out = new ArrayList<>(Math.min(n, alerts.size()));
        Iterator<Alert> it = alerts.descendingIterator();
        while (it.hasNext() && out.size() < n) {
            out.add(it.next());
        }
        return List.copyOf(out);
    }

    public List<Alert> getAlerts() {
        return getAlerts(50);
    }

    public synchronized int clearAlerts() {
        int n = alerts.size();
        alerts.clear();
        log.info("[MONITOR] Cleared {} alert(s)", n);
        return n;
    }

    /* ------------------------------------------------------------------ */
    /* Metrics and health                                                   */
    /* ------------------------------------------------------------------ */

    public synchronized RunMetrics getMetrics() {
        long uptime = Duration.between(startedAt, clock.instant()).toMillis();
        if (runs.isEmpty()) {
            return RunMetrics.builder().uptimeMs(uptime).build();
        }
        int total = runs.size();
        long ok = 0, slaOk = 0, durationSum = 0, recordsSum = 0;
        for (RunOutcome r : runs) {
            if (r.isSuccess()) ok++;
            if (r.isSlaCompliant()) slaOk++;
            durationSum += r.getDurationMs();
            recordsSum  += r.getRecordsProcessed();
        }
        return RunMetrics.builder()
                .totalRuns(total)
                .successRate((double) ok / total)
                .averageDurationMs((double) durationSum / total)
                .averageRecordsProcessed((double) recordsSum / total)
                .slaComplianceRate((double) slaOk / total)
                .lastRun(runs.peekLast())
                .uptimeMs(uptime)
                .build();
    }

    /**
     * Evaluates health. Never throws.
     * <ul>
     *   <li>UNHEALTHY: no run has finished within the stale threshold (measured from
     *       monitor start when there are no runs yet)</li>
     *   <li>DEGRADED: recent success rate below 80%, or SLA compliance below 90%</li>
     * </ul>
     */
    public HealthReport getHealthStatus() {
        Instant now = clock.instant();
        try {
            RunMetrics m;
            List<RunOutcome> recent;
            synchronized (this) {
                m = getMetrics();
                recent = lastRuns(Math.max(1, props.getHealthWindow()));
            }
            HealthStatus status = HealthStatus.HEALTHY;
            List<String> issues = new ArrayList<>();

            if (!recent.isEmpty()) {
                double recentSuccess = (double) recent.stream().filter(RunOutcome::isSuccess).count() / recent.size();
                if (recentSuccess < 0.8) {
                    status = HealthStatus.DEGRADED;
                    issues.add(String.format("Low recent success rate: %.0f%% over last %d runs",
                            recentSuccess * 100, recent.size()));
                }
            }
            if (m.getTotalRuns() > 0 && m.getSlaComplianceRate() < 0.9) {
                status = HealthStatus.DEGRADED;
                issues.add(String.format("SLA compliance below 90%%: %.0f%%", m.getSlaComplianceRate() * 100));
            }

            Instant lastEnd = m.getLastRun() != null ? m.getLastRun().getEndTime() : null;
            Instant reference = lastEnd != null ? lastEnd : startedAt;
            long staleMs = (long) (props.getStaleThresholdHours() * 3_600_000d);
            if (Duration.between(reference, now).toMillis() > staleMs) {
                status = HealthStatus.UNHEALTHY;
                issues.add(lastEnd != null
                        ? "No run completed since " + lastEnd
                        : "No run completed since monitor start at " + startedAt);
            }

            return HealthReport.builder()
                    .status(status)
                    .issues(List.copyOf(issues))
                    .uptimeMs(m.getUptimeMs())
                    .lastRunAt(lastEnd)
                    .metrics(m)
                    .timestamp(now)
                    .build();
        } catch (RuntimeException e) {
            log.error("[MONITOR] Health evaluation failed: {}", e.getMessage(), e);
            return HealthReport.builder()
                    .status(HealthStatus.UNHEALTHY)
                    .issues(List.of("Health evaluation failed: " + e.getMessage()))
                    .timestamp(now)
                    .build();
        }
    }

    public synchronized List<RunOutcome> getRecentRuns(int limit) {
        return lastRuns(limit > 0 ? limit : runs.size());
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public RunMonitorProperties getProperties() {
        return props;
    }

    /* ------------------------------------------------------------------ */

    /** Last {@code n} runs in recording order. Caller holds the lock. */
    private List<RunOutcome> lastRuns(int n) {
        List<RunOutcome> out = new ArrayList<>(Math.min(n, runs.size()));
        Iterator<RunOutcome> it = runs.descendingIterator();
        while (it.hasNext() && out.size() < n) {
            out.add(0, it.next());
        }
        return out;
    }

    private long slaThresholdMs() {
        return (long) (props.getSlaThresholdMinutes() * 60_000d);
    }

    private static String formatMinutes(double minutes) {
        return minutes == Math.rint(minutes) ? String.valueOf((long) minutes) : String.valueOf(minutes);
    }
}
