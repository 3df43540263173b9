package com.di.scorenova.scheduler;

import com.di.scorenova.exception.ValidationException;
import com.di.scorenova.retry.RetryPolicy;
import com.di.scorenova.retry.RetryResult;
import com.di.scorenova.util.CancellationToken;
import com.di.scorenova.util.MdcPropagation;
import com.di.scorenova.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Recurring job scheduler driven by one polling loop.
 *
 * <pre>
 *   poller (every pollIntervalMs)          dispatcher                 worker (one per fire)
 *   ──────────────────────────────         ──────────                 ────────────────────
 *   now ≥ nextRunAt ?                      queue.take()  ───────────▶ RetryPolicy.execute(job)
 *     IDLE      → TRIGGERED, enqueue ────▶                            → lastRun / runCount / …
 *     TRIGGERED → skip, skippedCount++                                → TRIGGERED → IDLE
 *   nextRunAt = cron.next(now)
 * </pre>
 *
 * <p>A long-running job never blocks polling: it runs on its own thread. While a
 * schedule's previous fire is still running, further due instants are skipped
 * rather than queued.
 *
 * <p>{@link #stop()} halts polling and cancels the {@link CancellationToken} of
 * every in-flight execution without waiting for it to finish.
 */
@Slf4j
@Service
public class JobScheduler {

    public static final String DEFAULT_TIME_OF_DAY = "02:00";

    private static final Pattern TIME_OF_DAY = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    private final JobSchedulerProperties props;
    private final MetricsCollector       metrics;
    private final Clock                  clock;
    private final RetryPolicy.Sleeper    sleeper;

    /** Guarded by {@code this}. */
    private final Map<String, ScheduleEntry> entries = new LinkedHashMap<>();

    private final BlockingQueue<DueEvent> dueEvents = new LinkedBlockingQueue<>();
    private final AtomicInteger workerSeq = new AtomicInteger();

    private ScheduledExecutorService poller;
    private Thread                   dispatcher;
    private volatile boolean         running;

    @Autowired
    public JobScheduler(JobSchedulerProperties props, MetricsCollector metrics) {
        this(props, metrics, Clock.systemUTC(), Thread::sleep);
    }

    public JobScheduler(JobSchedulerProperties props,
                        MetricsCollector       metrics,
                        Clock                  clock,
                        RetryPolicy.Sleeper    sleeper) {
        this.props   = props;
        this.metrics = metrics;
        this.clock   = clock;
        this.sleeper = sleeper;
    }

    /* ------------------------------------------------------------------ */
    /* Schedule creation                                                    */
    /* ------------------------------------------------------------------ */

    /**
     * Validates the inputs and derives the cron expression and first run.
     *
     * @param frequency hourly, daily or weekly (case-insensitive)
     * @param timeOfDay {@code HH:MM}; null means {@value #DEFAULT_TIME_OF_DAY}
     * @param timezone  zone id; null means the configured default
     * @throws ValidationException on any invalid input
     */
    public ScheduleSpec createSchedule(String frequency, String timeOfDay, String timezone) {
        ScheduleFrequency freq = ScheduleFrequency.parse(frequency);

        String time = timeOfDay != null ? timeOfDay.trim() : DEFAULT_TIME_OF_DAY;
        if (!TIME_OF_DAY.matcher(time).matches()) {
            throw new ValidationException("Invalid time of day '" + timeOfDay + "'; expected HH:MM (00:00-23:59)");
        }

        String zoneName = timezone != null ? timezone.trim() : props.getTimezone();
        ZoneId zone;
        try {
            zone = ZoneId.of(zoneName);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone '" + zoneName + "'", e);
        }

        int hour   = Integer.parseInt(time.substring(0, 2));
        int minute = Integer.parseInt(time.substring(3, 5));
        String cron = freq.toCron(hour, minute);

        return ScheduleSpec.builder()
                .frequency(freq)
                .timeOfDay(time)
                .timezone(zone)
                .cronExpression(cron)
                .nextRunAt(nextAfter(CronExpression.parse(cron), zone, clock.instant()))
                .build();
    }

    /**
     * Registers {@code job} under a new id, enabled. Nothing fires until {@link #start()}.
     *
     * @return the schedule id, {@code schedule_<frequency>_<HHMM>_<suffix>}
     */
    public String schedule(ScheduleSpec spec, ScheduledJob job) {
        if (spec == null || job == null) {
            throw new ValidationException("Schedule spec and job are required");
        }
        String id = String.format("schedule_%s_%s_%s",
                spec.getFrequency().name().toLowerCase(), spec.compactTime(),
                UUID.randomUUID().toString().substring(0, 8));
        ScheduleEntry entry = new ScheduleEntry(id, spec, CronExpression.parse(spec.getCronExpression()), job, clock.instant());
        entry.nextRunAt = nextAfter(entry.cron, spec.getTimezone(), clock.instant());
        synchronized (this) {
            entries.put(id, entry);
        }
        log.info("[SCHEDULER] Scheduled {} ({} {} {}), next run {}",
                 id, spec.getFrequency(), spec.getTimeOfDay(), spec.getTimezone(), entry.nextRunAt);
        return id;
    }

    /**
     * Enables or disables a schedule. Re-enabling recomputes the next run from now,
     * so fires missed while disabled are not replayed.
     *
     * @return false if no schedule has that id
     */
    public synchronized boolean setEnabled(String id, boolean enabled) {
        ScheduleEntry entry = entries.get(id);
        if (entry == null) {
            return false;
        }
        if (enabled && !entry.enabled) {
            entry.nextRunAt = nextAfter(entry.cron, entry.spec.getTimezone(), clock.instant());
        }
        entry.enabled = enabled;
        log.info("[SCHEDULER] {} {}", id, enabled ? "enabled" : "disabled");
        return true;
    }

    /**
     * Cancels any in-flight execution of the schedule and forgets it. Idempotent.
     *
     * @return whether a schedule was removed
     */
    public boolean removeSchedule(String id) {
        ScheduleEntry removed;
        synchronized (this) {
            removed = entries.remove(id);
        }
        if (removed == null) {
            return false;
        }
        CancellationToken inFlight = removed.inFlight;
        if (inFlight != null) {
            inFlight.cancel();
        }
        log.info("[SCHEDULER] Removed {}", id);
        return true;
    }

    public synchronized List<ScheduleView> getSchedules() {
        List<ScheduleView> views = new ArrayList<>(entries.size());
        for (ScheduleEntry e : entries.values()) {
            views.add(e.toView());
        }
        return List.copyOf(views);
    }

    public synchronized Optional<ScheduleView> getSchedule(String id) {
        ScheduleEntry e = entries.get(id);
        return e == null ? Optional.empty() : Optional.of(e.toView());
    }

    /** Earliest next run across enabled schedules. */
    public synchronized Optional<Instant> getNextRunAt() {
        return entries.values().stream()
                .filter(e -> e.enabled)
                .map(e -> e.nextRunAt)
                .min(Comparator.naturalOrder());
    }

    public synchronized int getScheduleCount() {
        return entries.size();
    }

    /* ------------------------------------------------------------------ */
    /* Lifecycle                                                            */
    /* ------------------------------------------------------------------ */

    public synchronized void start() {
        if (running) {
            log.debug("[SCHEDULER] Already running");
            return;
        }
        running = true;
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduler-poller");
            t.setDaemon(true);
            return t;
        });
        long interval = Math.max(10, props.getPollIntervalMs());
        poller.scheduleWithFixedDelay(this::pollSafely, 0, interval, TimeUnit.MILLISECONDS);

        dispatcher = new Thread(this::dispatchLoop, "scheduler-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("[SCHEDULER] Started: {} schedule(s), polling every {} ms", entries.size(), interval);
    }

    public void stop() {
        List<CancellationToken> inFlight = new ArrayList<>();
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            poller.shutdownNow();
            dispatcher.interrupt();
            poller = null;
            dispatcher = null;
            dueEvents.clear();
            for (ScheduleEntry e : entries.values()) {
                if (e.inFlight != null) {
                    inFlight.add(e.inFlight);
                }
                e.triggered = e.inFlight != null;
            }
        }
        inFlight.forEach(CancellationToken::cancel);
        log.info("[SCHEDULER] Stopped; cancelled {} in-flight execution(s)", inFlight.size());
    }

    public boolean isRunning() {
        return running;
    }

    /* ------------------------------------------------------------------ */
    /* Polling                                                              */
    /* ------------------------------------------------------------------ */

    private void pollSafely() {
        try {
            pollOnce();
        } catch (Exception e) {
            // an exception would cancel the periodic task
            log.error("[SCHEDULER] Poll failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One pass over the schedule table. Package-visible so tests can drive the
     * loop against a fixed clock.
     *
     * @return number of due events emitted
     */
    synchronized int pollOnce() {
        Instant now = clock.instant();
        int emitted = 0;
        for (ScheduleEntry e : entries.values()) {
            if (!e.enabled || now.isBefore(e.nextRunAt)) {
                continue;
            }
            Instant dueAt = e.nextRunAt;
            e.nextRunAt = nextAfter(e.cron, e.spec.getTimezone(), now);
            if (e.triggered) {
                e.skippedCount++;
                if (metrics != null) {
                    metrics.recordScheduledSkip();
                }
                log.warn("[SCHEDULER] {} due at {} skipped: previous run still in progress; next run {}",
                         e.id, dueAt, e.nextRunAt);
                continue;
            }
            e.triggered = true;
            dueEvents.add(new DueEvent(e.id, dueAt));
            emitted++;
            log.info("[SCHEDULER] {} due at {} triggered; next run {}", e.id, dueAt, e.nextRunAt);
        }
        return emitted;
    }

    /* ------------------------------------------------------------------ */
    /* Dispatch                                                             */
    /* ------------------------------------------------------------------ */

    private void dispatchLoop() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                DueEvent event = dueEvents.take();
                Thread worker = new Thread(MdcPropagation.wrapRunnable(() -> execute(event)),
                        "scheduler-worker-" + workerSeq.incrementAndGet());
                worker.setDaemon(true);
                worker.start();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        log.debug("[SCHEDULER] Dispatcher exited");
    }

    /**
     * Runs every queued due event on the calling thread. Package-visible for tests.
     *
     * @return number of executions run
     */
    int dispatchPending() {
        List<DueEvent> drained = new ArrayList<>();
        dueEvents.drainTo(drained);
        drained.forEach(this::execute);
        return drained.size();
    }

    int pendingEventCount() {
        return dueEvents.size();
    }

    /**
     * Runs one fire of a schedule with retries, then records the outcome and
     * returns the entry to IDLE.
     */
    private void execute(DueEvent event) {
        ScheduleEntry entry;
        CancellationToken token = CancellationToken.create();
        synchronized (this) {
            entry = entries.get(event.scheduleId);
            if (entry == null) {
                log.debug("[SCHEDULER] {} removed before dispatch; dropping fire", event.scheduleId);
                return;
            }
            entry.inFlight = token;
        }

        String executionId = "exec_" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MdcPropagation.SCHEDULE_ID, entry.id);
        try {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxAttempts(Math.max(1, props.getMaxRetries()))
                    .baseDelayMs(props.getRetryBaseDelayMs())
                    .sleeper(sleeper)
                    .build();
            ScheduleExecutionContext base = ScheduleExecutionContext.builder()
                    .scheduleId(entry.id)
                    .executionId(executionId)
                    .scheduledFor(event.dueAt)
                    .cancellationToken(token)
                    .build();
            AtomicInteger attempt = new AtomicInteger();
            ScheduledJob job = entry.job;

            log.info("[SCHEDULER] {} execution {} starting", entry.id, executionId);
            RetryResult<Void> result = policy.execute("schedule " + entry.id, () -> {
                job.run(base.toBuilder().attempt(attempt.incrementAndGet()).build());
                return null;
            }, t -> !token.isCancelled(), token);

            synchronized (this) {
                entry.lastRun      = clock.instant();
                entry.runCount++;
                entry.lastSuccess  = result.isSuccess();
                entry.lastError    = result.getErrorMessage();
                entry.lastAttempts = result.getAttempts();
            }
            if (metrics != null) {
                metrics.recordScheduledRun(result.isSuccess());
            }
            if (result.isSuccess()) {
                log.info("[SCHEDULER] {} execution {} succeeded after {} attempt(s)",
                         entry.id, executionId, result.getAttempts());
            } else {
                log.error("[SCHEDULER] {} execution {} failed after {} attempt(s): {}",
                          entry.id, executionId, result.getAttempts(), result.getErrorMessage());
            }
        } finally {
            synchronized (this) {
                entry.inFlight  = null;
                entry.triggered = false;
            }
            MDC.remove(MdcPropagation.SCHEDULE_ID);
        }
    }

    /* ------------------------------------------------------------------ */

    private static Instant nextAfter(CronExpression cron, ZoneId zone, Instant after) {
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, zone));
        if (next == null) {
            throw new ValidationException("Cron expression '" + cron + "' has no future fire time");
        }
        return next.toInstant();
    }

    private static final class DueEvent {
        final String  scheduleId;
        final Instant dueAt;

        DueEvent(String scheduleId, Instant dueAt) {
            this.scheduleId = scheduleId;
            this.dueAt      = dueAt;
        }
    }

    /** Mutable per-schedule state. Every field is guarded by the scheduler's monitor. */
    private static final class ScheduleEntry {
        final String         id;
        final ScheduleSpec   spec;
        final CronExpression cron;
        final ScheduledJob   job;
        final Instant        createdAt;

        boolean           enabled = true;
        boolean           triggered;
        Instant           nextRunAt;
        CancellationToken inFlight;

        Instant lastRun;
        Boolean lastSuccess;
        String  lastError;
        int     lastAttempts;
        long    runCount;
        long    skippedCount;

        ScheduleEntry(String id, ScheduleSpec spec, CronExpression cron, ScheduledJob job, Instant createdAt) {
            this.id        = id;
            this.spec      = spec;
            this.cron      = cron;
            this.job       = job;
            this.createdAt = createdAt;
        }

        ScheduleState state() {
            if (triggered) return ScheduleState.TRIGGERED;
            return enabled ? ScheduleState.IDLE : ScheduleState.DISABLED;
        }

        ScheduleView toView() {
            return ScheduleView.builder()
                    .id(id)
                    .frequency(spec.getFrequency())
                    .timeOfDay(spec.getTimeOfDay())
                    .timezone(spec.getTimezone().getId())
                    .cronExpression(spec.getCronExpression())
                    .state(state())
                    .enabled(enabled)
                    .nextRunAt(nextRunAt)
                    .lastRun(lastRun)
                    .lastSuccess(lastSuccess)
                    .lastError(lastError)
                    .lastAttempts(lastAttempts)
                    .runCount(runCount)
                    .skippedCount(skippedCount)
                    .createdAt(createdAt)
                    .build();
        }
    }
}
