package com.di.scorenova.orchestrator;

import com.di.scorenova.exception.ConfigurationException;
import com.di.scorenova.monitor.HealthReport;
import com.di.scorenova.monitor.RunMonitor;
import com.di.scorenova.monitor.RunOutcome;
import com.di.scorenova.monitor.RunTrigger;
import com.di.scorenova.pipeline.BatchScoringResult;
import com.di.scorenova.pipeline.InputRecord;
import com.di.scorenova.pipeline.ScoringPipeline;
import com.di.scorenova.predictor.Predictor;
import com.di.scorenova.scheduler.JobScheduler;
import com.di.scorenova.scheduler.JobSchedulerProperties;
import com.di.scorenova.scheduler.ScheduleExecutionContext;
import com.di.scorenova.scheduler.ScheduleSpec;
import com.di.scorenova.source.BatchRecordSource;
import com.di.scorenova.storage.LakeStorageConnector;
import com.di.scorenova.storage.PredictionBatch;
import com.di.scorenova.storage.StoreResult;
import com.di.scorenova.util.CancellationToken;
import com.di.scorenova.util.MdcPropagation;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wires scoring, lake storage, monitoring and scheduling into one batch run.
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────┐
 * │  initialize()                                                 │
 * │   register predictors → configure lake → install alert sink   │
 * │   → schedule "daily @ scheduleTime" → start scheduler         │
 * │   (any failure rolls back what was set up, then rethrows)     │
 * ├───────────────────────────────────────────────────────────────┤
 * │  executeBatch(records)            one at a time (lock)        │
 * │   ScoringPipeline.processBatch                                │
 * │   → LakeStorageConnector.storePredictions   (failure kept)    │
 * │   → RunMonitor.recordRun                                      │
 * ├───────────────────────────────────────────────────────────────┤
 * │  executeScheduledBatch(ctx)                                   │
 * │   BatchRecordSource.loadBatch → executeBatch                  │
 * │   load / scoring failure → failed run recorded, rethrown      │
 * ├───────────────────────────────────────────────────────────────┤
 * │  shutdown()   stop scheduler, cancel in-flight runs           │
 * └───────────────────────────────────────────────────────────────┘
 * </pre>
 */
@Slf4j
@Service
public class BatchOrchestrator {

    // ---- components ---------------------------------------------------------
    private final ScoringPipeline      pipeline;
    private final JobScheduler         scheduler;
    private final LakeStorageConnector storage;
    private final RunMonitor           monitor;
    private final BatchRecordSource    recordSource;
    private final LoggingAlertSink     alertSink;
    private final List<Predictor>      predictors;

    // ---- config -------------------------------------------------------------
    private final OrchestratorProperties props;
    private final JobSchedulerProperties schedulerProps;
    private final Clock                  clock;

    // ---- state --------------------------------------------------------------
    private final ReentrantLock     executionLock = new ReentrantLock();
    private volatile OrchestratorState state      = OrchestratorState.UNINITIALIZED;
    private volatile CancellationToken lifecycleToken = CancellationToken.create();
    private volatile String            scheduleId;
    private volatile InitializationReport initReport;
    private final List<String>         registeredPredictors = new ArrayList<>();

    @Autowired
    public BatchOrchestrator(ScoringPipeline        pipeline,
                             JobScheduler           scheduler,
                             LakeStorageConnector   storage,
                             RunMonitor             monitor,
                             BatchRecordSource      recordSource,
                             LoggingAlertSink       alertSink,
                             List<Predictor>        predictors,
                             OrchestratorProperties props,
                             JobSchedulerProperties schedulerProps) {
        this(pipeline, scheduler, storage, monitor, recordSource, alertSink, predictors,
             props, schedulerProps, Clock.systemUTC());
    }

    public BatchOrchestrator(ScoringPipeline        pipeline,
                             JobScheduler           scheduler,
                             LakeStorageConnector   storage,
                             RunMonitor             monitor,
                             BatchRecordSource      recordSource,
                             LoggingAlertSink       alertSink,
                             List<Predictor>        predictors,
                             OrchestratorProperties props,
                             JobSchedulerProperties schedulerProps,
                             Clock                  clock) {
        this.pipeline       = pipeline;
        this.scheduler      = scheduler;
        this.storage        = storage;
        this.monitor        = monitor;
        this.recordSource   = recordSource;
        this.alertSink      = alertSink;
        this.predictors     = predictors != null ? List.copyOf(predictors) : List.of();
        this.props          = props;
        this.schedulerProps = schedulerProps;
        this.clock          = clock;
    }

    /* ------------------------------------------------------------------ */
    /* Lifecycle                                                            */
    /* ------------------------------------------------------------------ */

    /**
     * Brings every enabled component up. Calling it again once READY returns the
     * earlier report.
     *
     * @throws ConfigurationException if storage is enabled but not configured,
     *                                or the orchestrator is shutting down
     */
    public synchronized InitializationReport initialize() {
        if (state == OrchestratorState.READY || state == OrchestratorState.RUNNING) {
            log.info("[ORCHESTRATOR] Already initialized");
            return initReport;
        }
        if (state == OrchestratorState.SHUTTING_DOWN) {
            throw new ConfigurationException("Cannot initialize while shutting down");
        }
        state = OrchestratorState.INITIALIZING;
        lifecycleToken = CancellationToken.create();
        // re-initializing after shutdown: drop what the previous run set up
        rollback(false, false);
        log.info("[ORCHESTRATOR] Initializing: scheduling={} storage={} monitoring={}",
                 props.isEnableScheduling(), props.isEnableStorage(), props.isEnableMonitoring());

        boolean sinkInstalled = false;
        boolean schedulerStarted = false;
        try {
            // 1. predictors
            for (Predictor p : predictors) {
                pipeline.registerPredictor(p);
                registeredPredictors.add(p.getName());
            }
            if (pipeline.getPredictorCount() == 0) {
                throw new ConfigurationException("No predictors available; enable at least one predictor");
            }

            // 2. lake
            if (props.isEnableStorage() && !storage.isConfigured()) {
                throw new ConfigurationException(
                        "Storage is enabled but scorenova.storage.workspace-id / container-id / credential are not all set");
            }

            // 3. alerts
            if (props.isEnableMonitoring()) {
                monitor.setAlertSink(alertSink);
                sinkInstalled = true;
            }

            // 4. schedule
            Instant nextRunAt = null;
            if (props.isEnableScheduling()) {
                ScheduleSpec spec = scheduler.createSchedule(
                        props.getScheduleFrequency(), schedulerProps.getScheduleTime(), schedulerProps.getTimezone());
                scheduleId = scheduler.schedule(spec, this::executeScheduledBatch);
                nextRunAt  = spec.getNextRunAt();
                if (!scheduler.isRunning()) {
                    scheduler.start();
                    schedulerStarted = true;
                }
                log.info("[ORCHESTRATOR] {} batch scheduled at {} {} ({}), first run {}",
                         spec.getFrequency(), spec.getTimeOfDay(), spec.getTimezone(), scheduleId, nextRunAt);
            }

            initReport = InitializationReport.builder()
                    .predictors(List.copyOf(registeredPredictors))
                    .storage(props.isEnableStorage() ? "configured" : InitializationReport.DISABLED)
                    .monitoring(props.isEnableMonitoring() ? "active" : InitializationReport.DISABLED)
                    .scheduling(props.isEnableScheduling() ? "scheduled" : InitializationReport.DISABLED)
                    .scheduleId(scheduleId)
                    .nextRunAt(nextRunAt)
                    .initializedAt(clock.instant())
                    .build();
            state = OrchestratorState.READY;
            log.info("[ORCHESTRATOR] Ready with {} predictor(s): {}", registeredPredictors.size(), registeredPredictors);
            return initReport;

        } catch (RuntimeException e) {
            log.error("[ORCHESTRATOR] Initialization failed, rolling back: {}", e.getMessage(), e);
            rollback(sinkInstalled, schedulerStarted);
            state = OrchestratorState.UNINITIALIZED;
            throw e;
        }
    }

    private void rollback(boolean sinkInstalled, boolean schedulerStarted) {
        if (schedulerStarted) {
            scheduler.stop();
        }
        if (scheduleId != null) {
            scheduler.removeSchedule(scheduleId);
            scheduleId = null;
        }
        if (sinkInstalled) {
            monitor.setAlertSink(null);
        }
        for (String name : registeredPredictors) {
            pipeline.unregisterPredictor(name);
        }
        registeredPredictors.clear();
    }

    /**
     * Stops future schedule fires and signals in-flight runs to cancel. Does not
     * wait for them. Idempotent.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (state == OrchestratorState.STOPPED || state == OrchestratorState.SHUTTING_DOWN) {
            return;
        }
        log.info("[ORCHESTRATOR] Shutting down");
        state = OrchestratorState.SHUTTING_DOWN;
        lifecycleToken.cancel();
        if (scheduler.isRunning()) {
            scheduler.stop();
            log.info("[ORCHESTRATOR] Scheduler stopped");
        }
        state = OrchestratorState.STOPPED;
        log.info("[ORCHESTRATOR] Shutdown complete");
    }

    public OrchestratorState getState() {
        return state;
    }

    public String getScheduleId() {
        return scheduleId;
    }

    /* ------------------------------------------------------------------ */
    /* Execution                                                            */
    /* ------------------------------------------------------------------ */

    public BatchExecutionResult executeBatch(List<InputRecord> records) {
        return executeBatch(records, RunTrigger.MANUAL, lifecycleToken);
    }

    /**
     * Scores, stores and records one batch. Executions are serialised: a second
     * caller waits for the first to finish.
     *
     * @throws ConfigurationException if the orchestrator is not initialized
     * @throws com.di.scorenova.exception.ValidationException if {@code records} is empty
     */
    public BatchExecutionResult executeBatch(List<InputRecord> records, RunTrigger trigger, CancellationToken token) {
        requireReady();
        executionLock.lock();
        String runId = "run_" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MdcPropagation.RUN_ID, runId);
        try {
            synchronized (this) {
                requireReady();
                state = OrchestratorState.RUNNING;
            }
            Instant start = clock.instant();
            log.info("[ORCHESTRATOR] {} run {} started: {} record(s)", trigger, runId,
                     records != null ? records.size() : 0);

            BatchScoringResult scoring = pipeline.processBatch(records, null, token);

            StoreResult storeResult = null;
            String storageError = null;
            if (props.isEnableStorage()) {
                try {
                    storeResult = storage.storePredictions(PredictionBatch.builder()
                            .predictions(scoring.getPredictions())
                            .batchId(runId)
                            .modelVersion(props.getModelVersion())
                            .runId(runId)
                            .build());
                } catch (RuntimeException e) {
                    storageError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    log.error("[ORCHESTRATOR] Lake write failed for run {}; keeping {} prediction(s): {}",
                              runId, scoring.getPredictions().size(), storageError, e);
                }
            }

            RunOutcome outcome = RunOutcome.builder()
                    .runId(runId)
                    .startTime(start)
                    .endTime(clock.instant())
                    .recordsProcessed(scoring.getPredictions().size())
                    .recordsFailed(scoring.getErrors().size())
                    .slaCompliant(scoring.getSummary().isSlaCompliant())
                    .storageError(storageError)
                    .lakePath(storeResult != null ? storeResult.getLakePath() : null)
                    .trigger(trigger)
                    .build();
            if (props.isEnableMonitoring()) {
                monitor.recordRun(outcome);
            }

            log.info("[ORCHESTRATOR] Run {} finished: {} scored, {} failed, stored={}",
                     runId, outcome.getRecordsProcessed(), outcome.getRecordsFailed(),
                     storeResult != null ? storeResult.getLakePath() : "no");
            return BatchExecutionResult.builder()
                    .runId(runId)
                    .scoring(scoring)
                    .storeResult(storeResult)
                    .storageError(storageError)
                    .outcome(outcome)
                    .build();
        } finally {
            // a shutdown during the run leaves STOPPED in place
            synchronized (this) {
                if (state == OrchestratorState.RUNNING) {
                    state = OrchestratorState.READY;
                }
            }
            MDC.remove(MdcPropagation.RUN_ID);
            executionLock.unlock();
        }
    }

    /**
     * Scheduler callback: loads the batch from the configured source and runs it.
     * A load or scoring failure is recorded as a failed run and rethrown so the
     * scheduler's retries apply. An empty source is a no-op.
     */
    public BatchExecutionResult executeScheduledBatch(ScheduleExecutionContext context) {
        Instant start = clock.instant();
        log.info("[ORCHESTRATOR] Scheduled batch {} (attempt {}) from {}",
                 context.getExecutionId(), context.getAttempt(), recordSource.describe());
        List<InputRecord> records = null;
        try {
            records = recordSource.loadBatch();
            if (records == null || records.isEmpty()) {
                log.info("[ORCHESTRATOR] Scheduled batch {}: source returned no records, nothing to score",
                         context.getExecutionId());
                return null;
            }
            return executeBatch(records, RunTrigger.SCHEDULED, context.getCancellationToken());
        } catch (RuntimeException e) {
            log.error("[ORCHESTRATOR] Scheduled batch {} failed: {}", context.getExecutionId(), e.getMessage(), e);
            if (props.isEnableMonitoring()) {
                monitor.recordRun(RunOutcome.builder()
                        .runId(context.getExecutionId() + "_" + context.getAttempt())
                        .startTime(start)
                        .endTime(clock.instant())
                        .recordsProcessed(0)
                        .recordsFailed(records != null && !records.isEmpty() ? records.size() : 1)
                        .trigger(RunTrigger.SCHEDULED)
                        .build());
            }
            throw e;
        }
    }

    private void requireReady() {
        OrchestratorState s = state;
        if (s != OrchestratorState.READY && s != OrchestratorState.RUNNING) {
            throw new ConfigurationException("Orchestrator is " + s + "; call initialize() first");
        }
    }

    /* ------------------------------------------------------------------ */
    /* Status                                                               */
    /* ------------------------------------------------------------------ */

    /** Never throws; a section that cannot be read is reported in {@code errors}. */
    public OrchestratorStatus getStatus() {
        List<String> errors = new ArrayList<>();
        OrchestratorStatus.OrchestratorStatusBuilder b = OrchestratorStatus.builder()
                .state(state)
                .initialized(state == OrchestratorState.READY || state == OrchestratorState.RUNNING)
                .timestamp(clock.instant());
        try {
            b.scheduler(OrchestratorStatus.Scheduler.builder()
                    .enabled(props.isEnableScheduling())
                    .running(scheduler.isRunning())
                    .scheduleCount(scheduler.getScheduleCount())
                    .scheduleId(scheduleId)
                    .nextRunAt(scheduler.getNextRunAt().orElse(null))
                    .build());
        } catch (RuntimeException e) {
            errors.add("scheduler: " + e.getMessage());
        }
        try {
            b.pipeline(OrchestratorStatus.Pipeline.builder()
                    .predictorCount(pipeline.getPredictorCount())
                    .predictorNames(pipeline.getPredictorNames())
                    .build());
        } catch (RuntimeException e) {
            errors.add("pipeline: " + e.getMessage());
        }
        try {
            b.storage(OrchestratorStatus.Storage.builder()
                    .enabled(props.isEnableStorage())
                    .configured(storage.isConfigured())
                    .backend(storage.getBackendName())
                    .build());
        } catch (RuntimeException e) {
            errors.add("storage: " + e.getMessage());
        }
        try {
            HealthReport health = monitor.getHealthStatus();
            b.monitoring(OrchestratorStatus.Monitoring.builder()
                    .enabled(props.isEnableMonitoring())
                    .health(health.getStatus())
                    .totalRuns(health.getMetrics() != null ? health.getMetrics().getTotalRuns() : 0)
                    .build());
            if (props.isEnableMonitoring()) {
                b.metrics(health.getMetrics());
            }
        } catch (RuntimeException e) {
            errors.add("monitoring: " + e.getMessage());
        }
        return b.errors(List.copyOf(errors)).build();
    }
}
