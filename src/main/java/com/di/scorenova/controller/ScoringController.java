package com.di.scorenova.controller;

import com.di.scorenova.controller.dto.ScoreBatchRequest;
import com.di.scorenova.controller.dto.StorageConfigRequest;
import com.di.scorenova.monitor.Alert;
import com.di.scorenova.monitor.HealthReport;
import com.di.scorenova.monitor.HealthStatus;
import com.di.scorenova.monitor.RunMetrics;
import com.di.scorenova.monitor.RunMonitor;
import com.di.scorenova.orchestrator.BatchExecutionResult;
import com.di.scorenova.orchestrator.BatchOrchestrator;
import com.di.scorenova.orchestrator.InitializationReport;
import com.di.scorenova.orchestrator.OrchestratorStatus;
import com.di.scorenova.scheduler.JobScheduler;
import com.di.scorenova.scheduler.ScheduleView;
import com.di.scorenova.storage.LakeStorageConnector;
import com.di.scorenova.storage.PredictionQuery;
import com.di.scorenova.storage.QueryResult;
import com.di.scorenova.storage.StorageInfo;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Operational REST surface for the scoring service.
 *
 * <p><strong>Base path:</strong> {@code /api/scoring}
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/initialize</td><td>Bring the orchestrator up (needed when auto-initialize is off)</td></tr>
 * <tr><td>POST</td><td>/shutdown</td><td>Stop scheduling and cancel in-flight runs</td></tr>
 * <tr><td>POST</td><td>/batches</td><td>Score, store and record an ad-hoc batch (synchronous)</td></tr>
 * <tr><td>GET</td><td>/status</td><td>Orchestrator status</td></tr>
 * <tr><td>GET</td><td>/metrics</td><td>Aggregate run metrics</td></tr>
 * <tr><td>GET</td><td>/health</td><td>Health report (503 when unhealthy)</td></tr>
 * <tr><td>GET / DELETE</td><td>/alerts</td><td>Recent alerts / clear them</td></tr>
 * <tr><td>GET</td><td>/schedules[/{id}]</td><td>Registered schedules</td></tr>
 * <tr><td>POST</td><td>/schedules/{id}/enable|disable</td><td>Toggle a schedule</td></tr>
 * <tr><td>DELETE</td><td>/schedules/{id}</td><td>Remove a schedule</td></tr>
 * <tr><td>GET</td><td>/predictions</td><td>Query stored predictions</td></tr>
 * <tr><td>GET</td><td>/storage/info</td><td>Lake partition summary</td></tr>
 * <tr><td>POST</td><td>/storage/configure</td><td>Update lake settings</td></tr>
 * </table>
 *
 * <p>Failures are mapped by {@link com.di.scorenova.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/scoring")
@Slf4j
@RequiredArgsConstructor
public class ScoringController {

    private final BatchOrchestrator    orchestrator;
    private final RunMonitor           monitor;
    private final JobScheduler         scheduler;
    private final LakeStorageConnector storage;

    /* ------------------------------------------------------------------ */
    /* Lifecycle                                                            */
    /* ------------------------------------------------------------------ */

    /** Idempotent once READY; a failed initialization is rolled back and mapped to 503. */
    @PostMapping("/initialize")
    public InitializationReport initialize() {
        log.info("[CONTROLLER] POST /api/scoring/initialize");
        return orchestrator.initialize();
    }

    @PostMapping("/shutdown")
    public OrchestratorStatus shutdown() {
        log.info("[CONTROLLER] POST /api/scoring/shutdown");
        orchestrator.shutdown();
        return orchestrator.getStatus();
    }

    /* ------------------------------------------------------------------ */
    /* Batches                                                              */
    /* ------------------------------------------------------------------ */

    /**
     * Runs one batch through scoring, the lake and the monitor. Returns
     * {@code 201 Created}, or {@code 207 Multi-Status} when some records failed
     * or the lake write did not succeed.
     */
    @PostMapping("/batches")
    public ResponseEntity<BatchExecutionResult> executeBatch(@Valid @RequestBody ScoreBatchRequest request) {
        log.info("[CONTROLLER] POST /api/scoring/batches records={}", request.getRecords().size());
        BatchExecutionResult result = orchestrator.executeBatch(request.toInputRecords());
        HttpStatus status = result.isSuccess() ? HttpStatus.CREATED : HttpStatus.MULTI_STATUS;
        return ResponseEntity.status(status).body(result);
    }

    /* ------------------------------------------------------------------ */
    /* Status, metrics, health, alerts                                      */
    /* ------------------------------------------------------------------ */

    @GetMapping("/status")
    public OrchestratorStatus getStatus() {
        return orchestrator.getStatus();
    }

    @GetMapping("/metrics")
    public RunMetrics getMetrics() {
        return monitor.getMetrics();
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> getHealth() {
        HealthReport report = monitor.getHealthStatus();
        HttpStatus status = report.getStatus() == HealthStatus.UNHEALTHY
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    @GetMapping("/alerts")
    public List<Alert> getAlerts(@RequestParam(required = false, defaultValue = "50") int limit) {
        return monitor.getAlerts(limit);
    }

    @DeleteMapping("/alerts")
    public Map<String, Object> clearAlerts() {
        return Map.of("cleared", monitor.clearAlerts());
    }

    /* ------------------------------------------------------------------ */
    /* Schedules                                                            */
    /* ------------------------------------------------------------------ */

    @GetMapping("/schedules")
    public List<ScheduleView> getSchedules() {
        return scheduler.getSchedules();
    }

    @GetMapping("/schedules/{id}")
    public ResponseEntity<ScheduleView> getSchedule(@PathVariable String id) {
        return scheduler.getSchedule(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/schedules/{id}/enable")
    public ResponseEntity<ScheduleView> enableSchedule(@PathVariable String id) {
        return toggle(id, true);
    }

    @PostMapping("/schedules/{id}/disable")
    public ResponseEntity<ScheduleView> disableSchedule(@PathVariable String id) {
        return toggle(id, false);
    }

    @DeleteMapping("/schedules/{id}")
    public ResponseEntity<Void> removeSchedule(@PathVariable String id) {
        log.info("[CONTROLLER] DELETE /api/scoring/schedules/{}", id);
        return scheduler.removeSchedule(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private ResponseEntity<ScheduleView> toggle(String id, boolean enabled) {
        log.info("[CONTROLLER] schedule {} enabled={}", id, enabled);
        if (!scheduler.setEnabled(id, enabled)) {
            return ResponseEntity.notFound().build();
        }
        return scheduler.getSchedule(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /* ------------------------------------------------------------------ */
    /* Lake                                                                 */
    /* ------------------------------------------------------------------ */

    @GetMapping("/predictions")
    public QueryResult getPredictions(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(required = false) List<String> equipmentIds,
            @RequestParam(required = false) List<String> modelNames,
            @RequestParam(required = false) Integer limit) {
        return storage.retrievePredictions(PredictionQuery.builder()
                .startDate(startDate)
                .endDate(endDate)
                .equipmentIds(equipmentIds != null ? new HashSet<>(equipmentIds) : null)
                .modelNames(modelNames != null ? new HashSet<>(modelNames) : null)
                .limit(limit)
                .build());
    }

    @GetMapping("/storage/info")
    public StorageInfo getStorageInfo() {
        return storage.getStorageInfo();
    }

    @PostMapping("/storage/configure")
    public Map<String, Object> configureStorage(@RequestBody StorageConfigRequest request) {
        log.info("[CONTROLLER] POST /api/scoring/storage/configure {}", request);
        boolean configured = storage.configure(request.toStorageConfig());
        return Map.of("configured", configured, "backend", storage.getBackendName());
    }
}
