package com.di.scorenova.pipeline;

import com.di.scorenova.exception.ValidationException;
import com.di.scorenova.predictor.FeatureVector;
import com.di.scorenova.predictor.PredictionException;
import com.di.scorenova.predictor.Predictor;
import com.di.scorenova.predictor.PredictorScore;
import com.di.scorenova.retry.RetryPolicy;
import com.di.scorenova.retry.RetryResult;
import com.di.scorenova.util.CancellationToken;
import com.di.scorenova.util.MdcPropagation;
import com.di.scorenova.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Chunked batch scoring engine.
 *
 * <pre>
 *   records ──▶ chunk 1 ──▶ chunk 2 ──▶ … (sequential)
 *                 │
 *                 ├─ record ─▶ features ─▶ predictor A, predictor B … ─▶ ensemble
 *                 ├─ record ─▶ …                     (≤ maxConcurrency at once)
 *                 └─ record ─▶ …
 * </pre>
 *
 * <h3>Failure semantics</h3>
 * A record fails when any predictor fails for it. A {@link PredictionException}
 * marked non-retryable fails the record after one attempt; any other error is
 * retried through {@link RetryPolicy} until {@code retryAttempts} attempts have
 * been made. A failed record never aborts the batch: it is reported in
 * {@link BatchScoringResult#getErrors()} and the batch carries on. Only an empty
 * input or an empty predictor registry is a hard error.
 *
 * <h3>Cancellation</h3>
 * The {@link CancellationToken} is checked between chunks and before each record.
 * Records left unscored are reported as errors with message
 * {@value ScoringError#CANCELLED}.
 */
@Slf4j
@Service
public class ScoringPipeline {

    private final ScoringPipelineProperties props;
    private final FeatureExtractor          featureExtractor;
    private final MetricsCollector          metrics;
    private final Clock                     clock;
    private final RetryPolicy.Sleeper       sleeper;

    /** Registration order is the order predictors are invoked and reported in. */
    private final Map<String, Predictor> predictors = new LinkedHashMap<>();

    @Autowired
    public ScoringPipeline(ScoringPipelineProperties props, MetricsCollector metrics) {
        this(props, metrics, Clock.systemUTC(), Thread::sleep);
    }

    public ScoringPipeline(ScoringPipelineProperties props,
                           MetricsCollector          metrics,
                           Clock                     clock,
                           RetryPolicy.Sleeper       sleeper) {
        this.props            = props;
        this.featureExtractor = new FeatureExtractor(props.getFeatureLength());
        this.metrics          = metrics;
        this.clock            = clock;
        this.sleeper          = sleeper;
    }

    /* ------------------------------------------------------------------ */
    /* Predictor registry                                                   */
    /* ------------------------------------------------------------------ */

    public synchronized void registerPredictor(Predictor predictor) {
        if (predictor == null) {
            throw new ValidationException("Predictor must not be null");
        }
        String name = predictor.getName();
        if (name == null || name.isBlank()) {
            throw new ValidationException("Predictor name must not be blank");
        }
        if (predictors.containsKey(name)) {
            throw new ValidationException("Predictor already registered: " + name);
        }
        predictors.put(name, predictor);
        log.info("[PIPELINE] Registered predictor '{}' ({} total)", name, predictors.size());
    }

    /** @return whether a predictor with that name was registered */
    public synchronized boolean unregisterPredictor(String name) {
        boolean removed = predictors.remove(name) != null;
        if (removed) {
            log.info("[PIPELINE] Unregistered predictor '{}'", name);
        }
        return removed;
    }

    public synchronized List<String> getPredictorNames() {
        return List.copyOf(predictors.keySet());
    }

    public synchronized int getPredictorCount() {
        return predictors.size();
    }

    private synchronized List<Predictor> snapshotPredictors() {
        return List.copyOf(predictors.values());
    }

    public ScoringPipelineProperties getProperties() {
        return props;
    }

    /* ------------------------------------------------------------------ */
    /* Batch scoring                                                        */
    /* ------------------------------------------------------------------ */

    public BatchScoringResult processBatch(List<InputRecord> records) {
        return processBatch(records, null, CancellationToken.none());
    }

    public BatchScoringResult processBatch(List<InputRecord> records, Integer batchSizeOverride) {
        return processBatch(records, batchSizeOverride, CancellationToken.none());
    }

    /**
     * Scores {@code records} in chunks of {@code batchSizeOverride} (or the
     * configured batch size when null or not positive).
     *
     * @throws ValidationException if {@code records} is null or empty, or no predictor is registered
     */
    public BatchScoringResult processBatch(List<InputRecord> records,
                                           Integer           batchSizeOverride,
                                           CancellationToken token) {
        if (records == null || records.isEmpty()) {
            throw new ValidationException("Batch must contain at least one record");
        }
        List<Predictor> activePredictors = snapshotPredictors();
        if (activePredictors.isEmpty()) {
            throw new ValidationException("No predictors registered");
        }
        CancellationToken cancel = token != null ? token : CancellationToken.none();

        int chunkSize = batchSizeOverride != null && batchSizeOverride > 0
                ? batchSizeOverride
                : Math.max(1, props.getBatchSize());
        int chunkCount = (records.size() + chunkSize - 1) / chunkSize;
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(Math.max(1, props.getRetryAttempts()))
                .baseDelayMs(props.getRetryBaseDelayMs())
                .sleeper(sleeper)
                .build();

        log.info("[PIPELINE] Scoring {} records in {} chunk(s) of ≤{} with {} predictor(s), concurrency ≤{}",
                 records.size(), chunkCount, chunkSize, activePredictors.size(), props.getMaxConcurrency());

        long startMs = clock.millis();
        List<PredictionResult> predictions = new ArrayList<>(records.size());
        List<ScoringError>     errors      = new ArrayList<>();
        boolean cancelled = false;

        for (int c = 0; c < chunkCount; c++) {
            int from = c * chunkSize;
            int to   = Math.min(from + chunkSize, records.size());
            if (cancel.isCancelled()) {
                cancelled = true;
                for (int i = from; i < to; i++) {
                    errors.add(cancelledError(records.get(i)));
                }
                continue;
            }
            List<RecordOutcome> outcomes = scoreChunk(records, from, to, activePredictors, retryPolicy, cancel);
            for (RecordOutcome o : outcomes) {
                if (o.prediction != null) {
                    predictions.add(o.prediction);
                } else {
                    errors.add(o.error);
                    cancelled |= o.error.isCancelled();
                }
            }
            log.debug("[PIPELINE] Chunk {}/{} done ({} records)", c + 1, chunkCount, to - from);
        }

        long processingTimeMs = Math.max(clock.millis() - startMs, 1L);
        boolean slaCompliant  = processingTimeMs < props.getSlaThresholdMinutes() * 60_000d;
        BatchSummary summary = BatchSummary.builder()
                .totalRecords(records.size())
                .successfulPredictions(predictions.size())
                .failedPredictions(errors.size())
                .processingTimeMs(processingTimeMs)
                .successRate((double) predictions.size() / records.size())
                .slaCompliant(slaCompliant)
                .predictorsUsed(activePredictors.stream().map(Predictor::getName).toList())
                .chunkCount(chunkCount)
                .cancelled(cancelled)
                .build();

        if (metrics != null) {
            metrics.recordBatch(records.size(), predictions.size(), errors.size(), processingTimeMs, slaCompliant);
        }
        if (!slaCompliant) {
            log.warn("[PIPELINE] Batch took {} ms, over the {} min SLA", processingTimeMs, props.getSlaThresholdMinutes());
        }
        log.info("[PIPELINE] Batch done: {}/{} scored, {} failed, {} ms{}",
                 predictions.size(), records.size(), errors.size(), processingTimeMs,
                 cancelled ? " (cancelled)" : "");

        return BatchScoringResult.builder()
                .predictions(List.copyOf(predictions))
                .errors(List.copyOf(errors))
                .summary(summary)
                .processedAt(clock.instant())
                .build();
    }

    /* ------------------------------------------------------------------ */
    /* Private: one chunk on a bounded pool                                 */
    /* ------------------------------------------------------------------ */

    /**
     * Scores {@code records[from, to)} on a {@code FixedThreadPool} no larger than
     * {@code maxConcurrency}. Each future uses {@code exceptionally} so one
     * unexpected failure cannot stop the others; outcomes keep input order.
     */
    private List<RecordOutcome> scoreChunk(List<InputRecord>  records,
                                           int                from,
                                           int                to,
                                           List<Predictor>    activePredictors,
                                           RetryPolicy        retryPolicy,
                                           CancellationToken  cancel) {
        int poolSize = Math.max(1, Math.min(props.getMaxConcurrency(), to - from));
        AtomicInteger threadSeq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "scoring-worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, tf);

        List<CompletableFuture<RecordOutcome>> futures = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            InputRecord record = records.get(i);
            int index = i;
            CompletableFuture<RecordOutcome> f = CompletableFuture
                    .supplyAsync(MdcPropagation.wrapSupplier(
                            () -> scoreRecord(record, index, activePredictors, retryPolicy, cancel)), executor)
                    .exceptionally(ex -> {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        log.error("[PIPELINE] record {} failed unexpectedly: {}", index, cause.getMessage(), cause);
                        return RecordOutcome.failed(error(record, describe(cause), false, 1));
                    });
            futures.add(f);
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[PIPELINE] Interrupted while scoring chunk [{}, {})", from, to);
        } catch (ExecutionException e) {
            // exceptionally() above completes every future normally
            log.error("[PIPELINE] Unexpected chunk failure: {}", e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }

        List<RecordOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            RecordOutcome o = futures.get(i).getNow(null);
            outcomes.add(o != null ? o : RecordOutcome.failed(cancelledError(records.get(from + i))));
        }
        return outcomes;
    }

    /* ------------------------------------------------------------------ */
    /* Private: single record                                               */
    /* ------------------------------------------------------------------ */

    private RecordOutcome scoreRecord(InputRecord       record,
                                      int               index,
                                      List<Predictor>   activePredictors,
                                      RetryPolicy       retryPolicy,
                                      CancellationToken cancel) {
        if (cancel.isCancelled()) {
            return RecordOutcome.failed(cancelledError(record));
        }
        FeatureVector features = featureExtractor.extract(record);
        Map<String, Double> scores = new LinkedHashMap<>();

        for (Predictor predictor : activePredictors) {
            RetryResult<Double> r = retryPolicy.execute(
                    "predictor " + predictor.getName(),
                    () -> checkedScore(predictor, features),
                    RETRYABLE,
                    cancel);
            if (metrics != null && r.getAttempts() > 1) {
                for (int i = 1; i < r.getAttempts(); i++) {
                    metrics.recordPredictorRetry();
                }
            }
            if (!r.isSuccess()) {
                boolean retryable = RETRYABLE.test(r.getError());
                log.warn("[PIPELINE] record {} ({}) failed on predictor '{}' after {} attempt(s): {}",
                         index, record.getEquipmentId(), predictor.getName(), r.getAttempts(), r.getErrorMessage());
                return RecordOutcome.failed(error(record, r.getErrorMessage(), retryable, r.getAttempts()));
            }
            scores.put(predictor.getName(), r.getValue());
        }

        String recordId = record.getEquipmentId() != null ? record.getEquipmentId() : "record-" + index;
        Instant ts = record.getTimestamp() != null ? record.getTimestamp() : clock.instant();

        return RecordOutcome.scored(PredictionResult.builder()
                .recordId(recordId)
                .timestamp(ts)
                .featureVector(features)
                .perPredictorScores(Collections.unmodifiableMap(scores))
                .ensembleScore(ensembleScore(scores.values()))
                .confidence(ensembleConfidence(scores.values()))
                .build());
    }

    private static double checkedScore(Predictor predictor, FeatureVector features) {
        PredictorScore result = predictor.predict(features);
        if (result == null) {
            throw PredictionException.permanent(predictor.getName() + " returned no score");
        }
        double score = result.getScore();
        if (!Double.isFinite(score) || score < 0.0 || score > 1.0) {
            throw PredictionException.permanent(predictor.getName() + " returned score out of [0,1]: " + score);
        }
        return score;
    }

    /** Everything except an explicitly permanent {@link PredictionException} is worth retrying. */
    private static final Predicate<Throwable> RETRYABLE =
            t -> !(t instanceof PredictionException) || ((PredictionException) t).isRetryable();

    /* ------------------------------------------------------------------ */
    /* Ensemble                                                              */
    /* ------------------------------------------------------------------ */

    static double ensembleScore(Collection<Double> scores) {
        if (scores.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double s : scores) sum += s;
        return sum / scores.size();
    }

    /** Agreement across predictors: {@code max(0, 1 - population stddev)}. */
    static double ensembleConfidence(Collection<Double> scores) {
        if (scores.size() <= 1) return 1.0;
        double mean = ensembleScore(scores);
        double variance = 0.0;
        for (double s : scores) variance += (s - mean) * (s - mean);
        variance /= scores.size();
        return Math.max(0.0, 1.0 - Math.sqrt(variance));
    }

    /* ------------------------------------------------------------------ */

    private ScoringError cancelledError(InputRecord record) {
        return error(record, ScoringError.CANCELLED, false, 0);
    }

    private ScoringError error(InputRecord record, String message, boolean retryable, int attempts) {
        return ScoringError.builder()
                .record(record)
                .errorMessage(message)
                .retryable(retryable)
                .attempts(attempts)
                .timestamp(clock.instant())
                .build();
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static final class RecordOutcome {
        final PredictionResult prediction;
        final ScoringError     error;

        private RecordOutcome(PredictionResult prediction, ScoringError error) {
            this.prediction = prediction;
            this.error      = error;
        }

        static RecordOutcome scored(PredictionResult p) {
            return new RecordOutcome(p, null);
        }

        static RecordOutcome failed(ScoringError e) {
            return new RecordOutcome(null, e);
        }
    }
}
