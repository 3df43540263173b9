package com.di.scorenova.pipeline;

import com.di.scorenova.exception.ValidationException;
import com.di.scorenova.predictor.PredictorScore;
import com.di.scorenova.support.MutableClock;
import com.di.scorenova.support.StubPredictors;
import com.di.scorenova.support.StubPredictors.CountingPredictor;
import com.di.scorenova.support.TestMetrics;
import com.di.scorenova.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScoringPipeline Tests")
class ScoringPipelineTest {

    private ScoringPipelineProperties props;
    private MutableClock clock;
    private List<Long> sleeps;
    private ScoringPipeline pipeline;

    @BeforeEach
    void setUp() {
        props = new ScoringPipelineProperties();
        clock = MutableClock.at("2024-06-01T12:00:00Z");
        sleeps = new ArrayList<>();
        pipeline = new ScoringPipeline(props, TestMetrics.collector(), clock, ms -> {
            synchronized (sleeps) {
                sleeps.add(ms);
            }
        });
    }

    private static List<InputRecord> records(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> InputRecord.builder()
                        .equipmentId(String.format("EQ%04d", i + 1))
                        .timestamp(Instant.parse("2024-06-01T00:00:00Z").plusSeconds(i))
                        .field("temperature", 60.0 + i)
                        .field("vibration", 0.5)
                        .build())
                .collect(Collectors.toList());
    }

    // ============================================================================
    // Predictor registry
    // ============================================================================

    @Test
    @DisplayName("Should reject a duplicate predictor name")
    void testRegisterPredictor_Duplicate() {
        pipeline.registerPredictor(StubPredictors.fixed("A", 0.5));
        assertThrows(ValidationException.class, () -> pipeline.registerPredictor(StubPredictors.fixed("A", 0.1)));
        assertEquals(1, pipeline.getPredictorCount());
    }

    @Test
    @DisplayName("Should reject null and blank-named predictors")
    void testRegisterPredictor_Invalid() {
        assertThrows(ValidationException.class, () -> pipeline.registerPredictor(null));
        assertThrows(ValidationException.class, () -> pipeline.registerPredictor(StubPredictors.fixed(" ", 0.5)));
    }

    @Test
    @DisplayName("Should keep registration order and support unregistering")
    void testRegistry_OrderAndRemoval() {
        pipeline.registerPredictor(StubPredictors.fixed("B", 0.5));
        pipeline.registerPredictor(StubPredictors.fixed("A", 0.5));
        assertEquals(List.of("B", "A"), pipeline.getPredictorNames());

        assertTrue(pipeline.unregisterPredictor("B"));
        assertFalse(pipeline.unregisterPredictor("B"));
        assertEquals(List.of("A"), pipeline.getPredictorNames());
    }

    // ============================================================================
    // Validation
    // ============================================================================

    @Test
    @DisplayName("Should reject an empty batch")
    void testProcessBatch_Empty() {
        pipeline.registerPredictor(StubPredictors.fixed("A", 0.5));
        assertThrows(ValidationException.class, () -> pipeline.processBatch(List.of()));
        assertThrows(ValidationException.class, () -> pipeline.processBatch(null));
    }

    @Test
    @DisplayName("Should reject a batch when no predictor is registered")
    void testProcessBatch_NoPredictors() {
        assertThrows(ValidationException.class, () -> pipeline.processBatch(records(1)));
    }

    // ============================================================================
    // Scoring and ensemble
    // ============================================================================

    @Test
    @DisplayName("Should score every record with a single constant predictor")
    void testProcessBatch_SinglePredictor() {
        pipeline.registerPredictor(StubPredictors.fixed("constant", 0.8));

        BatchScoringResult result = pipeline.processBatch(records(3));

        assertEquals(3, result.getPredictions().size());
        assertTrue(result.getErrors().isEmpty());
        for (PredictionResult p : result.getPredictions()) {
            assertEquals(0.8, p.getEnsembleScore(), 1e-12);
            assertEquals(1.0, p.getConfidence(), 1e-12);
            assertEquals(5, p.getFeatureVector().length());
        }
        BatchSummary s = result.getSummary();
        assertEquals(3, s.getTotalRecords());
        assertEquals(1.0, s.getSuccessRate());
        assertTrue(s.isSlaCompliant());
        assertTrue(s.getProcessingTimeMs() >= 1);
        assertEquals(List.of("constant"), s.getPredictorsUsed());
    }

    @Test
    @DisplayName("Should average predictor scores and derive confidence from their spread")
    void testProcessBatch_Ensemble() {
        pipeline.registerPredictor(StubPredictors.fixed("low", 0.2));
        pipeline.registerPredictor(StubPredictors.fixed("high", 0.6));

        PredictionResult p = pipeline.processBatch(records(1)).getPredictions().get(0);

        assertEquals(0.4, p.getEnsembleScore(), 1e-12);
        assertEquals(0.8, p.getConfidence(), 1e-12);
        assertEquals(List.of("low", "high"), new ArrayList<>(p.getPerPredictorScores().keySet()));
    }

    @Test
    @DisplayName("Should clamp ensemble confidence at zero")
    void testEnsembleConfidence_NeverNegative() {
        assertEquals(1.0, ScoringPipeline.ensembleConfidence(List.of(0.3)));
        assertEquals(0.5, ScoringPipeline.ensembleConfidence(List.of(0.0, 1.0)), 1e-12);
        assertTrue(ScoringPipeline.ensembleConfidence(List.of(0.0, 1.0, 0.0, 1.0)) >= 0.0);
    }

    @Test
    @DisplayName("Should keep input order and derive ids for records without equipmentId")
    void testProcessBatch_OrderAndDerivedIds() {
        pipeline.registerPredictor(StubPredictors.randomized("rnd", 7L));
        List<InputRecord> input = new ArrayList<>(records(20));
        input.add(InputRecord.builder().field("rpm", 1500.0).build());
        props.setMaxConcurrency(4);

        BatchScoringResult result = pipeline.processBatch(input, 6);

        assertEquals(21, result.getPredictions().size());
        assertEquals("EQ0001", result.getPredictions().get(0).getRecordId());
        assertEquals("EQ0020", result.getPredictions().get(19).getRecordId());
        assertEquals("record-20", result.getPredictions().get(20).getRecordId());
        assertEquals(clock.instant(), result.getPredictions().get(20).getTimestamp());
        assertEquals(4, result.getSummary().getChunkCount());
        result.getPredictions().forEach(p -> assertTrue(p.getEnsembleScore() >= 0 && p.getEnsembleScore() <= 1));
    }

    @Test
    @DisplayName("Should never run more predictor calls at once than maxConcurrency")
    void testProcessBatch_ConcurrencyBound() {
        props.setMaxConcurrency(3);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        pipeline.registerPredictor(new CountingPredictor("slow", f -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return PredictorScore.of(0.5);
        }));

        BatchScoringResult result = pipeline.processBatch(records(30));

        assertEquals(30, result.getPredictions().size());
        assertTrue(peak.get() <= 3, "peak concurrency " + peak.get());
    }

    // ============================================================================
    // Failures and retries
    // ============================================================================

    @Test
    @DisplayName("Should retry transient predictor failures with exponential backoff")
    void testProcessBatch_TransientRetried() {
        props.setMaxConcurrency(1);
        CountingPredictor flaky = StubPredictors.flaky("flaky", 2, 0.3);
        pipeline.registerPredictor(flaky);

        BatchScoringResult result = pipeline.processBatch(records(1));

        assertEquals(1, result.getPredictions().size());
        assertEquals(3, flaky.getCalls());
        assertEquals(List.of(200L, 400L), sleeps);
    }

    @Test
    @DisplayName("Should fail a record after retryAttempts transient failures")
    void testProcessBatch_RetriesExhausted() {
        CountingPredictor down = StubPredictors.alwaysFailing("down");
        pipeline.registerPredictor(down);

        BatchScoringResult result = pipeline.processBatch(records(2));

        assertTrue(result.getPredictions().isEmpty());
        assertEquals(2, result.getErrors().size());
        for (ScoringError e : result.getErrors()) {
            assertEquals(3, e.getAttempts());
            assertTrue(e.isRetryable());
        }
        assertEquals(6, down.getCalls());
    }

    @Test
    @DisplayName("Should make exactly one attempt for a permanent predictor failure")
    void testProcessBatch_PermanentNotRetried() {
        CountingPredictor broken = StubPredictors.permanentlyFailing("broken");
        pipeline.registerPredictor(broken);

        BatchScoringResult result = pipeline.processBatch(records(1));

        ScoringError e = result.getErrors().get(0);
        assertEquals(1, e.getAttempts());
        assertFalse(e.isRetryable());
        assertEquals(1, broken.getCalls());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should reject out-of-range scores without retrying")
    void testProcessBatch_OutOfRangeScore() {
        pipeline.registerPredictor(StubPredictors.fixed("wild", 1.5));

        ScoringError e = pipeline.processBatch(records(1)).getErrors().get(0);

        assertEquals(1, e.getAttempts());
        assertTrue(e.getErrorMessage().contains("out of [0,1]"));
    }

    @Test
    @DisplayName("Should account for every record as either a prediction or an error")
    void testProcessBatch_Conservation() {
        AtomicInteger calls = new AtomicInteger();
        pipeline.registerPredictor(new CountingPredictor("odd", f -> {
            if (calls.incrementAndGet() % 2 == 0) {
                throw new IllegalStateException("even call");
            }
            return PredictorScore.of(0.4);
        }));
        props.setRetryAttempts(1);

        BatchScoringResult result = pipeline.processBatch(records(25), 10);

        assertEquals(25, result.getPredictions().size() + result.getErrors().size());
        assertEquals(result.getErrors().size(), result.getSummary().getFailedPredictions());
        assertEquals((double) result.getPredictions().size() / 25, result.getSummary().getSuccessRate(), 1e-12);
    }

    // ============================================================================
    // SLA and cancellation
    // ============================================================================

    @Test
    @DisplayName("Should flag a batch that exceeds the SLA threshold")
    void testProcessBatch_SlaBreach() {
        props.setMaxConcurrency(1);
        pipeline.registerPredictor(new CountingPredictor("slow", f -> {
            clock.advance(Duration.ofMinutes(31));
            return PredictorScore.of(0.5);
        }));

        BatchSummary s = pipeline.processBatch(records(1)).getSummary();

        assertFalse(s.isSlaCompliant());
        assertTrue(s.getProcessingTimeMs() >= Duration.ofMinutes(31).toMillis());
    }

    @Test
    @DisplayName("Should report unscored records as cancelled once the token is cancelled")
    void testProcessBatch_Cancelled() {
        CancellationToken token = CancellationToken.create();
        props.setMaxConcurrency(1);
        pipeline.registerPredictor(new CountingPredictor("cancelling", f -> {
            token.cancel();
            return PredictorScore.of(0.5);
        }));

        BatchScoringResult result = pipeline.processBatch(records(3), 1, token);

        assertEquals(1, result.getPredictions().size());
        assertEquals(2, result.getErrors().size());
        assertTrue(result.getErrors().stream().allMatch(ScoringError::isCancelled));
        assertTrue(result.getSummary().isCancelled());
    }

    @Test
    @DisplayName("Should score nothing with an already cancelled token")
    void testProcessBatch_CancelledUpFront() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        CountingPredictor p = StubPredictors.fixed("p", 0.5);
        pipeline.registerPredictor(p);

        BatchScoringResult result = pipeline.processBatch(records(4), 2, token);

        assertEquals(4, result.getErrors().size());
        assertEquals(0, p.getCalls());
    }
}
