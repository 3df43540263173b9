package com.di.scorenova.retry;

import com.di.scorenova.util.CancellationToken;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff, shared by the scoring pipeline
 * (per-predictor calls) and the job scheduler (job callbacks).
 *
 * <pre>
 *   attempt 1 ── fail ──▶ sleep base × 2¹ ──▶ attempt 2 ── fail ──▶ sleep base × 2² ──▶ …
 * </pre>
 *
 * <p>{@code maxAttempts} counts every call including the first, so a
 * non-retryable failure costs exactly one attempt and a retryable one at most
 * {@code maxAttempts}. Delays are capped at {@code maxDelayMs}; an optional
 * jitter adds up to {@code jitterRatio × delay} on top.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    long baseDelayMs = 100;

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    long maxDelayMs = 60_000;

    /** 0 disables jitter. */
    @Builder.Default
    double jitterRatio = 0.0;

    @Builder.Default
    Sleeper sleeper = Thread::sleep;

    /** Blocking pause between attempts; swapped out in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    /**
     * Delay before the attempt that follows failed attempt {@code attempt} (1-based).
     */
    public long delayAfterAttempt(int attempt) {
        double raw = baseDelayMs * Math.pow(multiplier, attempt);
        long delay = (long) Math.min(raw, (double) maxDelayMs);
        if (jitterRatio > 0 && delay > 0) {
            long bound = (long) (delay * jitterRatio);
            if (bound > 0) {
                delay = Math.min(delay + ThreadLocalRandom.current().nextLong(bound), maxDelayMs);
            }
        }
        return Math.max(delay, 0);
    }

    public <T> RetryResult<T> execute(String operation, Callable<T> action, Predicate<Throwable> retryable) {
        return execute(operation, action, retryable, CancellationToken.none());
    }

    /**
     * Runs {@code action} until it succeeds, fails with a non-retryable error,
     * runs out of attempts, or {@code token} is cancelled. Never throws for a
     * failure of {@code action}; the outcome carries the last error instead.
     */
    public <T> RetryResult<T> execute(String operation,
                                      Callable<T> action,
                                      Predicate<Throwable> retryable,
                                      CancellationToken token) {
        int limit = Math.max(1, maxAttempts);
        Throwable lastError = null;
        int attempt = 0;

        while (attempt < limit) {
            attempt++;
            try {
                T value = action.call();
                return RetryResult.success(value, attempt);
            } catch (Exception ex) {
                lastError = ex;
                if (!retryable.test(ex)) {
                    log.debug("[RETRY] {} failed with non-retryable error on attempt {}: {}",
                              operation, attempt, ex.getMessage());
                    return RetryResult.failure(ex, attempt);
                }
                if (attempt >= limit) {
                    break;
                }
                if (token.isCancelled()) {
                    log.info("[RETRY] {} cancelled after attempt {}", operation, attempt);
                    break;
                }
                long delay = delayAfterAttempt(attempt);
                log.warn("[RETRY] {} failed (attempt {}/{}), retrying in {} ms: {}",
                         operation, attempt, limit, delay, ex.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[RETRY] {} interrupted during backoff after attempt {}", operation, attempt);
                    break;
                }
            }
        }
        return RetryResult.failure(lastError, attempt);
    }
}
