package com.di.scorenova.predictor;

/**
 * Failure raised by a {@link Predictor} for a single record.
 *
 * <p>The {@link #isRetryable()} flag drives the pipeline's retry decision:
 * transient failures are retried with backoff, permanent ones fail the record
 * after one attempt. Never escapes a batch.
 */
public class PredictionException extends RuntimeException {

    private final boolean retryable;

    public PredictionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PredictionException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static PredictionException transientFailure(String message) {
        return new PredictionException(message, true);
    }

    public static PredictionException permanent(String message) {
        return new PredictionException(message, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
