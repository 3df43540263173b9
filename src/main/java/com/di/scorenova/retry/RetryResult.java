package com.di.scorenova.retry;

import lombok.Value;

/**
 * Outcome of {@link RetryPolicy#execute}: either a value or the last error, plus
 * the number of attempts that were made.
 */
@Value
public class RetryResult<T> {

    boolean success;
    T value;
    Throwable error;
    int attempts;

    static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(true, value, null, attempts);
    }

    static <T> RetryResult<T> failure(Throwable error, int attempts) {
        return new RetryResult<>(false, null, error, attempts);
    }

    public String getErrorMessage() {
        if (error == null) return null;
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
