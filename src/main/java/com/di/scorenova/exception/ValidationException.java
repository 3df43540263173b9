package com.di.scorenova.exception;

/**
 * Thrown when a caller hands the service input it cannot act on: an empty batch,
 * a pipeline without predictors, or a malformed schedule.
 *
 * <p>Fatal for the call only. Caught by {@link GlobalExceptionHandler}
 * and returned as a 400 Bad Request.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
