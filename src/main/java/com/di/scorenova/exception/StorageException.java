package com.di.scorenova.exception;

/**
 * Lake read or write failure. The orchestrator records it on the run outcome
 * instead of discarding already computed predictions.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
