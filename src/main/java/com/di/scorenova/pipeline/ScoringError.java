package com.di.scorenova.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A record that could not be scored, with the last error seen.
 */
@Value
@Builder
public class ScoringError {

    public static final String CANCELLED = "cancelled";

    InputRecord record;
    String errorMessage;
    boolean retryable;
    int attempts;
    Instant timestamp;

    public boolean isCancelled() {
        return CANCELLED.equals(errorMessage);
    }
}
