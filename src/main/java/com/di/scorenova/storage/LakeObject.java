package com.di.scorenova.storage;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Listing entry returned by a {@link LakeObjectStore}.
 */
@Value
@Builder
public class LakeObject {

    public static final String RECORD_COUNT = "recordCount";

    /** ISO-8601 timestamp of the newest reading in the object. */
    public static final String LATEST_READING = "latestReading";

    String path;
    long sizeBytes;
    Instant updatedAt;
    Map<String, String> metadata;

    /** Record count stamped at write time, or -1 if the object carries none. */
    public long recordCount() {
        String v = metadata != null ? metadata.get(RECORD_COUNT) : null;
        if (v == null) return -1;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** Newest reading stamped at write time; empty for objects written without it. */
    public Optional<Instant> latestReading() {
        String v = metadata != null ? metadata.get(LATEST_READING) : null;
        if (v == null) return Optional.empty();
        try {
            return Optional.of(Instant.parse(v));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
