package com.di.scorenova.pipeline;

import com.di.scorenova.exception.ValidationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One unit of input to be scored: an equipment reading with named numeric fields.
 */
@Value
@Builder
public class InputRecord {

    public static final String EQUIPMENT_ID = "equipmentId";
    public static final String TIMESTAMP    = "timestamp";

    private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    /** May be null; the pipeline then derives a positional record id. */
    String equipmentId;

    /** May be null; the pipeline then stamps the scoring instant. */
    Instant timestamp;

    @Singular
    Map<String, Double> fields;

    /**
     * Builds a record from a loosely-typed map such as a parsed JSON object.
     * {@code equipmentId} and {@code timestamp} (ISO-8601) are lifted out; every
     * other entry that is numeric, or a string holding a decimal number, becomes a
     * field. Everything else is ignored.
     *
     * @throws ValidationException if {@code timestamp} is present but not a valid instant
     */
    public static InputRecord fromMap(Map<String, ?> raw) {
        InputRecordBuilder builder = InputRecord.builder();
        if (raw == null) {
            return builder.build();
        }
        raw.forEach((key, value) -> {
            if (value == null) return;
            if (EQUIPMENT_ID.equals(key)) {
                builder.equipmentId(String.valueOf(value));
            } else if (TIMESTAMP.equals(key)) {
                builder.timestamp(parseInstant(value));
            } else if (value instanceof Number) {
                builder.field(key, ((Number) value).doubleValue());
            } else if (value instanceof String && NUMERIC.matcher((String) value).matches()) {
                builder.field(key, Double.parseDouble((String) value));
            }
        });
        return builder.build();
    }

    private static Instant parseInstant(Object value) {
        if (value instanceof Instant) return (Instant) value;
        if (value instanceof Number) return Instant.ofEpochMilli(((Number) value).longValue());
        try {
            return Instant.parse(String.valueOf(value));
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid timestamp '" + value + "'; expected ISO-8601 or epoch millis", e);
        }
    }
}
