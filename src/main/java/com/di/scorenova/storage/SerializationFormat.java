package com.di.scorenova.storage;

import com.di.scorenova.exception.ValidationException;

import java.util.Locale;

/**
 * On-lake encodings for a prediction batch. The enum name in lower case is the
 * file extension.
 */
public enum SerializationFormat {

    /** One JSON object per line. */
    JSONL("application/x-ndjson"),

    /** A single JSON array. */
    JSON("application/json");

    private final String contentType;

    SerializationFormat(String contentType) {
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }

    public String extension() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SerializationFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return JSONL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported serialization format '" + value + "'; expected jsonl or json", e);
        }
    }

    /** Format implied by an object path's extension, or null if none matches. */
    static SerializationFormat fromPath(String path) {
        for (SerializationFormat f : values()) {
            if (path.endsWith("." + f.extension())) {
                return f;
            }
        }
        return null;
    }
}
