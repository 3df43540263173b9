package com.di.scorenova.source;

import com.di.scorenova.exception.ConfigurationException;
import com.di.scorenova.pipeline.InputRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a batch from a local file on every load: either a JSON array of flat
 * objects, or JSON Lines (one object per line, chosen by a {@code .jsonl}
 * extension). Each object maps to an {@link InputRecord} via
 * {@link InputRecord#fromMap}.
 *
 * <pre>
 * [ { "equipmentId": "EQ0001", "timestamp": "2024-01-01T00:00:00Z",
 *     "temperature": 25.5, "vibration": 2.1, "pressure": 1013.25 }, … ]
 * </pre>
 */
@Slf4j
public class JsonFileRecordSource implements BatchRecordSource {

    private static final TypeReference<List<Map<String, Object>>> LIST_OF_OBJECTS = new TypeReference<>() { };
    private static final TypeReference<Map<String, Object>>       OBJECT          = new TypeReference<>() { };

    private final Path         path;
    private final ObjectMapper objectMapper;

    public JsonFileRecordSource(Path path, ObjectMapper objectMapper) {
        if (path == null) {
            throw new ConfigurationException("scorenova.source.path is required for the json-file source");
        }
        this.path         = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<InputRecord> loadBatch() {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Batch input file not found: " + path);
        }
        try {
            List<Map<String, Object>> rows = path.getFileName().toString().endsWith(".jsonl")
                    ? readLines()
                    : objectMapper.readValue(path.toFile(), LIST_OF_OBJECTS);
            List<InputRecord> records = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                records.add(InputRecord.fromMap(row));
            }
            log.info("[SOURCE] Loaded {} record(s) from {}", records.size(), path);
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read batch input " + path, e);
        }
    }

    private List<Map<String, Object>> readLines() throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                rows.add(objectMapper.readValue(line, OBJECT));
            }
        }
        return rows;
    }

    @Override
    public String describe() {
        return "json-file(" + path + ")";
    }
}
