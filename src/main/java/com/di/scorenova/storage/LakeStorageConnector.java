package com.di.scorenova.storage;

import com.di.scorenova.exception.ConfigurationException;
import com.di.scorenova.exception.StorageException;
import com.di.scorenova.exception.ValidationException;
import com.di.scorenova.pipeline.PredictionResult;
import com.di.scorenova.util.MetricsCollector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Writes prediction batches to the lake and reads them back.
 *
 * <pre>
 *   storePredictions(batch)
 *     PredictionResult ──▶ StoredPredictionRecord ──▶ jsonl | json bytes
 *     path = {basePath}/year=YYYY/month=MM/day=DD/hour=HH/batch_{batchId}.{format}   (UTC, write time)
 *     LakeObjectStore.put(containerId, path, bytes)
 * </pre>
 *
 * <p>Every operation except {@link #configure} and {@link #isConfigured} requires
 * a configured connection and otherwise fails with {@link ConfigurationException}
 * before touching the store.
 *
 * <h3>Delivery and consistency</h3>
 * Writes are at-least-once: a retried write with the same batch id within the same
 * hour overwrites the same object, one in a later hour creates a duplicate that
 * readers must tolerate. Reads see a write as soon as {@code put} returns on both
 * shipped backends; other object stores may list new objects eventually.
 */
@Slf4j
@Service
public class LakeStorageConnector {

    private final LakeObjectStore  store;
    private final MetricsCollector metrics;
    private final Clock            clock;
    private final ObjectMapper     objectMapper;

    private volatile StorageConfig config;

    @Autowired
    public LakeStorageConnector(LakeObjectStore store, LakeStorageProperties props, MetricsCollector metrics) {
        this(store, props.toStorageConfig(), metrics, Clock.systemUTC());
    }

    public LakeStorageConnector(LakeObjectStore  store,
                                StorageConfig    initialConfig,
                                MetricsCollector metrics,
                                Clock            clock) {
        this.store        = store;
        this.config       = initialConfig != null ? initialConfig : StorageConfig.builder().build();
        this.metrics      = metrics;
        this.clock        = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("[LAKE] Connector on '{}' backend, configured={}", store.backendName(), config.isConfigured());
    }

    /* ------------------------------------------------------------------ */
    /* Configuration                                                        */
    /* ------------------------------------------------------------------ */

    /**
     * Merges the non-null fields of {@code update} over the current configuration.
     * An incomplete result is accepted and simply leaves the connector unconfigured.
     *
     * @return whether the connector is now usable
     */
    public synchronized boolean configure(StorageConfig update) {
        if (update == null) {
            throw new ValidationException("Storage configuration must not be null");
        }
        this.config = config.mergedWith(update);
        boolean ok = config.isConfigured();
        log.info("[LAKE] Configured workspace={} container={} basePath={} format={} → usable={}",
                 config.getWorkspaceId(), config.getContainerId(), config.effectiveBasePath(),
                 config.effectiveFormat().extension(), ok);
        return ok;
    }

    public boolean isConfigured() {
        return config.isConfigured();
    }

    public StorageConfig getConfig() {
        return config;
    }

    public String getBackendName() {
        return store.backendName();
    }

    /* ------------------------------------------------------------------ */
    /* Write                                                                */
    /* ------------------------------------------------------------------ */

    /**
     * Serialises the batch and writes it as one object under the current UTC hour.
     *
     * @throws ConfigurationException if the connector is not configured
     * @throws ValidationException    if the batch or its prediction list is null
     * @throws StorageException       if serialisation or the write fails
     */
    public StoreResult storePredictions(PredictionBatch batch) {
        StorageConfig cfg = requireConfigured();
        if (batch == null || batch.getPredictions() == null) {
            throw new ValidationException("Prediction batch with a prediction list is required");
        }

        Instant writtenAt = clock.instant();
        String  batchId   = batch.getBatchId() != null && !batch.getBatchId().isBlank()
                ? batch.getBatchId()
                : generateBatchId(writtenAt);
        SerializationFormat format = cfg.effectiveFormat();
        String path = PartitionPathResolver.objectPath(cfg.effectiveBasePath(), writtenAt, batchId, format);

        StoredPredictionRecord.Metadata meta = StoredPredictionRecord.Metadata.builder()
                .batchId(batchId)
                .modelVersion(batch.getModelVersion() != null ? batch.getModelVersion() : PredictionBatch.DEFAULT_MODEL_VERSION)
                .processingTime(writtenAt)
                .runId(batch.getRunId())
                .build();
        List<StoredPredictionRecord> records = new ArrayList<>(batch.getPredictions().size());
        for (PredictionResult p : batch.getPredictions()) {
            records.add(toStoredRecord(p, meta));
        }

        byte[] bytes;
        try {
            bytes = serialize(records, format);
        } catch (IOException e) {
            if (metrics != null) metrics.recordLakeWriteError();
            throw new StorageException("Failed to serialise batch " + batchId, e);
        }

        Map<String, String> objectMetadata = new HashMap<>();
        objectMetadata.put(LakeObject.RECORD_COUNT, String.valueOf(records.size()));
        objectMetadata.put("batchId", batchId);
        latestReading(records).ifPresent(ts -> objectMetadata.put(LakeObject.LATEST_READING, ts.toString()));

        try {
            store.put(cfg.getContainerId(), path, bytes, format.getContentType(), objectMetadata);
        } catch (StorageException e) {
            if (metrics != null) metrics.recordLakeWriteError();
            throw e;
        } catch (RuntimeException e) {
            if (metrics != null) metrics.recordLakeWriteError();
            throw new StorageException("Failed to write " + path, e);
        }
        if (metrics != null) metrics.recordLakeWrite(bytes.length);

        log.info("[LAKE] Stored {} predictions ({} bytes) → {}/{}",
                 records.size(), bytes.length, cfg.getContainerId(), path);

        return StoreResult.builder()
                .lakePath(path)
                .recordCount(records.size())
                .format(format)
                .bytesWritten(bytes.length)
                .batchId(batchId)
                .storedAt(writtenAt)
                .workspaceId(cfg.getWorkspaceId())
                .containerId(cfg.getContainerId())
                .build();
    }

    static StoredPredictionRecord toStoredRecord(PredictionResult p, StoredPredictionRecord.Metadata meta) {
        double[] features = p.getFeatureVector() != null ? p.getFeatureVector().toArray() : new double[0];
        return StoredPredictionRecord.builder()
                .equipmentId(p.getRecordId())
                .timestamp(p.getTimestamp())
                .failureProbability(p.getEnsembleScore())
                .confidence(p.getConfidence())
                .features(Arrays.stream(features).boxed().toList())
                .modelPredictions(p.getPerPredictorScores() != null ? p.getPerPredictorScores() : Map.of())
                .metadata(meta)
                .build();
    }

    /** Null timestamps never match a start date, so they do not count. */
    private static Optional<Instant> latestReading(List<StoredPredictionRecord> records) {
        return records.stream()
                .map(StoredPredictionRecord::getTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
    }

    private byte[] serialize(List<StoredPredictionRecord> records, SerializationFormat format) throws IOException {
        if (format == SerializationFormat.JSON) {
            return objectMapper.writeValueAsBytes(records);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (StoredPredictionRecord r : records) {
            out.write(objectMapper.writeValueAsBytes(r));
            out.write('\n');
        }
        return out.toByteArray();
    }

    private static String generateBatchId(Instant at) {
        return at.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    /* ------------------------------------------------------------------ */
    /* Read                                                                 */
    /* ------------------------------------------------------------------ */

    /**
     * Reads stored predictions matching {@code query}, newest first.
     *
     * <p>Readings carry caller-supplied timestamps that may lie after the hour the
     * object was written in, so the partition path says nothing about them. An
     * object is skipped unread only when its {@code latestReading} metadata is
     * before {@code startDate}. Objects that cannot be parsed are skipped and
     * listed in {@link QueryResult.Metadata#getUnreadableObjects()}.
     *
     * @throws ConfigurationException if the connector is not configured
     * @throws StorageException       if listing or reading fails
     */
    public QueryResult retrievePredictions(PredictionQuery query) {
        StorageConfig cfg = requireConfigured();
        PredictionQuery q = query != null ? query : PredictionQuery.all();

        List<LakeObject> objects = store.list(cfg.getContainerId(), cfg.effectiveBasePath() + "/");
        List<StoredPredictionRecord> matches = new ArrayList<>();
        List<String> unreadable = new ArrayList<>();
        int pruned = 0;
        for (LakeObject obj : objects) {
            SerializationFormat format = SerializationFormat.fromPath(obj.getPath());
            if (format == null) {
                continue;
            }
            if (q.getStartDate() != null) {
                Optional<Instant> latest = obj.latestReading();
                if (latest.isPresent() && latest.get().isBefore(q.getStartDate())) {
                    pruned++;
                    continue;
                }
            }
            List<StoredPredictionRecord> records;
            try {
                records = deserialize(store.read(cfg.getContainerId(), obj.getPath()), format);
            } catch (JsonProcessingException e) {
                log.warn("[LAKE] Skipping corrupt lake object {}: {}", obj.getPath(), e.getOriginalMessage());
                unreadable.add(obj.getPath());
                continue;
            } catch (IOException e) {
                throw new StorageException("Failed to read lake object " + obj.getPath(), e);
            }
            for (StoredPredictionRecord r : records) {
                if (matches(r, q)) {
                    matches.add(r);
                }
            }
        }

        matches.sort(NEWEST_FIRST);
        int total = matches.size();
        List<StoredPredictionRecord> page = List.copyOf(matches.subList(0, Math.min(total, q.effectiveLimit())));
        log.debug("[LAKE] Query matched {} record(s), returning {}, pruned {} object(s), {} unreadable",
                  total, page.size(), pruned, unreadable.size());

        return QueryResult.builder()
                .predictions(page)
                .metadata(QueryResult.Metadata.builder()
                        .totalRecords(total)
                        .returnedRecords(page.size())
                        .unreadableObjects(List.copyOf(unreadable))
                        .query(q)
                        .retrievedAt(clock.instant())
                        .build())
                .build();
    }

    private static final Comparator<StoredPredictionRecord> NEWEST_FIRST =
            Comparator.comparing(StoredPredictionRecord::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()))
                      .thenComparing(StoredPredictionRecord::getEquipmentId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static boolean matches(StoredPredictionRecord r, PredictionQuery q) {
        Instant ts = r.getTimestamp();
        if (q.getStartDate() != null && (ts == null || ts.isBefore(q.getStartDate()))) return false;
        if (q.getEndDate() != null && (ts == null || ts.isAfter(q.getEndDate()))) return false;
        if (q.getEquipmentIds() != null && !q.getEquipmentIds().isEmpty()
                && !q.getEquipmentIds().contains(r.getEquipmentId())) return false;
        if (q.getModelNames() != null && !q.getModelNames().isEmpty()) {
            Map<String, Double> scores = r.getModelPredictions();
            if (scores == null) return false;
            return q.getModelNames().stream().anyMatch(scores::containsKey);
        }
        return true;
    }

    private List<StoredPredictionRecord> deserialize(byte[] bytes, SerializationFormat format) throws IOException {
        if (format == SerializationFormat.JSON) {
            return Arrays.asList(objectMapper.readValue(bytes, StoredPredictionRecord[].class));
        }
        List<StoredPredictionRecord> out = new ArrayList<>();
        for (String line : new String(bytes, StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) {
                out.add(objectMapper.readValue(line, StoredPredictionRecord.class));
            }
        }
        return out;
    }

    /* ------------------------------------------------------------------ */
    /* Info                                                                 */
    /* ------------------------------------------------------------------ */

    /**
     * Sizes, record counts and hourly partitions under the base path. Record counts
     * come from object metadata written alongside each batch.
     *
     * @throws ConfigurationException if the connector is not configured
     */
    public StorageInfo getStorageInfo() {
        StorageConfig cfg = requireConfigured();
        List<LakeObject> objects = store.list(cfg.getContainerId(), cfg.effectiveBasePath() + "/");

        Map<String, PartitionTally> partitions = new TreeMap<>();
        long totalBytes = 0;
        long totalRecords = 0;
        Instant lastUpdate = null;
        for (LakeObject obj : objects) {
            long records = Math.max(0, obj.recordCount());
            totalBytes   += obj.getSizeBytes();
            totalRecords += records;
            if (obj.getUpdatedAt() != null && (lastUpdate == null || obj.getUpdatedAt().isAfter(lastUpdate))) {
                lastUpdate = obj.getUpdatedAt();
            }
            String key = PartitionPathResolver.partitionKey(obj.getPath());
            if (key != null) {
                PartitionTally t = partitions.computeIfAbsent(key, k -> new PartitionTally(
                        PartitionPathResolver.partitionHour(obj.getPath()).orElse(null)));
                t.objects++;
                t.records += records;
                t.bytes   += obj.getSizeBytes();
            }
        }

        List<StorageInfo.Partition> partitionList = new ArrayList<>(partitions.size());
        partitions.forEach((key, t) -> partitionList.add(StorageInfo.Partition.builder()
                .key(key)
                .hour(t.hour)
                .objects(t.objects)
                .records(t.records)
                .sizeBytes(t.bytes)
                .build()));

        return StorageInfo.builder()
                .workspaceId(cfg.getWorkspaceId())
                .containerId(cfg.getContainerId())
                .basePath(cfg.effectiveBasePath())
                .format(cfg.effectiveFormat())
                .totalSizeBytes(totalBytes)
                .totalRecords(totalRecords)
                .objectCount(objects.size())
                .lastUpdate(lastUpdate)
                .partitions(List.copyOf(partitionList))
                .build();
    }

    /* ------------------------------------------------------------------ */

    private StorageConfig requireConfigured() {
        StorageConfig cfg = config;
        if (!cfg.isConfigured()) {
            throw new ConfigurationException(
                    "Lake storage not configured: workspaceId, containerId and credential are required");
        }
        return cfg;
    }

    private static final class PartitionTally {
        final Instant hour;
        int  objects;
        long records;
        long bytes;

        PartitionTally(Instant hour) {
            this.hour = hour;
        }
    }
}
