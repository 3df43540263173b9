package com.di.scorenova.storage;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only summary of what the connector has on the lake under its base path.
 */
@Value
@Builder
public class StorageInfo {

    String workspaceId;
    String containerId;
    String basePath;
    SerializationFormat format;
    long totalSizeBytes;
    long totalRecords;
    long objectCount;

    /** Null when nothing has been written. */
    Instant lastUpdate;

    /** One entry per hourly partition, oldest first. */
    List<Partition> partitions;

    @Value
    @Builder
    public static class Partition {
        /** {@code year=YYYY/month=MM/day=DD/hour=HH}. */
        String key;
        Instant hour;
        int objects;
        long records;
        long sizeBytes;
    }
}
