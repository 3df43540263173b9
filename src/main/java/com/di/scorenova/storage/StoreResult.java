package com.di.scorenova.storage;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class StoreResult {

    String lakePath;
    int recordCount;
    SerializationFormat format;
    long bytesWritten;
    String batchId;
    Instant storedAt;
    String workspaceId;
    String containerId;
}
