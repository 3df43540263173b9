package com.di.scorenova.storage;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Connection settings for the lake. Usable once workspace, container and
 * credential are all present.
 */
@Value
@Builder(toBuilder = true)
public class StorageConfig {

    public static final String DEFAULT_BASE_PATH = "predictions";

    /** Logical lake workspace / project. */
    String workspaceId;

    /** Container within the workspace; the bucket on GCS. */
    String containerId;

    /** Opaque credential reference. Never logged. */
    @ToString.Exclude
    String credential;

    String basePath;

    SerializationFormat format;

    public boolean isConfigured() {
        return notBlank(workspaceId) && notBlank(containerId) && notBlank(credential);
    }

    public String effectiveBasePath() {
        if (!notBlank(basePath)) return DEFAULT_BASE_PATH;
        String trimmed = basePath.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? DEFAULT_BASE_PATH : trimmed;
    }

    public SerializationFormat effectiveFormat() {
        return format != null ? format : SerializationFormat.JSONL;
    }

    /** Fields set in {@code update} win; null fields keep the current value. */
    public StorageConfig mergedWith(StorageConfig update) {
        if (update == null) return this;
        return toBuilder()
                .workspaceId(update.workspaceId != null ? update.workspaceId : workspaceId)
                .containerId(update.containerId != null ? update.containerId : containerId)
                .credential(update.credential != null ? update.credential : credential)
                .basePath(update.basePath != null ? update.basePath : basePath)
                .format(update.format != null ? update.format : format)
                .build();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
