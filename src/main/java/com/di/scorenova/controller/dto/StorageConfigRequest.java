package com.di.scorenova.controller.dto;

import com.di.scorenova.storage.SerializationFormat;
import com.di.scorenova.storage.StorageConfig;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Partial lake settings for {@code POST /api/scoring/storage/configure}. Omitted
 * fields keep their current value. Accepts camelCase and snake_case.
 */
@Data
@NoArgsConstructor
public class StorageConfigRequest {
    @JsonAlias("workspace_id")
    private String workspaceId;
    @JsonAlias("container_id")
    private String containerId;
    @ToString.Exclude
    private String credential;
    @JsonAlias("base_path")
    private String basePath;
    private String format;

    public StorageConfig toStorageConfig() {
        return StorageConfig.builder()
                .workspaceId(workspaceId)
                .containerId(containerId)
                .credential(credential)
                .basePath(basePath)
                .format(format != null ? SerializationFormat.parse(format) : null)
                .build();
    }
}
