package com.di.scorenova.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Lake connection and backend selection.
 *
 * <pre>
 * scorenova:
 *   storage:
 *     backend: memory          # memory | gcs
 *     workspace-id: my-project
 *     container-id: my-bucket
 *     credential: adc
 *     base-path: predictions
 *     format: jsonl            # jsonl | json
 *     gcs:
 *       project-id: my-project
 * </pre>
 *
 * The connector stays unconfigured until workspace, container and credential are set,
 * either here or through {@code LakeStorageConnector.configure}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "scorenova.storage")
public class LakeStorageProperties {

    private String backend = "memory";

    private String workspaceId;

    private String containerId;

    private String credential;

    private String basePath = StorageConfig.DEFAULT_BASE_PATH;

    private String format = "jsonl";

    private Gcs gcs = new Gcs();

    @Data
    public static class Gcs {
        /** Empty means the project from Application Default Credentials. */
        private String projectId;
    }

    public StorageConfig toStorageConfig() {
        return StorageConfig.builder()
                .workspaceId(workspaceId)
                .containerId(containerId)
                .credential(credential)
                .basePath(basePath)
                .format(SerializationFormat.parse(format))
                .build();
    }
}
