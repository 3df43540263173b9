package com.di.scorenova.storage;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a Google Cloud Storage client bean backed by
 * Application Default Credentials (ADC) when the GCS lake backend is selected.
 */
@Configuration
@ConditionalOnProperty(name = "scorenova.storage.backend", havingValue = "gcs")
public class LakeStorageConfig {

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    public Storage gcsStorage(LakeStorageProperties props) {
        String projectId = props.getGcs().getProjectId();
        if (projectId == null || projectId.isBlank()) {
            return StorageOptions.getDefaultInstance().getService();
        }
        return StorageOptions.newBuilder().setProjectId(projectId).build().getService();
    }
}
