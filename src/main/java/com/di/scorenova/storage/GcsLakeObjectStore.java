package com.di.scorenova.storage;

import com.di.scorenova.exception.StorageException;
import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google Cloud Storage backend. The lake container is the bucket; object paths are
 * used as blob names unchanged.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "scorenova.storage.backend", havingValue = "gcs")
public class GcsLakeObjectStore implements LakeObjectStore {

    private final Storage storage;

    public GcsLakeObjectStore(Storage storage) {
        this.storage = storage;
    }

    @Override
    public void put(String bucket, String path, byte[] content, String contentType, Map<String, String> metadata) {
        String gcsPath = gcsUri(bucket, path);
        try {
            BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, path))
                    .setContentType(contentType)
                    .setMetadata(metadata)
                    .build();
            storage.create(blobInfo, content);
            log.debug("[LAKE-GCS] wrote {} bytes → {}", content.length, gcsPath);
        } catch (Exception e) {
            throw new StorageException("Failed to write " + gcsPath, e);
        }
    }

    @Override
    public List<LakeObject> list(String bucket, String prefix) {
        try {
            Page<Blob> page = storage.list(bucket, Storage.BlobListOption.prefix(prefix == null ? "" : prefix));
            List<LakeObject> out = new ArrayList<>();
            for (Blob blob : page.iterateAll()) {
                out.add(LakeObject.builder()
                        .path(blob.getName())
                        .sizeBytes(blob.getSize() != null ? blob.getSize() : 0L)
                        .updatedAt(toInstant(blob.getUpdateTimeOffsetDateTime()))
                        .metadata(blob.getMetadata() != null ? blob.getMetadata() : Map.of())
                        .build());
            }
            return out;
        } catch (Exception e) {
            throw new StorageException("Failed to list " + gcsUri(bucket, prefix), e);
        }
    }

    @Override
    public byte[] read(String bucket, String path) {
        String gcsPath = gcsUri(bucket, path);
        Blob blob;
        try {
            blob = storage.get(BlobId.of(bucket, path));
        } catch (Exception e) {
            throw new StorageException("Failed to read " + gcsPath, e);
        }
        if (blob == null || !blob.exists()) {
            throw new StorageException("Object not found: " + gcsPath);
        }
        try {
            byte[] bytes = blob.getContent();
            log.debug("[LAKE-GCS] read {} bytes from {}", bytes.length, gcsPath);
            return bytes;
        } catch (Exception e) {
            throw new StorageException("Failed to read " + gcsPath, e);
        }
    }

    @Override
    public String backendName() {
        return "gcs";
    }

    private static Instant toInstant(OffsetDateTime t) {
        return t != null ? t.toInstant() : null;
    }

    private static String gcsUri(String bucket, String path) {
        return "gs://" + bucket + "/" + (path == null ? "" : path);
    }
}
