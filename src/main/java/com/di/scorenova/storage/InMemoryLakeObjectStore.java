package com.di.scorenova.storage;

import com.di.scorenova.exception.StorageException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of LakeObjectStore. Suitable for single-node and testing.
 * When scorenova.storage.backend=gcs, GcsLakeObjectStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "scorenova.storage.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryLakeObjectStore implements LakeObjectStore {

    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLakeObjectStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLakeObjectStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String container, String path, byte[] content, String contentType, Map<String, String> metadata) {
        if (container == null || path == null || content == null) {
            throw new StorageException("container, path and content are required");
        }
        objects.put(key(container, path), new StoredObject(container, path, content.clone(),
                metadata != null ? Map.copyOf(metadata) : Map.of(), clock.instant()));
    }

    @Override
    public List<LakeObject> list(String container, String prefix) {
        List<LakeObject> out = new ArrayList<>();
        for (StoredObject o : objects.values()) {
            if (o.container.equals(container) && (prefix == null || o.path.startsWith(prefix))) {
                out.add(LakeObject.builder()
                        .path(o.path)
                        .sizeBytes(o.content.length)
                        .updatedAt(o.updatedAt)
                        .metadata(o.metadata)
                        .build());
            }
        }
        out.sort(Comparator.comparing(LakeObject::getPath));
        return out;
    }

    @Override
    public byte[] read(String container, String path) {
        StoredObject o = objects.get(key(container, path));
        if (o == null) {
            throw new StorageException("Object not found: " + container + "/" + path);
        }
        return o.content.clone();
    }

    @Override
    public String backendName() {
        return "memory";
    }

    public int size() {
        return objects.size();
    }

    private static String key(String container, String path) {
        return container + "/" + path;
    }

    private static final class StoredObject {
        final String              container;
        final String              path;
        final byte[]              content;
        final Map<String, String> metadata;
        final Instant             updatedAt;

        StoredObject(String container, String path, byte[] content, Map<String, String> metadata, Instant updatedAt) {
            this.container = container;
            this.path      = path;
            this.content   = content;
            this.metadata  = metadata;
            this.updatedAt = updatedAt;
        }
    }
}
