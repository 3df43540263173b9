package com.di.scorenova.storage;

import java.util.List;
import java.util.Map;

/**
 * Blob store the lake connector writes through. Failures surface as
 * {@link com.di.scorenova.exception.StorageException}.
 */
public interface LakeObjectStore {

    /** Creates or overwrites the object. */
    void put(String container, String path, byte[] content, String contentType, Map<String, String> metadata);

    /** Every object whose path starts with {@code prefix}. */
    List<LakeObject> list(String container, String prefix);

    byte[] read(String container, String path);

    /** Short backend name for logs and status. */
    String backendName();
}
