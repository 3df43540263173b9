package com.di.scorenova.storage;

import com.di.scorenova.exception.StorageException;
import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("GcsLakeObjectStore Tests")
class GcsLakeObjectStoreTest {

    private Storage storage;
    private GcsLakeObjectStore store;

    @BeforeEach
    void setUp() {
        storage = mock(Storage.class);
        store = new GcsLakeObjectStore(storage);
    }

    @Test
    @DisplayName("Should create a blob with content type and metadata")
    void testPut() {
        byte[] content = "{}\n".getBytes();
        store.put("bucket", "predictions/x.jsonl", content, "application/x-ndjson", Map.of("recordCount", "1"));

        ArgumentCaptor<BlobInfo> info = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).create(info.capture(), eq(content));
        assertEquals(BlobId.of("bucket", "predictions/x.jsonl"), info.getValue().getBlobId());
        assertEquals("application/x-ndjson", info.getValue().getContentType());
        assertEquals("1", info.getValue().getMetadata().get("recordCount"));
    }

    @Test
    @DisplayName("Should wrap client failures in StorageException")
    void testPut_Failure() {
        when(storage.create(any(BlobInfo.class), any(byte[].class)))
                .thenThrow(new com.google.cloud.storage.StorageException(403, "Forbidden"));

        StorageException e = assertThrows(StorageException.class,
                () -> store.put("bucket", "p.jsonl", new byte[0], "application/json", Map.of()));
        assertTrue(e.getMessage().contains("gs://bucket/p.jsonl"));
    }

    @Test
    @DisplayName("Should map listed blobs to lake objects")
    @SuppressWarnings("unchecked")
    void testList() {
        Blob blob = mock(Blob.class);
        when(blob.getName()).thenReturn("predictions/year=2024/month=01/day=01/hour=00/batch_a.jsonl");
        when(blob.getSize()).thenReturn(42L);
        when(blob.getUpdateTimeOffsetDateTime()).thenReturn(OffsetDateTime.of(2024, 1, 1, 0, 5, 0, 0, ZoneOffset.UTC));
        when(blob.getMetadata()).thenReturn(Map.of("recordCount", "3"));
        Page<Blob> page = mock(Page.class);
        when(page.iterateAll()).thenReturn(List.of(blob));
        when(storage.list(eq("bucket"), any(Storage.BlobListOption.class))).thenReturn(page);

        List<LakeObject> objects = store.list("bucket", "predictions/");

        assertEquals(1, objects.size());
        assertEquals(42L, objects.get(0).getSizeBytes());
        assertEquals(3, objects.get(0).recordCount());
        assertEquals("2024-01-01T00:05:00Z", objects.get(0).getUpdatedAt().toString());
    }

    @Test
    @DisplayName("Should read blob content and fail on missing blobs")
    void testRead() {
        Blob blob = mock(Blob.class);
        when(blob.exists()).thenReturn(true);
        when(blob.getContent()).thenReturn(new byte[]{1, 2, 3});
        when(storage.get(BlobId.of("bucket", "a"))).thenReturn(blob);

        assertArrayEquals(new byte[]{1, 2, 3}, store.read("bucket", "a"));
        assertThrows(StorageException.class, () -> store.read("bucket", "missing"));
        assertEquals("gcs", store.backendName());
    }
}
