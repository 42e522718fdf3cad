package com.seqflow.core.target;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GcsObjectStoreTest {

    private Storage storage;
    private GcsObjectStore store;

    @BeforeEach
    void setUp() {
        storage = mock(Storage.class);
        store = new GcsObjectStore(storage);
    }

    @Test
    void existsReflectsBlobPresence() {
        Blob blob = mock(Blob.class);
        when(blob.exists()).thenReturn(true);
        when(storage.get(BlobId.of("bucket", "present"))).thenReturn(blob);
        when(storage.get(BlobId.of("bucket", "absent"))).thenReturn(null);

        assertTrue(store.exists("bucket", "present"));
        assertFalse(store.exists("bucket", "absent"));
    }

    @Test
    void unreachableStoreIsAnAccessError() {
        when(storage.get(BlobId.of("bucket", "k"))).thenThrow(new StorageException(503, "unavailable"));

        var e = assertThrows(TargetAccessException.class, () -> store.exists("bucket", "k"));
        assertTrue(e.getMessage().contains("gs://bucket/k"));
    }

    @Test
    void sizeOfMissingObjectIsFileNotFound() {
        when(storage.get(BlobId.of("bucket", "k"))).thenReturn(null);

        assertThrows(FileNotFoundException.class, () -> store.size("bucket", "k"));
    }

    @Test
    void uploadFailureIsAnIOException() throws IOException {
        when(storage.createFrom(any(BlobInfo.class), any(Path.class))).thenThrow(new StorageException(500, "boom"));

        var e = assertThrows(IOException.class, () -> store.upload(Path.of("/tmp/x"), "bucket", "k"));
        assertInstanceOf(StorageException.class, e.getCause());
    }
}
