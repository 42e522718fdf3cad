package com.seqflow.core.target;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Abstraction over a remote object store.
 * Implementations: GcsObjectStore (Google Cloud Storage), FileSystemObjectStore (mirrored buckets).
 */
public interface ObjectStore {

    /**
     * @return false for a missing object
     * @throws TargetAccessException on transport or auth failure
     */
    boolean exists(String bucket, String key);

    long size(String bucket, String key) throws IOException;

    InputStream openStream(String bucket, String key) throws IOException;

    void download(String bucket, String key, Path destination) throws IOException;

    void upload(Path source, String bucket, String key) throws IOException;

    void delete(String bucket, String key) throws IOException;
}
