package com.seqflow.core.target;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Target backed by an object in an {@link ObjectStore}.
 * Writes are spooled to a local temp file and uploaded on close.
 */
public final class RemoteTarget implements Target {

    private final TargetUri uri;
    private final ObjectStore store;

    public RemoteTarget(TargetUri uri, ObjectStore store) {
        if (uri.isLocal()) {
            throw new IllegalArgumentException("Remote target needs a remote location: " + uri);
        }
        this.uri = uri;
        this.store = store;
    }

    @Override
    public TargetUri uri() {
        return uri;
    }

    @Override
    public boolean exists() {
        return store.exists(uri.bucket(), uri.key());
    }

    @Override
    public long size() throws IOException {
        return store.size(uri.bucket(), uri.key());
    }

    @Override
    public InputStream openForRead() throws IOException {
        return store.openStream(uri.bucket(), uri.key());
    }

    @Override
    public TargetOutputStream openForWrite() throws IOException {
        Path spool = Files.createTempFile("seqflow-", ".upload");
        return new TargetOutputStream(spool, file -> store.upload(file, uri.bucket(), uri.key()));
    }

    @Override
    public boolean isLocal() {
        return false;
    }

    @Override
    public void materializeTo(Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        store.download(uri.bucket(), uri.key(), destination);
    }

    @Override
    public void publishFrom(Path source) throws IOException {
        store.upload(source, uri.bucket(), uri.key());
    }

    @Override
    public void delete() throws IOException {
        store.delete(uri.bucket(), uri.key());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RemoteTarget other && uri.equals(other.uri);
    }

    @Override
    public int hashCode() {
        return uri.hashCode();
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
