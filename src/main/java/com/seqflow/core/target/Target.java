package com.seqflow.core.target;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Handle to a storage location standing in for a build artifact.
 *
 * <p>The location is fixed at construction. Existence is queried against the
 * backing store on every call and never cached, so work completed by an earlier
 * process is always detected.
 */
public interface Target {

    TargetUri uri();

    /**
     * Queries the backing store.
     *
     * @return false when the object is missing
     * @throws TargetAccessException when the store cannot be reached
     */
    boolean exists();

    /** Size in bytes of the existing object. */
    long size() throws IOException;

    InputStream openForRead() throws IOException;

    /**
     * Opens a stream whose content becomes visible at this location only when
     * {@link TargetOutputStream#commit()} is called. Closing without a commit
     * leaves the location untouched.
     */
    TargetOutputStream openForWrite() throws IOException;

    /**
     * Writes the location in one go: the content is published when
     * {@code body} returns normally and discarded when it throws.
     */
    default void write(ContentWriter body) throws IOException {
        try (TargetOutputStream out = openForWrite()) {
            body.writeTo(out);
            out.commit();
        }
    }

    boolean isLocal();

    default Optional<Path> localPath() {
        return isLocal() ? Optional.of(uri().localPath()) : Optional.empty();
    }

    /** Copies the object to a local file, creating parent directories. */
    void materializeTo(Path destination) throws IOException;

    /** Replaces the object with the content of a local file. */
    void publishFrom(Path source) throws IOException;

    void delete() throws IOException;

    @FunctionalInterface
    interface ContentWriter {
        void writeTo(OutputStream out) throws IOException;
    }
}
