package com.seqflow.core.target;

import java.io.BufferedOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stream to a target, spooled to a local file. Content becomes visible at the
 * target only through {@link #commit()}; closing an uncommitted stream discards
 * what was written. The spool file is deleted on every path.
 */
public class TargetOutputStream extends FilterOutputStream {

    @FunctionalInterface
    interface Publisher {
        void publish(Path spoolFile) throws IOException;
    }

    private final Path spoolFile;
    private final Publisher publisher;
    private boolean closed;

    TargetOutputStream(Path spoolFile, Publisher publisher) throws IOException {
        super(openSpool(spoolFile));
        this.spoolFile = spoolFile;
        this.publisher = publisher;
    }

    private static OutputStream openSpool(Path spoolFile) throws IOException {
        return new BufferedOutputStream(Files.newOutputStream(spoolFile));
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        out.write(b, off, len);
    }

    /**
     * Publishes the written content to the target and closes the stream.
     *
     * @throws IllegalStateException when the stream is already closed
     */
    public void commit() throws IOException {
        if (closed) {
            throw new IllegalStateException("Stream already closed");
        }
        closed = true;
        try {
            super.close();
            publisher.publish(spoolFile);
        } finally {
            Files.deleteIfExists(spoolFile);
        }
    }

    /** Discards the content unless {@link #commit()} ran first. */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            super.close();
        } finally {
            Files.deleteIfExists(spoolFile);
        }
    }
}
