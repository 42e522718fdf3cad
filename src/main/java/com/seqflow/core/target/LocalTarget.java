package com.seqflow.core.target;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Target backed by a file on the local filesystem.
 */
public final class LocalTarget implements Target {

    private final TargetUri uri;
    private final Path path;

    public LocalTarget(Path path) {
        this.uri = TargetUri.local(path);
        this.path = uri.localPath();
    }

    @Override
    public TargetUri uri() {
        return uri;
    }

    @Override
    public boolean exists() {
        return Files.exists(path);
    }

    @Override
    public long size() throws IOException {
        return Files.size(path);
    }

    @Override
    public InputStream openForRead() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public TargetOutputStream openForWrite() throws IOException {
        Path parent = createParent(path);
        Path spool = Files.createTempFile(parent, "." + path.getFileName(), ".part");
        return new TargetOutputStream(spool, file -> moveIntoPlace(file, path));
    }

    @Override
    public boolean isLocal() {
        return true;
    }

    @Override
    public void materializeTo(Path destination) throws IOException {
        createParent(destination);
        Files.copy(path, destination, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public void publishFrom(Path source) throws IOException {
        Path parent = createParent(path);
        Path staging = Files.createTempFile(parent, "." + path.getFileName(), ".part");
        try {
            Files.copy(source, staging, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(staging, path);
        } finally {
            Files.deleteIfExists(staging);
        }
    }

    @Override
    public void delete() throws IOException {
        Files.deleteIfExists(path);
    }

    private static Path createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        return parent;
    }

    private static void moveIntoPlace(Path staged, Path destination) throws IOException {
        try {
            Files.move(staged, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staged, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LocalTarget other && uri.equals(other.uri);
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
