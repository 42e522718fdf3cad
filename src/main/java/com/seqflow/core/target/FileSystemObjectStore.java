package com.seqflow.core.target;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Object store that keeps each bucket as a directory under a root.
 *
 * <p>Used for buckets mirrored or mounted onto the local host, and as the
 * store behind remote targets in tests.
 */
public class FileSystemObjectStore implements ObjectStore {

    private final Path root;

    public FileSystemObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean exists(String bucket, String key) {
        return Files.isRegularFile(resolve(bucket, key));
    }

    @Override
    public long size(String bucket, String key) throws IOException {
        return Files.size(existing(bucket, key));
    }

    @Override
    public InputStream openStream(String bucket, String key) throws IOException {
        return Files.newInputStream(existing(bucket, key));
    }

    @Override
    public void download(String bucket, String key, Path destination) throws IOException {
        Files.copy(existing(bucket, key), destination, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public void upload(Path source, String bucket, String key) throws IOException {
        Path object = resolve(bucket, key);
        Files.createDirectories(object.getParent());
        Path staging = Files.createTempFile(object.getParent(), "." + object.getFileName(), ".part");
        try {
            Files.copy(source, staging, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.move(staging, object, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(staging, object, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(staging);
        }
    }

    @Override
    public void delete(String bucket, String key) throws IOException {
        Files.deleteIfExists(resolve(bucket, key));
    }

    private Path existing(String bucket, String key) throws FileNotFoundException {
        Path object = resolve(bucket, key);
        if (!Files.isRegularFile(object)) {
            throw new FileNotFoundException(bucket + "/" + key);
        }
        return object;
    }

    Path resolve(String bucket, String key) {
        Path object = root.resolve(bucket).resolve(key).normalize();
        if (!object.startsWith(root.resolve(bucket))) {
            throw new InvalidTargetException("Object key escapes its bucket: " + bucket + "/" + key);
        }
        return object;
    }
}
