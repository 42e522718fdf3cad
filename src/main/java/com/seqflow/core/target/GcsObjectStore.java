package com.seqflow.core.target;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.file.Path;

/**
 * Google Cloud Storage backed object store ({@code gs://bucket/key}).
 */
public class GcsObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(GcsObjectStore.class);

    private final Storage storage;

    public GcsObjectStore(Storage storage) {
        this.storage = storage;
    }

    @Override
    public boolean exists(String bucket, String key) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            return blob != null && blob.exists();
        } catch (StorageException e) {
            throw new TargetAccessException("Could not query gs://" + bucket + "/" + key, e);
        }
    }

    @Override
    public long size(String bucket, String key) throws IOException {
        Long size = blob(bucket, key).getSize();
        return size != null ? size : 0L;
    }

    @Override
    public InputStream openStream(String bucket, String key) throws IOException {
        try {
            return Channels.newInputStream(storage.reader(BlobId.of(bucket, key)));
        } catch (StorageException e) {
            throw new IOException("Could not open gs://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void download(String bucket, String key, Path destination) throws IOException {
        Blob blob = blob(bucket, key);
        try {
            blob.downloadTo(destination);
        } catch (StorageException e) {
            throw new IOException("Could not download gs://" + bucket + "/" + key, e);
        }
        log.debug("Downloaded gs://{}/{} to {}", bucket, key, destination);
    }

    @Override
    public void upload(Path source, String bucket, String key) throws IOException {
        try {
            storage.createFrom(BlobInfo.newBuilder(bucket, key).build(), source);
        } catch (StorageException e) {
            throw new IOException("Could not upload " + source + " to gs://" + bucket + "/" + key, e);
        }
        log.debug("Uploaded {} to gs://{}/{}", source, bucket, key);
    }

    @Override
    public void delete(String bucket, String key) throws IOException {
        try {
            storage.delete(BlobId.of(bucket, key));
        } catch (StorageException e) {
            throw new IOException("Could not delete gs://" + bucket + "/" + key, e);
        }
    }

    private Blob blob(String bucket, String key) throws IOException {
        Blob blob;
        try {
            blob = storage.get(BlobId.of(bucket, key));
        } catch (StorageException e) {
            throw new IOException("Could not query gs://" + bucket + "/" + key, e);
        }
        if (blob == null) {
            throw new FileNotFoundException("gs://" + bucket + "/" + key);
        }
        return blob;
    }
}
