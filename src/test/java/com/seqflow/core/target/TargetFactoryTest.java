package com.seqflow.core.target;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TargetFactoryTest {

    @TempDir
    Path tmp;

    @Test
    void createsLocalAndRemoteTargets() {
        var registry = new ObjectStoreRegistry().register("S3", new FileSystemObjectStore(tmp));
        var factory = new TargetFactory(registry);

        assertInstanceOf(LocalTarget.class, factory.of(tmp.resolve("x.txt").toString()));
        assertInstanceOf(RemoteTarget.class, factory.of("s3://bucket/x.txt"));
        assertTrue(registry.lookup("s3").isPresent(), "schemes are case-insensitive");
    }

    @Test
    void unregisteredSchemeIsRejected() {
        var factory = new TargetFactory(new ObjectStoreRegistry());

        var e = assertThrows(InvalidTargetException.class, () -> factory.of("gs://bucket/key"));
        assertTrue(e.getMessage().contains("gs"));
    }

    @Test
    void storageConfigRegistersMirrorForConfiguredSchemes() {
        var properties = new StorageProperties();
        properties.setMirrorRoot(tmp.toString());

        ObjectStoreRegistry registry = new StorageConfig().objectStoreRegistry(properties);

        assertEquals(Set.of("s3"), registry.schemes());
        assertInstanceOf(FileSystemObjectStore.class, registry.lookup("s3").orElseThrow());
    }
}
