package com.seqflow.core.target;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TargetUriTest {

    @Test
    void parsesRemoteLocation() {
        TargetUri uri = TargetUri.parse("s3://bucket/reads/S1.fastq.gz");

        assertEquals("s3", uri.scheme());
        assertEquals("bucket", uri.bucket());
        assertEquals("reads/S1.fastq.gz", uri.key());
        assertFalse(uri.isLocal());
        assertEquals("S1.fastq.gz", uri.fileName());
        assertEquals("s3://bucket/reads/S1.fastq.gz", uri.toString());
    }

    @Test
    void schemeIsLowerCased() {
        assertEquals("gs", TargetUri.parse("GS://b/k").scheme());
    }

    @Test
    void plainPathIsLocalAndAbsolute() {
        TargetUri uri = TargetUri.parse("data/../data/S1.fastq");

        assertTrue(uri.isLocal());
        assertNull(uri.bucket());
        assertEquals(Path.of("data/S1.fastq").toAbsolutePath().normalize(), uri.localPath());
    }

    @Test
    void fileSchemeIsLocal() {
        TargetUri uri = TargetUri.parse("file:///tmp/x/out.tsv");

        assertTrue(uri.isLocal());
        assertEquals(Path.of("/tmp/x/out.tsv"), uri.localPath());
        assertEquals("out.tsv", uri.fileName());
    }

    @Test
    void rejectsBlankAndBucketOnlyLocations() {
        assertThrows(InvalidTargetException.class, () -> TargetUri.parse(" "));
        assertThrows(InvalidTargetException.class, () -> TargetUri.parse("s3://bucket"));
        assertThrows(InvalidTargetException.class, () -> TargetUri.parse("s3://bucket/"));
        assertThrows(InvalidTargetException.class, () -> TargetUri.parse("s3:///key"));
    }

    @Test
    void remoteUriHasNoLocalPath() {
        TargetUri uri = TargetUri.parse("s3://b/k");
        assertThrows(IllegalStateException.class, uri::localPath);
    }
}
