package com.seqflow.core.target;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RemoteTargetTest {

    @TempDir
    Path tmp;

    private FileSystemObjectStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemObjectStore(tmp.resolve("store"));
    }

    @Test
    void rejectsLocalUri() {
        assertThrows(IllegalArgumentException.class,
                () -> new RemoteTarget(TargetUri.local(tmp.resolve("x")), store));
    }

    @Test
    void publishThenExistsThenMaterialize() throws IOException {
        var target = new RemoteTarget(TargetUri.parse("s3://bucket/project/S1.fasta.gz"), store);
        assertFalse(target.exists());

        target.publishFrom(Files.writeString(tmp.resolve("local.fasta"), ">contig\nACGT\n"));

        assertTrue(target.exists());
        assertTrue(Files.isRegularFile(tmp.resolve("store/bucket/project/S1.fasta.gz")));
        Path copy = tmp.resolve("work/inputs/S1.fasta.gz");
        target.materializeTo(copy);
        assertEquals(">contig\nACGT\n", Files.readString(copy));
    }

    @Test
    void streamedWriteIsUploadedOnCommit() throws IOException {
        var target = new RemoteTarget(TargetUri.parse("s3://bucket/out.txt"), store);

        target.write(out -> out.write("streamed".getBytes(StandardCharsets.UTF_8)));

        try (InputStream in = target.openForRead()) {
            assertEquals("streamed", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        assertEquals(8, target.size());
    }

    @Test
    void failedUploadSurfacesOnCommit() throws IOException {
        ObjectStore failing = mock(ObjectStore.class);
        doThrow(new IOException("network down")).when(failing).upload(any(), eq("bucket"), eq("out.txt"));
        var target = new RemoteTarget(TargetUri.parse("s3://bucket/out.txt"), failing);

        TargetOutputStream out = target.openForWrite();
        out.write(1);

        IOException e = assertThrows(IOException.class, out::commit);
        assertEquals("network down", e.getMessage());
    }

    @Test
    void abandonedStreamIsNeverUploaded() throws IOException {
        ObjectStore recording = mock(ObjectStore.class);
        var target = new RemoteTarget(TargetUri.parse("s3://bucket/out.txt"), recording);

        assertThrows(IOException.class, () -> target.write(out -> {
            out.write("half".getBytes(StandardCharsets.UTF_8));
            throw new IOException("disk full");
        }));

        verify(recording, never()).upload(any(), any(), any());
    }

    @Test
    void equalityFollowsUri() {
        var a = new RemoteTarget(TargetUri.parse("s3://b/k"), store);
        var b = new RemoteTarget(TargetUri.parse("s3://b/k"), store);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("s3://b/k", a.toString());
    }
}
