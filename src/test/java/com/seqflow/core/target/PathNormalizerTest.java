package com.seqflow.core.target;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathNormalizerTest {

    @Test
    void folderEndsWithExactlyOneSlash() {
        assertEquals("s3://b/project/", PathNormalizer.folder("s3://b/project"));
        assertEquals("s3://b/project/", PathNormalizer.folder("s3://b/project///"));
        assertEquals("/data/out/", PathNormalizer.folder(" /data/out "));
        assertEquals("/", PathNormalizer.folder("/"));
    }

    @Test
    void folderRejectsBlankOrBucketlessInput() {
        assertThrows(InvalidTargetException.class, () -> PathNormalizer.folder(""));
        assertThrows(InvalidTargetException.class, () -> PathNormalizer.folder(null));
        assertThrows(InvalidTargetException.class, () -> PathNormalizer.folder("s3://"));
    }

    @Test
    void joinUsesSingleSeparators() {
        assertEquals("s3://b/p/fastqp/S1.fastqp.tsv", PathNormalizer.join("s3://b/p/", "/fastqp/", "S1.fastqp.tsv"));
        assertEquals("s3://b/p/prokka", PathNormalizer.join("s3://b/p", "prokka"));
        assertEquals("/out/a", PathNormalizer.join("/out", "", "a"));
    }

    @Test
    void sanitizeNameReplacesDisallowedCharacters() {
        assertEquals("metaspades_sample_1_A", PathNormalizer.sanitizeName("metaspades_sample.1 A"));
        assertEquals("get_sra-SRR123", PathNormalizer.sanitizeName("get_sra-SRR123"));
    }
}
