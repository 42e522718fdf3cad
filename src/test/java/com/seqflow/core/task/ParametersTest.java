package com.seqflow.core.task;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParametersTest {

    @Test
    void typedAccessors() {
        Parameters params = Parameters.builder()
                .put("sample_name", "S1")
                .put("threads", 4)
                .put("size", 10_000_000_000L)
                .put("paired", true)
                .put("ref", Path.of("/refdbs/uniref"))
                .build();

        assertEquals("S1", params.getString("sample_name"));
        assertEquals(4, params.getInt("threads"));
        assertEquals(10_000_000_000L, params.getLong("size"));
        assertTrue(params.getBoolean("paired"));
        assertEquals(Path.of("/refdbs/uniref"), params.getPath("ref"));
        assertEquals("4", params.render("threads"));
        assertEquals(List.of("sample_name", "threads", "size", "paired", "ref"), List.copyOf(params.names()));
    }

    @Test
    void unknownNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Parameters.empty().getString("missing"));
    }

    @Test
    void nullAndBlankAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Parameters.builder().put("x", (String) null));
        assertThrows(IllegalArgumentException.class, () -> Parameters.builder().put(" ", "v"));
    }

    @Test
    void identityDependsOnTypeNameAndParameters() {
        var a = new TaskId("Step", "t", Parameters.builder().put("k", "v").build());
        var b = new TaskId("Step", "t", Parameters.builder().put("k", "v").build());
        var c = new TaskId("Step", "t", Parameters.builder().put("k", "w").build());

        assertEquals(a, b);
        assertNotEquals(a, c);
        assertEquals("t", a.toString());
        assertThrows(IllegalArgumentException.class, () -> new TaskId("Step", "", null));
    }

    @Test
    void resourceHintsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ResourceHints(0, 1024));
        assertThrows(IllegalArgumentException.class, () -> new ResourceHints(1, 0));
    }
}
