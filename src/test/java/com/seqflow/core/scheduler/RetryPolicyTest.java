package com.seqflow.core.scheduler;

import com.seqflow.core.SeqflowException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void backoffGrowsAndIsCapped() {
        var policy = new RetryPolicy(10, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(10));

        assertEquals(Duration.ofSeconds(2), policy.backoffAfter(1));
        assertEquals(Duration.ofSeconds(4), policy.backoffAfter(2));
        assertEquals(Duration.ofSeconds(8), policy.backoffAfter(3));
        assertEquals(Duration.ofSeconds(10), policy.backoffAfter(4));
    }

    @Test
    void transientFailuresAreRetriedUntilSuccess() {
        var calls = new AtomicInteger();
        var policy = new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO);

        String result = policy.execute("submit", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientBackendException("throttled");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void otherFailuresAreNotRetried() {
        var calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> RetryPolicy.exponential(5, Duration.ZERO).execute("x", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bad request");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void checkedFailuresAreWrapped() {
        var e = assertThrows(SeqflowException.class, () -> RetryPolicy.none().execute("read", () -> {
            throw new IOException("disk");
        }));
        assertTrue(e.getMessage().contains("read failed: disk"));
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, 0.5, Duration.ZERO));
    }
}
