package com.seqflow.core.scheduler;

import com.seqflow.core.SeqflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bounded retry with exponential backoff for {@link TransientBackendException}s.
 * Any other exception is propagated on the first attempt.
 *
 * @param maxAttempts    total attempts, at least 1
 * @param initialBackoff delay before the second attempt
 * @param multiplier     backoff growth factor per attempt
 * @param maxBackoff     upper bound for a single delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, 2.0, Duration.ofMinutes(5));
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        long millis = (long) Math.min(initialBackoff.toMillis() * factor, (double) maxBackoff.toMillis());
        return Duration.ofMillis(Math.max(0, millis));
    }

    /**
     * Runs the action, retrying transient failures.
     *
     * @throws TransientBackendException when every attempt failed transiently
     */
    public <T> T execute(String description, Callable<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.call();
            } catch (TransientBackendException e) {
                if (attempt >= maxAttempts) {
                    throw new TransientBackendException(description + " failed after " + attempt
                            + " attempt(s): " + e.getMessage(), e);
                }
                Duration delay = backoffAfter(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        description, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                sleep(delay);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new SeqflowException(description + " failed: " + e.getMessage(), e);
            }
        }
    }

    private static void sleep(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SeqflowException("Interrupted while waiting to retry", e);
        }
    }
}
