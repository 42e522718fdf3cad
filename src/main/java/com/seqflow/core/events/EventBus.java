package com.seqflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for pipeline run events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations; scheduler workers
 * publish from their own threads.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PipelineEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<PipelineEvent>> runSubs = runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<PipelineEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<PipelineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<PipelineEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> runSubscribers.computeIfPresent(runId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /** Number of runs that still have subscribers; finished runs drop out when their last listener leaves. */
    public int activeRuns() {
        return runSubscribers.size();
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
