package com.testfleet.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for pipeline run events.
 * <p>
 * A subscriber either follows one run or every run. Readiness events are
 * published from supervisor worker threads, so publish and subscribe may race
 * freely; a subscriber sees each event at most once.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Delivers the event to every listener of its run and to every global listener.
     * A listener that throws is logged and skipped.
     */
    public void publish(PipelineEvent event) {
        log.debug("Publishing {} for run {}", event.eventType(), event.runId());
        for (Listener listener : listeners) {
            if (listener.accepts(event)) {
                deliverSafely(listener.consumer(), event);
            }
        }
    }

    /**
     * Follows the events of one run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<PipelineEvent> consumer) {
        if (runId == null) {
            throw new IllegalArgumentException("runId is required; use subscribeAll for every run");
        }
        return register(new Listener(runId, consumer));
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        return register(new Listener(null, consumer));
    }

    int listenerCount() {
        return listeners.size();
    }

    private Subscription register(Listener listener) {
        listeners.add(listener);
        log.debug("Subscribed to {}", listener.runId() != null ? "run " + listener.runId() : "all runs");
        return () -> listeners.remove(listener);
    }

    private void deliverSafely(Consumer<PipelineEvent> consumer, PipelineEvent event) {
        try {
            consumer.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    /** Handle for cancelling a subscription. */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    // Identity equality so the same consumer can be registered twice and removed once.
    private static final class Listener {
        private final String runId;
        private final Consumer<PipelineEvent> consumer;

        Listener(String runId, Consumer<PipelineEvent> consumer) {
            this.runId = runId;
            this.consumer = consumer;
        }

        String runId() { return runId; }
        Consumer<PipelineEvent> consumer() { return consumer; }

        boolean accepts(PipelineEvent event) {
            return runId == null || runId.equals(event.runId());
        }
    }
}
