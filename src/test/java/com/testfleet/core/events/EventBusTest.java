package com.testfleet.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    void deliversToRunAndGlobalSubscribers() {
        List<PipelineEvent> runEvents = new ArrayList<>();
        List<PipelineEvent> allEvents = new ArrayList<>();
        eventBus.subscribe("run-1", runEvents::add);
        eventBus.subscribeAll(allEvents::add);

        eventBus.publish(PipelineEvent.of("phase.started", "run-1", "unit", Map.of()));
        eventBus.publish(PipelineEvent.of("phase.started", "run-2", "unit", Map.of()));

        assertEquals(1, runEvents.size());
        assertEquals(2, allEvents.size());
    }

    @Test
    void unsubscribeStopsDelivery() {
        List<PipelineEvent> received = new ArrayList<>();
        var subscription = eventBus.subscribe("run-1", received::add);

        subscription.unsubscribe();
        eventBus.publish(PipelineEvent.of("run.started", "run-1", null, Map.of()));

        assertTrue(received.isEmpty());
        assertEquals(0, eventBus.listenerCount());
    }

    @Test
    void runSubscriptionRequiresRunId() {
        assertThrows(IllegalArgumentException.class, () -> eventBus.subscribe(null, e -> { }));
    }

    @Test
    void failingSubscriberDoesNotStopOthers() {
        List<PipelineEvent> received = new ArrayList<>();
        eventBus.subscribe("run-1", e -> { throw new IllegalStateException("boom"); });
        eventBus.subscribe("run-1", received::add);

        eventBus.publish(PipelineEvent.of("service.ready", "run-1", "postgres", Map.of()));

        assertEquals(1, received.size());
        assertEquals("postgres", received.get(0).subject());
    }
}
