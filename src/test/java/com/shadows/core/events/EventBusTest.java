package com.shadows.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("ShadowsEvent")
    class ShadowsEventTests {

        @Test
        @DisplayName("of() stamps the event and defaults a null payload")
        void ofDefaultsPayload() {
            Instant before = Instant.now();
            var event = ShadowsEvent.of("doom.event", "S-1", null, null);

            assertEquals("doom.event", event.eventType());
            assertEquals("S-1", event.scenarioId());
            assertNull(event.subjectId());
            assertEquals(Map.of(), event.payload());
            assertFalse(event.timestamp().isBefore(before));
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to scenario subscriber")
        void deliversToScenarioSubscriber() {
            List<ShadowsEvent> received = new ArrayList<>();
            eventBus.subscribe("S-1", received::add);

            eventBus.publish(ShadowsEvent.of("quest_item.spawned", "S-1", "quest_item_obj_0_0", Map.of()));

            assertEquals(1, received.size());
            assertEquals("quest_item_obj_0_0", received.get(0).subjectId());
        }

        @Test
        @DisplayName("does not deliver events of other scenarios")
        void filtersByScenario() {
            List<ShadowsEvent> received = new ArrayList<>();
            eventBus.subscribe("S-1", received::add);

            eventBus.publish(ShadowsEvent.of("doom.event", "S-2", null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscribers see every scenario")
        void globalSubscriber() {
            List<ShadowsEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(ShadowsEvent.of("doom.event", "S-1", null, Map.of()));
            eventBus.publish(ShadowsEvent.of("doom.event", "S-2", null, Map.of()));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<ShadowsEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribeAll(received::add);
            subscription.unsubscribe();

            eventBus.publish(ShadowsEvent.of("doom.event", "S-1", null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a failing listener does not block the others")
        void failingListenerIsolated() {
            List<ShadowsEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(ShadowsEvent.of("doom.event", "S-1", null, Map.of())));
            assertEquals(1, received.size());
        }
    }
}
