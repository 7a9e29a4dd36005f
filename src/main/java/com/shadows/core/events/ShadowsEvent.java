package com.shadows.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Something that happened while generating or playing a scenario, for live CLI output and listeners.
 *
 * @param eventType  dotted event name, e.g. "scenario.generated", "quest_item.spawned", "doom.event"
 * @param scenarioId the scenario this event belongs to
 * @param subjectId  objective, quest item or quest tile the event is about (nullable)
 * @param payload    event-specific details
 */
public record ShadowsEvent(
    String eventType,
    String scenarioId,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static ShadowsEvent of(String eventType, String scenarioId, String subjectId, Map<String, Object> payload) {
        return new ShadowsEvent(eventType, scenarioId, subjectId, payload == null ? Map.of() : payload, Instant.now());
    }
}
