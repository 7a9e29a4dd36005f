package com.shadows.core.objectives;

import com.shadows.core.model.DoomEvent;
import com.shadows.core.model.Scenario;

import java.util.List;

/**
 * @param updatedScenario scenario with the fired events marked triggered
 * @param firedEvents     events that fired on this doom change, highest threshold first
 */
public record DoomTick(Scenario updatedScenario, List<DoomEvent> firedEvents) {

    public DoomTick {
        firedEvents = List.copyOf(firedEvents);
    }
}
