package com.shadows.core.objectives;

import com.shadows.core.model.DoomEvent;
import com.shadows.core.model.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fires doom events as the doom counter falls. Each event fires at most once per scenario.
 */
@Service
public class DoomEventScheduler {

    private static final Logger log = LoggerFactory.getLogger(DoomEventScheduler.class);

    public DoomTick onDoomChanged(Scenario scenario, int doom) {
        List<DoomEvent> fired = new ArrayList<>();
        List<DoomEvent> events = new ArrayList<>();
        for (DoomEvent event : scenario.doomEvents()) {
            if (!event.triggered() && event.threshold() >= doom) {
                fired.add(event);
                events.add(event.withTriggered());
                log.info("Doom {} reached threshold {}: {}", doom, event.threshold(), event.message());
            } else {
                events.add(event);
            }
        }
        if (fired.isEmpty()) {
            return new DoomTick(scenario, List.of());
        }
        return new DoomTick(scenario.withDoomEvents(events), fired);
    }

    public Optional<DoomEvent> nextEvent(Scenario scenario) {
        return scenario.doomEvents().stream().filter(e -> !e.triggered()).findFirst();
    }
}
