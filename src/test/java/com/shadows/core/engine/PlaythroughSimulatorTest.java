package com.shadows.core.engine;

import com.shadows.core.TestScenarios;
import com.shadows.core.balance.SpawnProperties;
import com.shadows.core.catalog.MissionCatalog;
import com.shadows.core.events.EventBus;
import com.shadows.core.events.ShadowsEvent;
import com.shadows.core.metrics.ShadowsMetrics;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.objectives.DoomEventScheduler;
import com.shadows.core.objectives.ObjectiveTracker;
import com.shadows.core.spawn.ObjectiveSpawnService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.shadows.core.TestScenarios.required;
import static org.junit.jupiter.api.Assertions.*;

class PlaythroughSimulatorTest {

    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private PlaythroughSimulator simulator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        Random random = new Random(42);
        simulator = new PlaythroughSimulator(
                new ObjectiveSpawnService(new SpawnProperties(), random),
                new ObjectiveTracker(new MissionCatalog()),
                new DoomEventScheduler(),
                eventBus,
                new ShadowsMetrics(registry),
                random);
    }

    @Test
    void singleKeyIsFoundBeforeDoomRunsOut() {
        Scenario scenario = TestScenarios.builder()
                .objective(required("obj_key", ObjectiveType.FIND_ITEM, "iron_key", null))
                .build();

        SimulationReport report = simulator.simulate(scenario, 40);

        assertEquals(SimulationOutcome.VICTORY, report.outcome());
        assertTrue(report.roundsPlayed() <= 9, "critical doom forces the key by round 9");
        assertEquals(100, report.completion());
        assertEquals(1, report.itemsSpawned() + report.itemsForced());
        assertEquals(1.0, registry.counter("shadows.simulation.outcomes", "outcome", "victory").count());
    }

    @Test
    void enemiesFromDoomEventsAreFought() {
        Scenario scenario = TestScenarios.builder()
                .objective(required("obj_cultists", ObjectiveType.KILL_ENEMY, "cultist", 2))
                .event(TestScenarios.enemies(11, "cultist", 2))
                .build();

        SimulationReport report = simulator.simulate(scenario, 40);

        assertEquals(SimulationOutcome.VICTORY, report.outcome());
        assertEquals(2, report.roundsPlayed());
        assertEquals(List.of("At doom 11: 2 cultist arrive"), report.firedDoomEvents());
    }

    @Test
    void unwinnableScenarioEndsInDefeat() {
        Scenario scenario = TestScenarios.builder()
                .startDoom(5)
                .noVictory()
                .build();

        SimulationReport report = simulator.simulate(scenario, 40);

        assertEquals(SimulationOutcome.DEFEAT, report.outcome());
        assertEquals(5, report.roundsPlayed());
        assertEquals(0, report.finalDoom());
    }

    @Test
    void roundLimitStallsTheRun() {
        Scenario scenario = TestScenarios.builder()
                .noVictory()
                .event(TestScenarios.enemies(10, "ghoul", 1))
                .build();

        SimulationReport report = simulator.simulate(scenario, 3);

        assertEquals(SimulationOutcome.STALLED, report.outcome());
        assertEquals(3, report.roundsPlayed());
        assertEquals(9, report.finalDoom());
        assertEquals(List.of("At doom 10: 1 ghoul arrive"), report.firedDoomEvents());
    }

    @Test
    void publishesProgressEvents() {
        List<ShadowsEvent> seen = new ArrayList<>();
        eventBus.subscribeAll(seen::add);
        Scenario scenario = TestScenarios.builder()
                .objective(required("obj_key", ObjectiveType.FIND_ITEM, "iron_key", null))
                .build();

        simulator.simulate(scenario, 40);

        List<String> types = seen.stream().map(ShadowsEvent::eventType).toList();
        assertTrue(types.contains("quest_item.spawned"));
        assertTrue(types.contains("quest_item.collected"));
        assertTrue(types.contains("objective.completed"));
        assertEquals("simulation.finished", types.get(types.size() - 1));
    }

    @Test
    void rejectsBadArguments() {
        Scenario scenario = TestScenarios.builder().build();

        assertThrows(IllegalArgumentException.class, () -> simulator.simulate(null, 10));
        assertThrows(IllegalArgumentException.class, () -> simulator.simulate(scenario, 0));
    }
}
