package com.shadows.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShadowsMetricsTest {

    private SimpleMeterRegistry registry;
    private ShadowsMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ShadowsMetrics(registry);
    }

    @Test
    @DisplayName("recordGenerationDuration creates a timer")
    void recordGenerationDuration() {
        metrics.recordGenerationDuration(120);
        var timer = registry.find("shadows.generation.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordScenarioGenerated counts per difficulty")
    void recordScenarioGenerated() {
        metrics.recordScenarioGenerated("Normal", false);
        metrics.recordScenarioGenerated("Normal", true);
        metrics.recordScenarioGenerated("Hard", false);

        var normal = registry.find("shadows.scenarios.generated").tag("difficulty", "Normal").counters();
        var hard = registry.find("shadows.scenarios.generated").tag("difficulty", "Hard").counter();

        assertEquals(2.0, normal.stream().mapToDouble(c -> c.count()).sum());
        assertNotNull(hard);
        assertEquals(1.0, hard.count());
    }

    @Test
    @DisplayName("recordValidation splits verdicts by result")
    void recordValidation() {
        metrics.recordValidation(true, 90);
        metrics.recordValidation(true, 100);
        metrics.recordValidation(false, 20);

        var winnable = registry.find("shadows.validation.verdicts").tag("result", "winnable").counter();
        var unwinnable = registry.find("shadows.validation.verdicts").tag("result", "unwinnable").counter();
        var confidence = registry.find("shadows.validation.confidence").summary();

        assertEquals(2.0, winnable.count());
        assertEquals(1.0, unwinnable.count());
        assertNotNull(confidence);
        assertEquals(3, confidence.count());
        assertEquals(210.0, confidence.totalAmount());
    }

    @Test
    @DisplayName("recordGenerationExhausted increments counter")
    void recordGenerationExhausted() {
        metrics.recordGenerationExhausted();
        var counter = registry.find("shadows.generation.exhausted").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordAutoFix counts passes and repairs")
    void recordAutoFix() {
        metrics.recordAutoFix(3);
        assertEquals(1.0, registry.find("shadows.autofix.applied").counter().count());
        assertEquals(3.0, registry.find("shadows.autofix.changes").summary().totalAmount());
    }

    @Test
    @DisplayName("recordForcedSpawn adds the forced count under the urgency tag")
    void recordForcedSpawn() {
        metrics.recordForcedSpawn("critical", 2);
        metrics.recordForcedSpawn("warning", 1);

        assertEquals(2.0, registry.find("shadows.spawn.forced").tag("urgency", "critical").counter().count());
        assertEquals(1.0, registry.find("shadows.spawn.forced").tag("urgency", "warning").counter().count());
    }

    @Test
    @DisplayName("recordSimulation records outcome and rounds")
    void recordSimulation() {
        metrics.recordSimulation("victory", 9);
        assertEquals(1.0, registry.find("shadows.simulation.outcomes").tag("outcome", "victory").counter().count());
        assertEquals(9.0, registry.find("shadows.simulation.rounds").tag("outcome", "victory").summary().totalAmount());
    }
}
