package com.shadows.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for scenario generation and the spawn runtime.
 */
@Service
public class ShadowsMetrics {

    private final MeterRegistry registry;

    public ShadowsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGenerationDuration(long ms) {
        Timer.builder("shadows.generation.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordScenarioGenerated(String difficulty, boolean fixed) {
        Counter.builder("shadows.scenarios.generated")
                .tag("difficulty", difficulty)
                .tag("fixed", String.valueOf(fixed))
                .register(registry)
                .increment();
    }

    public void recordGenerationAttempts(int attempts) {
        DistributionSummary.builder("shadows.generation.attempts")
                .description("Attempts needed per validated scenario")
                .register(registry)
                .record(attempts);
    }

    public void recordGenerationExhausted() {
        Counter.builder("shadows.generation.exhausted")
                .description("Validated-generation loops that ran out of attempts")
                .register(registry)
                .increment();
    }

    public void recordValidation(boolean winnable, int confidence) {
        Counter.builder("shadows.validation.verdicts")
                .tag("result", winnable ? "winnable" : "unwinnable")
                .register(registry)
                .increment();

        DistributionSummary.builder("shadows.validation.confidence")
                .register(registry)
                .record(confidence);
    }

    public void recordAutoFix(int changeCount) {
        Counter.builder("shadows.autofix.applied")
                .register(registry)
                .increment();

        DistributionSummary.builder("shadows.autofix.changes")
                .description("Repairs applied per auto-fix pass")
                .register(registry)
                .record(changeCount);
    }

    /**
     * @param urgency "warning" or "critical"
     */
    public void recordForcedSpawn(String urgency, int count) {
        Counter.builder("shadows.spawn.forced")
                .tag("urgency", urgency)
                .register(registry)
                .increment(count);
    }

    public void recordSimulation(String outcome, int rounds) {
        Counter.builder("shadows.simulation.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("shadows.simulation.rounds")
                .tag("outcome", outcome)
                .register(registry)
                .record(rounds);
    }
}
