package com.shadows.core.repair;

import com.shadows.core.TestScenarios;
import com.shadows.core.balance.BalanceProperties;
import com.shadows.core.balance.GenerationProperties;
import com.shadows.core.events.EventBus;
import com.shadows.core.events.ShadowsEvent;
import com.shadows.core.generator.ScenarioGenerator;
import com.shadows.core.metrics.ShadowsMetrics;
import com.shadows.core.model.Difficulty;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.model.VictoryType;
import com.shadows.core.validation.WinnabilityValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.shadows.core.TestScenarios.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ValidatedScenarioGeneratorTest {

    private ScenarioGenerator scenarioGenerator;
    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private ValidatedScenarioGenerator validatedGenerator;

    @BeforeEach
    void setUp() {
        var balance = new BalanceProperties();
        var validator = new WinnabilityValidator(balance);
        scenarioGenerator = mock(ScenarioGenerator.class);
        registry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        validatedGenerator = new ValidatedScenarioGenerator(scenarioGenerator, validator,
                new ScenarioAutoFixer(balance, validator), new GenerationProperties(),
                new ShadowsMetrics(registry), eventBus);
    }

    private static Scenario good(String id) {
        return TestScenarios.builder()
                .id(id)
                .objective(required("obj_find", ObjectiveType.FIND_ITEM, "iron_key", null))
                .build();
    }

    /** No victory condition: nothing the auto-fixer can repair. */
    private static Scenario hopeless(String id) {
        return TestScenarios.builder()
                .id(id)
                .noVictory()
                .objective(required("obj_find", ObjectiveType.FIND_ITEM, "iron_key", null))
                .build();
    }

    private static Supplier<Scenario> sequence(Scenario... scenarios) {
        Iterator<Scenario> it = Arrays.asList(scenarios).iterator();
        return it::next;
    }

    @Nested
    @DisplayName("Argument checks")
    class ArgumentTests {

        @Test
        @DisplayName("maxAttempts below 1 is rejected")
        void zeroAttempts() {
            assertThrows(IllegalArgumentException.class,
                    () -> validatedGenerator.generateValidatedScenario(() -> good("s"), 0));
        }

        @Test
        @DisplayName("null difficulty is rejected")
        void nullDifficulty() {
            assertThrows(IllegalArgumentException.class,
                    () -> validatedGenerator.generateValidatedScenario((Difficulty) null, 3));
        }
    }

    @Nested
    @DisplayName("Loop")
    class LoopTests {

        @Test
        @DisplayName("a winnable first candidate is returned untouched")
        void acceptsFirst() {
            var result = validatedGenerator.generateValidatedScenario(sequence(good("s1")), 5);

            assertTrue(result.isPresent());
            assertEquals("s1", result.get().scenario().id());
            assertEquals(1, result.get().attempts());
            assertFalse(result.get().wasFixed());
            assertTrue(result.get().fixChanges().isEmpty());
        }

        @Test
        @DisplayName("a repairable candidate is auto-fixed and returned")
        void fixesBrokenCandidate() {
            Scenario broken = TestScenarios.builder()
                    .id("s1")
                    .victoryType(VictoryType.SURVIVAL)
                    .startDoom(10)
                    .objective(required("obj_survive", ObjectiveType.SURVIVE, null, 15))
                    .build();

            var result = validatedGenerator.generateValidatedScenario(sequence(broken), 5);

            assertTrue(result.isPresent());
            assertTrue(result.get().wasFixed());
            assertFalse(result.get().fixChanges().isEmpty());
            assertEquals(17, result.get().scenario().startDoom());
            assertTrue(result.get().validation().winnable());
        }

        @Test
        @DisplayName("hopeless candidates are retried until one validates")
        void retries() {
            var result = validatedGenerator.generateValidatedScenario(
                    sequence(hopeless("s1"), hopeless("s2"), good("s3")), 5);

            assertTrue(result.isPresent());
            assertEquals("s3", result.get().scenario().id());
            assertEquals(3, result.get().attempts());
        }

        @Test
        @DisplayName("gives up after exactly maxAttempts generator calls")
        void exhausts() {
            AtomicInteger calls = new AtomicInteger();
            var result = validatedGenerator.generateValidatedScenario(
                    () -> hopeless("s" + calls.incrementAndGet()), 3);

            assertTrue(result.isEmpty());
            assertEquals(3, calls.get());
            assertEquals(1.0, registry.find("shadows.generation.exhausted").counter().count());
        }

        @Test
        @DisplayName("a null candidate uses up an attempt")
        void skipsNull() {
            var result = validatedGenerator.generateValidatedScenario(sequence(null, good("s2")), 5);

            assertTrue(result.isPresent());
            assertEquals(2, result.get().attempts());
        }

        @Test
        @DisplayName("difficulty overload draws from the scenario generator")
        void usesGenerator() {
            when(scenarioGenerator.generateRandomScenario(Difficulty.HARD)).thenReturn(good("hard_1"));

            var result = validatedGenerator.generateValidatedScenario(Difficulty.HARD, 2);

            assertEquals("hard_1", result.orElseThrow().scenario().id());
            verify(scenarioGenerator, times(1)).generateRandomScenario(Difficulty.HARD);
        }
    }

    @Nested
    @DisplayName("Observability")
    class ObservabilityTests {

        @Test
        @DisplayName("publishes rejected and generated events")
        void publishesEvents() {
            List<ShadowsEvent> events = new ArrayList<>();
            eventBus.subscribeAll(events::add);

            validatedGenerator.generateValidatedScenario(sequence(hopeless("s1"), good("s2")), 5);

            List<String> types = events.stream().map(ShadowsEvent::eventType).toList();
            assertEquals(List.of("scenario.rejected", "scenario.generated"), types);
            assertEquals("s2", events.get(1).scenarioId());
        }

        @Test
        @DisplayName("records generated scenarios, attempts and duration")
        void recordsMetrics() {
            validatedGenerator.generateValidatedScenario(sequence(good("s1")), 5);

            assertEquals(1.0, registry.find("shadows.scenarios.generated")
                    .tag("difficulty", "Normal").counter().count());
            assertEquals(1, registry.find("shadows.generation.attempts").summary().count());
            assertEquals(1, registry.find("shadows.generation.duration").timer().count());
        }
    }
}
