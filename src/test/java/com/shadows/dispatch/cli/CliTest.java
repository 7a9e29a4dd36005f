package com.shadows.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadows.core.TestScenarios;
import com.shadows.core.engine.PlaythroughSimulator;
import com.shadows.core.engine.SimulationOutcome;
import com.shadows.core.engine.SimulationReport;
import com.shadows.core.events.EventBus;
import com.shadows.core.model.Difficulty;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.persistence.SaveGameCodec;
import com.shadows.core.repair.ValidatedScenario;
import com.shadows.core.repair.ValidatedScenarioGenerator;
import com.shadows.core.validation.IssueCode;
import com.shadows.core.validation.ValidationIssue;
import com.shadows.core.validation.ValidationResult;
import com.shadows.core.validation.WinnabilityValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static com.shadows.core.TestScenarios.required;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Shadows CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private ValidatedScenarioGenerator generator;
    private WinnabilityValidator validator;
    private PlaythroughSimulator simulator;
    private EventBus eventBus;
    private final SaveGameCodec codec = new SaveGameCodec(new ObjectMapper());

    private final Scenario scenario = TestScenarios.builder()
            .id("gen_1_abcdefg_1")
            .objective(required("obj_key", ObjectiveType.FIND_ITEM, "iron_key", null))
            .event(TestScenarios.boss(3, "shoggoth"))
            .build();

    private final ValidationResult winnable = new ValidationResult(true, 100, List.of(), null);

    private final ValidationResult unwinnable = new ValidationResult(false, 60,
            List.of(ValidationIssue.of(IssueCode.NO_VICTORY_CONDITIONS, "No victory conditions",
                    "Add a victory condition")),
            null);

    @BeforeEach
    void setUp() {
        generator = mock(ValidatedScenarioGenerator.class);
        validator = mock(WinnabilityValidator.class);
        simulator = mock(PlaythroughSimulator.class);
        eventBus = new EventBus();
        when(validator.getValidationSummary(any())).thenReturn("summary");
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == GenerateCommand.class) {
                    return (K) new GenerateCommand(generator, validator, codec);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(validator, codec);
                }
                if (cls == SimulateCommand.class) {
                    return (K) new SimulateCommand(generator, simulator, eventBus);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ShadowsCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private ValidatedScenario validated(int attempts, boolean fixed, List<String> changes) {
        return new ValidatedScenario(scenario, winnable, attempts, fixed, changes);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("generate", "validate", "simulate", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("Procedural mission generator"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Shadows 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints usage")
        void noArgsPrintsUsage() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("unknown option fails")
        void unknownOption() {
            CliResult result = execute("generate", "--bogus");
            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("generate")
    class GenerateTests {

        @Test
        @DisplayName("prints the scenario and its verdict")
        void generatesScenario() {
            when(generator.generateValidatedScenario(Difficulty.NORMAL))
                    .thenReturn(Optional.of(validated(3, true, List.of("Raised start doom to 14"))));

            CliResult result = execute("generate");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("gen_1_abcdefg_1"));
            assertTrue(result.output().contains("WINNABLE"));
            assertTrue(result.output().contains("Accepted after 3 attempt(s)"));
            assertTrue(result.output().contains("Raised start doom to 14"));
        }

        @Test
        @DisplayName("--attempts and --difficulty reach the generator")
        void passesAttempts() {
            when(generator.generateValidatedScenario(Difficulty.HARD, 5))
                    .thenReturn(Optional.of(validated(1, false, List.of())));

            CliResult result = execute("generate", "-d", "Hard", "--attempts", "5");

            assertEquals(0, result.exitCode());
            verify(generator).generateValidatedScenario(Difficulty.HARD, 5);
        }

        @Test
        @DisplayName("writes numbered files for several scenarios")
        void writesFiles(@TempDir Path dir) {
            when(generator.generateValidatedScenario(Difficulty.NORMAL))
                    .thenReturn(Optional.of(validated(1, false, List.of())));
            Path out = dir.resolve("mission.json");

            CliResult result = execute("generate", "-n", "2", "--out", out.toString());

            assertEquals(0, result.exitCode());
            assertTrue(Files.exists(out));
            assertTrue(Files.exists(dir.resolve("mission-2.json")));
            assertEquals(scenario, codec.readScenario(out));
        }

        @Test
        @DisplayName("exits 1 when no winnable scenario is found")
        void exhausted() {
            when(generator.generateValidatedScenario(any(Difficulty.class))).thenReturn(Optional.empty());

            CliResult result = execute("generate");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No winnable Normal scenario"));
        }

        @Test
        @DisplayName("exits 2 on bad input")
        void badInput() {
            assertEquals(2, execute("generate", "-d", "Easy").exitCode());
            assertEquals(2, execute("generate", "-n", "0").exitCode());
            assertEquals(2, execute("generate", "--attempts", "0").exitCode());
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("exits 0 for a winnable scenario file")
        void winnableFile(@TempDir Path dir) {
            Path file = dir.resolve("scenario.json");
            codec.writeScenario(scenario, file);
            when(validator.validateScenarioWinnability(any())).thenReturn(winnable);
            when(validator.isScenarioBasicallyWinnable(any())).thenReturn(true);

            CliResult result = execute("validate", file.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WINNABLE"));
        }

        @Test
        @DisplayName("exits 1 and lists issues for an unwinnable scenario")
        void unwinnableFile(@TempDir Path dir) {
            Path file = dir.resolve("scenario.json");
            codec.writeScenario(scenario, file);
            when(validator.validateScenarioWinnability(any())).thenReturn(unwinnable);
            when(validator.isScenarioBasicallyWinnable(any())).thenReturn(false);

            CliResult result = execute("validate", file.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("NOT WINNABLE"));
            assertTrue(result.output().contains("No victory conditions"));
        }

        @Test
        @DisplayName("exits 2 for a missing file")
        void missingFile(@TempDir Path dir) {
            CliResult result = execute("validate", dir.resolve("absent.json").toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Cannot read"));
        }
    }

    @Nested
    @DisplayName("simulate")
    class SimulateTests {

        private SimulationReport report(SimulationOutcome outcome) {
            return new SimulationReport("gen_1_abcdefg_1", outcome, 7, 5, 1, 0, 0, List.of(), 100);
        }

        @Test
        @DisplayName("prints a tally over all runs")
        void tally() {
            when(generator.generateValidatedScenario(Difficulty.NORMAL))
                    .thenReturn(Optional.of(validated(1, false, List.of())));
            when(simulator.simulate(any(), anyInt()))
                    .thenReturn(report(SimulationOutcome.VICTORY), report(SimulationOutcome.DEFEAT));

            CliResult result = execute("simulate", "--runs", "2", "--max-rounds", "20");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 run(s): 1 victory, 1 defeat, 0 stalled"));
            verify(simulator, times(2)).simulate(scenario, 20);
        }

        @Test
        @DisplayName("exits 1 when generation fails")
        void generationFails() {
            when(generator.generateValidatedScenario(any(Difficulty.class))).thenReturn(Optional.empty());

            assertEquals(1, execute("simulate").exitCode());
        }

        @Test
        @DisplayName("exits 2 on bad input")
        void badInput() {
            assertEquals(2, execute("simulate", "-d", "Easy").exitCode());
            assertEquals(2, execute("simulate", "--runs", "0").exitCode());
        }
    }
}
