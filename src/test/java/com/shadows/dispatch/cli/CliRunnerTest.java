package com.shadows.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadows.core.engine.PlaythroughSimulator;
import com.shadows.core.events.EventBus;
import com.shadows.core.persistence.SaveGameCodec;
import com.shadows.core.repair.ValidatedScenarioGenerator;
import com.shadows.core.validation.WinnabilityValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class CliRunnerTest {

    private ValidatedScenarioGenerator generator;
    private CliRunner runner;

    @BeforeEach
    void setUp() {
        generator = mock(ValidatedScenarioGenerator.class);
        WinnabilityValidator validator = mock(WinnabilityValidator.class);
        PlaythroughSimulator simulator = mock(PlaythroughSimulator.class);
        SaveGameCodec codec = new SaveGameCodec(new ObjectMapper());

        CommandLine.IFactory factory = new CommandLine.IFactory() {
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
                    return (K) new SimulateCommand(generator, simulator, new EventBus());
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        runner = new CliRunner(new ShadowsCommand(), factory);
    }

    @Test
    @DisplayName("serve is recognised only as the subcommand")
    void serveDetection() {
        assertTrue(CliRunner.isServeInvocation("serve"));
        assertTrue(CliRunner.isServeInvocation("serve", "--help"));
        assertFalse(CliRunner.isServeInvocation("generate", "--out", "serve"));
        assertFalse(CliRunner.isServeInvocation("validate", "serve"));
        assertFalse(CliRunner.isServeInvocation("--version"));
        assertFalse(CliRunner.isServeInvocation());
    }

    @Test
    @DisplayName("serve mode skips picocli and reports success")
    void serveLeavesCommandLineAlone() {
        runner.run("serve");

        assertEquals(0, runner.getExitCode());
        verifyNoInteractions(generator);
    }

    @Test
    @DisplayName("the command's exit code is handed back to Spring")
    void exitCodeComesFromCommand() {
        runner.run("generate", "-n", "0");
        assertEquals(2, runner.getExitCode());

        runner.run("--version");
        assertEquals(0, runner.getExitCode());
    }

    @Test
    @DisplayName("an option value named serve still runs the command")
    void serveAsOptionValueIsNotServeMode() {
        runner.run("generate", "-d", "serve");

        assertEquals(2, runner.getExitCode());
        verifyNoInteractions(generator);
    }
}
