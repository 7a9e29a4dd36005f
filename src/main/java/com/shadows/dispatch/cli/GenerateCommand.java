package com.shadows.dispatch.cli;

import com.shadows.core.model.Difficulty;
import com.shadows.core.persistence.SaveGameCodec;
import com.shadows.core.persistence.SaveGameException;
import com.shadows.core.repair.ValidatedScenario;
import com.shadows.core.repair.ValidatedScenarioGenerator;
import com.shadows.core.validation.WinnabilityValidator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: shadows generate [-d difficulty] [-n count] [--attempts N] [--out file]
 * <p>
 * Runs the validated-generation loop and prints each scenario with its verdict.
 * With {@code --out} the scenarios are written as JSON; further scenarios get a
 * numeric suffix ({@code mission.json}, {@code mission-2.json}, ...).
 */
@Command(name = "generate", mixinStandardHelpOptions = true, description = "Generate winnable scenarios")
@Component
public class GenerateCommand implements Callable<Integer> {

    @Option(names = {"--difficulty", "-d"}, description = "Normal, Hard or Nightmare", defaultValue = "Normal")
    private String difficulty;

    @Option(names = {"--count", "-n"}, description = "Number of scenarios to generate", defaultValue = "1")
    private int count;

    @Option(names = "--attempts", description = "Generator calls allowed per scenario")
    private Integer attempts;

    @Option(names = "--out", description = "Write the scenario JSON to this file")
    private Path out;

    private final ValidatedScenarioGenerator generator;
    private final WinnabilityValidator validator;
    private final SaveGameCodec codec;

    public GenerateCommand(ValidatedScenarioGenerator generator, WinnabilityValidator validator, SaveGameCodec codec) {
        this.generator = generator;
        this.validator = validator;
        this.codec = codec;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Difficulty level;
        try {
            level = Difficulty.fromLabel(difficulty);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid difficulty: " + difficulty + ". Valid: Normal, Hard, Nightmare");
            return 2;
        }
        if (count < 1) {
            ConsoleOutput.error("--count must be at least 1");
            return 2;
        }
        if (attempts != null && attempts < 1) {
            ConsoleOutput.error("--attempts must be at least 1");
            return 2;
        }

        for (int i = 1; i <= count; i++) {
            Optional<ValidatedScenario> result = attempts != null
                    ? generator.generateValidatedScenario(level, attempts)
                    : generator.generateValidatedScenario(level);
            if (result.isEmpty()) {
                ConsoleOutput.error("No winnable " + level.label() + " scenario found; try more --attempts");
                return 1;
            }
            ValidatedScenario validated = result.get();
            ConsoleOutput.scenario(validated.scenario());
            ConsoleOutput.validation(validated.validation(), validator.getValidationSummary(validated.validation()));
            ConsoleOutput.info("Accepted after " + validated.attempts() + " attempt(s)"
                    + (validated.wasFixed() ? ", auto-fixed:" : ""));
            validated.fixChanges().forEach(ConsoleOutput::fixChange);

            if (out != null) {
                Path target = targetFile(i);
                try {
                    codec.writeScenario(validated.scenario(), target);
                } catch (SaveGameException e) {
                    ConsoleOutput.error(e.getMessage());
                    return 1;
                }
                ConsoleOutput.success("Wrote " + target);
            }
        }
        return 0;
    }

    private Path targetFile(int index) {
        if (index == 1) {
            return out;
        }
        String name = out.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String numbered = dot > 0
                ? name.substring(0, dot) + "-" + index + name.substring(dot)
                : name + "-" + index;
        return out.resolveSibling(numbered);
    }
}
