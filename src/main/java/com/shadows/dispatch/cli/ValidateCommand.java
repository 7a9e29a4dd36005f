package com.shadows.dispatch.cli;

import com.shadows.core.model.Scenario;
import com.shadows.core.persistence.SaveGameCodec;
import com.shadows.core.persistence.SaveGameException;
import com.shadows.core.validation.ValidationResult;
import com.shadows.core.validation.WinnabilityValidator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: shadows validate &lt;file&gt;
 * <p>
 * Checks a scenario JSON file for winnability. Exits 0 when winnable, 1 otherwise.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check a scenario file for winnability")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Scenario JSON file")
    private Path file;

    private final WinnabilityValidator validator;
    private final SaveGameCodec codec;

    public ValidateCommand(WinnabilityValidator validator, SaveGameCodec codec) {
        this.validator = validator;
        this.codec = codec;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Scenario scenario;
        try {
            scenario = codec.readScenario(file);
        } catch (SaveGameException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }

        ConsoleOutput.scenario(scenario);
        ValidationResult result = validator.validateScenarioWinnability(scenario);
        ConsoleOutput.validation(result, validator.getValidationSummary(result));
        if (!validator.isScenarioBasicallyWinnable(scenario)) {
            ConsoleOutput.info("Fails the quick structural check as well.");
        }
        return result.winnable() ? 0 : 1;
    }
}
