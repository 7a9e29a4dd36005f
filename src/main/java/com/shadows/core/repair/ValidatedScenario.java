package com.shadows.core.repair;

import com.shadows.core.model.Scenario;
import com.shadows.core.validation.ValidationResult;

import java.io.Serializable;
import java.util.List;

/**
 * A scenario that passed full validation.
 *
 * @param attempts   generator invocations used, 1-based
 * @param wasFixed   whether the auto-fixer had to repair the scenario
 * @param fixChanges repairs applied, empty unless {@code wasFixed}
 */
public record ValidatedScenario(
    Scenario scenario,
    ValidationResult validation,
    int attempts,
    boolean wasFixed,
    List<String> fixChanges
) implements Serializable {

    public ValidatedScenario {
        fixChanges = fixChanges == null ? List.of() : List.copyOf(fixChanges);
    }
}
