package com.shadows.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shadows.core.model.Scenario;
import com.shadows.core.repair.ValidatedScenario;
import com.shadows.core.validation.ValidationResult;

import java.util.List;

/**
 * Response body for a successfully generated scenario.
 */
public record ScenarioResponse(
        @JsonProperty("scenario") Scenario scenario,
        @JsonProperty("validation") ValidationResult validation,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("was_fixed") boolean wasFixed,
        @JsonProperty("fix_changes") List<String> fixChanges,
        @JsonProperty("summary") String summary
) {

    static ScenarioResponse from(ValidatedScenario validated, String summary) {
        return new ScenarioResponse(validated.scenario(), validated.validation(), validated.attempts(),
                validated.wasFixed(), validated.fixChanges(), summary);
    }
}
