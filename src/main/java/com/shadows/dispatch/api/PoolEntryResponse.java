package com.shadows.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shadows.core.model.Scenario;
import com.shadows.core.validation.ValidationResult;

/**
 * One scenario of a mission-selection pool with its validation verdict.
 */
public record PoolEntryResponse(
        @JsonProperty("scenario") Scenario scenario,
        @JsonProperty("validation") ValidationResult validation,
        @JsonProperty("summary") String summary
) {}
