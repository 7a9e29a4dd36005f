package com.shadows.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/scenarios.
 *
 * @param difficulty  difficulty label ("Normal", "Hard", "Nightmare"); defaults to Normal
 * @param maxAttempts generator calls allowed before giving up; defaults to the configured value
 */
public record GenerateScenarioRequest(
        @JsonProperty("difficulty") String difficulty,
        @JsonProperty("max_attempts") Integer maxAttempts
) {}
