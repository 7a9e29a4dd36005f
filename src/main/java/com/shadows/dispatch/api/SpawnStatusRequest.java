package com.shadows.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.Scenario;

/**
 * Request body for POST /api/v1/spawns/status.
 */
public record SpawnStatusRequest(
        @JsonProperty("scenario") Scenario scenario,
        @JsonProperty("state") ObjectiveSpawnState state
) {}
