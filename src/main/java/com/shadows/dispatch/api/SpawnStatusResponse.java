package com.shadows.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shadows.core.spawn.ObjectiveProgress;
import com.shadows.core.spawn.SpawnStatus;

import java.util.List;

public record SpawnStatusResponse(
        @JsonProperty("status") SpawnStatus status,
        @JsonProperty("progress") List<ObjectiveProgress> progress
) {}
