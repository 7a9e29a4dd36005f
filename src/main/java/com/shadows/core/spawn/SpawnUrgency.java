package com.shadows.core.spawn;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SpawnUrgency {
    @JsonProperty("none") NONE,
    @JsonProperty("warning") WARNING,
    @JsonProperty("critical") CRITICAL
}
