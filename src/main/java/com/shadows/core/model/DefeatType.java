package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DefeatType {
    @JsonProperty("all_dead") ALL_DEAD,
    @JsonProperty("doom_zero") DOOM_ZERO,
    @JsonProperty("objective_failed") OBJECTIVE_FAILED
}
