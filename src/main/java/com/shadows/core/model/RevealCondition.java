package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RevealCondition {
    @JsonProperty("objective_complete") OBJECTIVE_COMPLETE,
    @JsonProperty("item_found") ITEM_FOUND,
    @JsonProperty("doom_threshold") DOOM_THRESHOLD
}
