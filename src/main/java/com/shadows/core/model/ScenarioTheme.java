package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Visual theme of a scenario; selects tile names, categories and floor types for the board.
 */
public enum ScenarioTheme {
    @JsonProperty("manor") MANOR,
    @JsonProperty("church") CHURCH,
    @JsonProperty("asylum") ASYLUM,
    @JsonProperty("warehouse") WAREHOUSE,
    @JsonProperty("forest") FOREST,
    @JsonProperty("urban") URBAN,
    @JsonProperty("coastal") COASTAL,
    @JsonProperty("underground") UNDERGROUND,
    @JsonProperty("academic") ACADEMIC
}
