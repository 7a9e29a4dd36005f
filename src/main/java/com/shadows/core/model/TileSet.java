package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TileSet {
    @JsonProperty("indoor") INDOOR,
    @JsonProperty("outdoor") OUTDOOR,
    @JsonProperty("mixed") MIXED
}
