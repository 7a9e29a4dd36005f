package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TileCategory {
    @JsonProperty("nature") NATURE,
    @JsonProperty("urban") URBAN,
    @JsonProperty("street") STREET,
    @JsonProperty("facade") FACADE,
    @JsonProperty("foyer") FOYER,
    @JsonProperty("corridor") CORRIDOR,
    @JsonProperty("room") ROOM,
    @JsonProperty("stairs") STAIRS,
    @JsonProperty("basement") BASEMENT,
    @JsonProperty("crypt") CRYPT;

    /** Pass-through tiles never hold quest items. */
    public boolean isPassage() {
        return this == CORRIDOR || this == STREET;
    }
}
