package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum VictoryType {
    @JsonProperty("escape") ESCAPE,
    @JsonProperty("assassination") ASSASSINATION,
    @JsonProperty("survival") SURVIVAL,
    @JsonProperty("collection") COLLECTION,
    @JsonProperty("ritual") RITUAL,
    @JsonProperty("investigation") INVESTIGATION;

    public String key() {
        return name().toLowerCase();
    }
}
