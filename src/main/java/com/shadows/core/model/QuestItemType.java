package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QuestItemType {
    @JsonProperty("key") KEY,
    @JsonProperty("clue") CLUE,
    @JsonProperty("collectible") COLLECTIBLE,
    @JsonProperty("artifact") ARTIFACT,
    @JsonProperty("component") COMPONENT
}
