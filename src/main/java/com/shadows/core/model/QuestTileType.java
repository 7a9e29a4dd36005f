package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QuestTileType {
    @JsonProperty("exit") EXIT,
    @JsonProperty("altar") ALTAR,
    @JsonProperty("final_confrontation") FINAL_CONFRONTATION,
    @JsonProperty("npc_location") NPC_LOCATION
}
