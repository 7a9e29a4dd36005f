package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DoomEventType {
    @JsonProperty("spawn_enemy") SPAWN_ENEMY,
    @JsonProperty("spawn_boss") SPAWN_BOSS,
    @JsonProperty("buff_enemies") BUFF_ENEMIES,
    @JsonProperty("sanity_hit") SANITY_HIT,
    @JsonProperty("unlock_area") UNLOCK_AREA,
    @JsonProperty("narrative") NARRATIVE
}
