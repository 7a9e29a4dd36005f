package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kinds of scenario objectives. The wire names are the lower snake case forms.
 */
public enum ObjectiveType {
    @JsonProperty("find_item") FIND_ITEM,
    @JsonProperty("find_tile") FIND_TILE,
    @JsonProperty("kill_enemy") KILL_ENEMY,
    @JsonProperty("kill_boss") KILL_BOSS,
    @JsonProperty("survive") SURVIVE,
    @JsonProperty("interact") INTERACT,
    @JsonProperty("escape") ESCAPE,
    @JsonProperty("collect") COLLECT,
    @JsonProperty("explore") EXPLORE,
    @JsonProperty("protect") PROTECT,
    @JsonProperty("escort") ESCORT,
    @JsonProperty("ritual") RITUAL;

    public String key() {
        return name().toLowerCase();
    }
}
