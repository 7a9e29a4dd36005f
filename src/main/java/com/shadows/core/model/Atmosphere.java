package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Atmosphere {
    @JsonProperty("creepy") CREEPY,
    @JsonProperty("urban") URBAN,
    @JsonProperty("wilderness") WILDERNESS,
    @JsonProperty("academic") ACADEMIC,
    @JsonProperty("industrial") INDUSTRIAL
}
