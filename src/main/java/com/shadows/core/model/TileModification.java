package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Partial tile update applied by the board when a quest tile materializes. Null fields are left unchanged.
 */
public record TileModification(
    String name,
    String description,
    String floorType,
    String objectType,
    @JsonProperty("isGate") boolean gate
) implements Serializable {}
