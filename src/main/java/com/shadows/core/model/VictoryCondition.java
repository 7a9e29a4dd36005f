package com.shadows.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Victory is reached once every objective listed in {@code requiredObjectives} is complete.
 */
public record VictoryCondition(
    VictoryType type,
    String description,
    List<String> requiredObjectives
) implements Serializable {

    public VictoryCondition {
        requiredObjectives = requiredObjectives == null ? List.of() : List.copyOf(requiredObjectives);
    }
}
