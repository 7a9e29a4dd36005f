package com.shadows.core.spawn;

import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.ScenarioObjective;

/**
 * @param updatedObjective linked objective after progress was applied, null when the item has no objective
 */
public record CollectionResult(
    ObjectiveSpawnState updatedState,
    ScenarioObjective updatedObjective,
    boolean objectiveCompleted
) {}
