package com.shadows.core.persistence;

import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.Scenario;

import java.io.Serializable;

/**
 * Everything needed to resume a game: the scenario (objective progress and fired doom
 * events included), the spawn runtime state, and the host's doom counter and round.
 */
public record SaveGame(
    Scenario scenario,
    ObjectiveSpawnState spawnState,
    int doom,
    int round
) implements Serializable {}
