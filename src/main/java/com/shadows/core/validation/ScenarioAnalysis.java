package com.shadows.core.validation;

import java.io.Serializable;

/**
 * Derived metrics the validator computes before running its checks.
 *
 * @param estimatedMinRounds     rounds needed to clear every required objective, rounded up
 * @param effectiveDoomBudget    start doom scaled by the difficulty efficiency, rounded down
 * @param totalEnemiesFromEvents every enemy and boss the doom events will spawn
 * @param enemySpawnCapacity     enemies from {@code spawn_enemy} events only
 * @param requiredKills          kills demanded by required kill objectives, bosses included
 * @param availableCollectibles  rough estimate of collectibles a party will come across
 */
public record ScenarioAnalysis(
    int estimatedMinRounds,
    int effectiveDoomBudget,
    int totalEnemiesFromEvents,
    int enemySpawnCapacity,
    boolean hasBossSpawn,
    int requiredKills,
    int survivalRoundsRequired,
    int requiredCollectibles,
    int availableCollectibles,
    boolean hasEscapeRoute,
    boolean objectiveChainValid
) implements Serializable {}
