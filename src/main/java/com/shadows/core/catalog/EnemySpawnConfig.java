package com.shadows.core.catalog;

/**
 * One entry of an enemy pool: which enemy arrives, how many, and the announcement text.
 */
public record EnemySpawnConfig(String type, AmountRange amount, String message) {}
