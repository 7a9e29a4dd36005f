package com.shadows.core.spawn;

/**
 * Asks the host to summon a boss where a final confrontation materialized.
 *
 * @param tileId board tile for the boss, null when no explored tile was available
 */
public record BossSpawnSignal(String bossType, String tileId, String questTileId) {}
