package com.shadows.core.model;

import java.io.Serializable;

/**
 * An objective-linked location. Moves monotonically from unrevealed to revealed to materialized on a board tile.
 *
 * @param revealObjectiveId objective whose completion reveals this tile (nullable)
 * @param bossType          boss summoned when a final confrontation materializes (nullable)
 * @param spawnedOnTileId   board tile carrying this quest tile once spawned (nullable)
 */
public record QuestTile(
    String id,
    String objectiveId,
    QuestTileType type,
    String name,
    boolean spawned,
    boolean revealed,
    RevealCondition revealCondition,
    String revealObjectiveId,
    String bossType,
    String spawnedOnTileId
) implements Serializable {

    public QuestTile asRevealed() {
        return new QuestTile(id, objectiveId, type, name, spawned, true, revealCondition, revealObjectiveId,
                bossType, spawnedOnTileId);
    }

    public QuestTile spawnedOn(String tileId) {
        return new QuestTile(id, objectiveId, type, name, true, true, revealCondition, revealObjectiveId,
                bossType, tileId);
    }
}
