package com.shadows.core.model;

import java.io.Serializable;

/**
 * An objective-linked item. Moves monotonically from unspawned to spawned (on a tile) to collected.
 */
public record QuestItem(
    String id,
    String objectiveId,
    String scenarioId,
    QuestItemType type,
    String name,
    String description,
    boolean spawned,
    String spawnedOnTileId,
    boolean collected
) implements Serializable {

    public QuestItem spawnedOn(String tileId) {
        return new QuestItem(id, objectiveId, scenarioId, type, name, description, true, tileId, collected);
    }

    public QuestItem asCollected() {
        return new QuestItem(id, objectiveId, scenarioId, type, name, description, spawned, spawnedOnTileId, true);
    }
}
