package com.shadows.core.spawn;

import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.QuestTile;
import com.shadows.core.model.TileModification;

/**
 * All fields except {@code updatedState} are null when nothing materialized.
 */
public record QuestTileSpawnResult(
    ObjectiveSpawnState updatedState,
    QuestTile spawnedQuestTile,
    String targetTileId,
    TileModification tileModification,
    BossSpawnSignal bossSpawn
) {

    static QuestTileSpawnResult none(ObjectiveSpawnState state) {
        return new QuestTileSpawnResult(state, null, null, null, null);
    }

    public boolean spawned() {
        return spawnedQuestTile != null;
    }
}
