package com.shadows.core.spawn;

import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.QuestItem;
import com.shadows.core.model.QuestTile;
import com.shadows.core.model.TileModification;

import java.util.List;

/**
 * Outcome of one explored tile.
 *
 * @param spawnedItem         item that appeared on the tile (nullable)
 * @param revealedQuestTiles  quest tiles whose reveal condition was met by this event
 * @param spawnedQuestTile    quest tile materialized on the explored tile (nullable)
 * @param tileModification    change the board must apply to the explored tile (nullable)
 * @param bossSpawn           boss to summon when a final confrontation materialized (nullable)
 */
public record TileExplorationResult(
    ObjectiveSpawnState updatedState,
    QuestItem spawnedItem,
    List<QuestTile> revealedQuestTiles,
    QuestTile spawnedQuestTile,
    TileModification tileModification,
    BossSpawnSignal bossSpawn
) {

    public TileExplorationResult {
        revealedQuestTiles = revealedQuestTiles == null ? List.of() : List.copyOf(revealedQuestTiles);
    }
}
