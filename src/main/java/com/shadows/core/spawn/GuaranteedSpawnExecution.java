package com.shadows.core.spawn;

import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.QuestItem;

import java.util.List;

/**
 * @param itemPlacements  forced items and the tiles they were placed on
 * @param questTileSpawns quest tiles that materialized
 * @param deferredItems   forced items with no eligible tile yet; retried on the next check
 */
public record GuaranteedSpawnExecution(
    ObjectiveSpawnState updatedState,
    List<ItemPlacement> itemPlacements,
    List<QuestTileSpawnResult> questTileSpawns,
    List<QuestItem> deferredItems
) {

    public record ItemPlacement(QuestItem item, String tileId) {}

    public GuaranteedSpawnExecution {
        itemPlacements = List.copyOf(itemPlacements);
        questTileSpawns = List.copyOf(questTileSpawns);
        deferredItems = List.copyOf(deferredItems);
    }
}
