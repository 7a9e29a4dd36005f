package com.shadows.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Per-scenario spawn bookkeeping. Every operation returns a new value.
 *
 * @param tilesSinceLastSpawn consecutive explored tiles without an item spawn (pity counter)
 */
public record ObjectiveSpawnState(
    List<QuestItem> questItems,
    List<QuestTile> questTiles,
    int tilesExplored,
    int itemsCollected,
    int tilesSinceLastSpawn
) implements Serializable {

    public ObjectiveSpawnState {
        questItems = questItems == null ? List.of() : List.copyOf(questItems);
        questTiles = questTiles == null ? List.of() : List.copyOf(questTiles);
    }

    public static ObjectiveSpawnState empty() {
        return new ObjectiveSpawnState(List.of(), List.of(), 0, 0, 0);
    }

    public ObjectiveSpawnState withItem(String itemId, UnaryOperator<QuestItem> change) {
        List<QuestItem> items = questItems.stream()
                .map(qi -> qi.id().equals(itemId) ? change.apply(qi) : qi)
                .toList();
        return new ObjectiveSpawnState(items, questTiles, tilesExplored, itemsCollected, tilesSinceLastSpawn);
    }

    public ObjectiveSpawnState withQuestTile(String questTileId, UnaryOperator<QuestTile> change) {
        List<QuestTile> tiles = questTiles.stream()
                .map(qt -> qt.id().equals(questTileId) ? change.apply(qt) : qt)
                .toList();
        return new ObjectiveSpawnState(questItems, tiles, tilesExplored, itemsCollected, tilesSinceLastSpawn);
    }

    public ObjectiveSpawnState withCounters(int explored, int collected, int sinceLastSpawn) {
        return new ObjectiveSpawnState(questItems, questTiles, explored, collected, sinceLastSpawn);
    }
}
