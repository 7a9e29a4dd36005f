package com.shadows.core.spawn;

import com.shadows.core.model.QuestItem;
import com.shadows.core.model.QuestTile;

import java.util.List;

/**
 * Doom-driven backstop verdict: which quest items and tiles must appear now regardless of luck.
 */
public record GuaranteedSpawnCheck(
    SpawnUrgency urgency,
    List<QuestItem> forcedItems,
    List<QuestTile> forcedTiles,
    List<String> warnings
) {

    public GuaranteedSpawnCheck {
        forcedItems = forcedItems == null ? List.of() : List.copyOf(forcedItems);
        forcedTiles = forcedTiles == null ? List.of() : List.copyOf(forcedTiles);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    static GuaranteedSpawnCheck none() {
        return new GuaranteedSpawnCheck(SpawnUrgency.NONE, List.of(), List.of(), List.of());
    }

    public boolean hasForcedSpawns() {
        return !forcedItems.isEmpty() || !forcedTiles.isEmpty();
    }
}
