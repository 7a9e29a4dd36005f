package com.shadows.core.spawn;

import java.util.List;

/**
 * Diagnostic snapshot of the spawn runtime.
 *
 * @param missingRequired "Item: name" / "Tile: name" for required things not yet on the board
 */
public record SpawnStatus(
    int totalItems,
    int spawnedItems,
    int collectedItems,
    int totalTiles,
    int spawnedTiles,
    List<String> missingRequired
) {

    public SpawnStatus {
        missingRequired = List.copyOf(missingRequired);
    }
}
