package com.shadows.core.spawn;

import com.shadows.core.model.QuestItemType;
import com.shadows.core.model.QuestTileType;
import com.shadows.core.model.Tile;
import com.shadows.core.model.TileCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpawnAffinityTablesTest {

    private static Tile tile(String name, TileCategory category, int zoneLevel) {
        return new Tile("t", 0, 0, name, category, "stone", zoneLevel, true, true, List.of(), null, false, null, false);
    }

    @Test
    void roomBonusFollowsKeywords() {
        assertEquals(0.25, SpawnAffinityTables.roomSpawnBonus("Ritual Chamber"));
        assertEquals(0.2, SpawnAffinityTables.roomSpawnBonus("Dusty Library"));
        assertEquals(0.15, SpawnAffinityTables.roomSpawnBonus("Wine Cellar"));
        assertEquals(0.1, SpawnAffinityTables.roomSpawnBonus("Storage Room"));
        assertEquals(0.0, SpawnAffinityTables.roomSpawnBonus("Kitchen"));
        assertEquals(0.0, SpawnAffinityTables.roomSpawnBonus(null));
    }

    @Test
    void itemAffinityPicksBestKeyword() {
        assertEquals(3, SpawnAffinityTables.itemRoomScore(QuestItemType.KEY, "Private Study"));
        assertEquals(3, SpawnAffinityTables.itemRoomScore(QuestItemType.CLUE, "Library"));
        assertEquals(3, SpawnAffinityTables.itemRoomScore(QuestItemType.ARTIFACT, "Family Crypt"));
        assertEquals(3, SpawnAffinityTables.itemRoomScore(QuestItemType.COMPONENT, "Laboratory"));
        assertEquals(1, SpawnAffinityTables.itemRoomScore(QuestItemType.COMPONENT, "Kitchen"));
        assertEquals(0, SpawnAffinityTables.itemRoomScore(QuestItemType.KEY, "Kitchen"));
        assertEquals(0, SpawnAffinityTables.itemRoomScore(null, "Study"));
    }

    @Test
    void questTileTypeFromTarget() {
        assertEquals(QuestTileType.EXIT, SpawnAffinityTables.questTileTypeFor("exit_door").type());
        assertEquals(QuestTileType.ALTAR, SpawnAffinityTables.questTileTypeFor("ritual_altar").type());
        assertEquals(QuestTileType.FINAL_CONFRONTATION,
                SpawnAffinityTables.questTileTypeFor("final_confrontation").type());
        assertEquals(QuestTileType.NPC_LOCATION, SpawnAffinityTables.questTileTypeFor("prisoner").type());
        assertEquals("Special Location", SpawnAffinityTables.questTileTypeFor(null).name());
    }

    @Test
    void exitsPreferEntrances() {
        assertEquals(5, SpawnAffinityTables.questTileLocationScore(QuestTileType.EXIT,
                tile("Grand Foyer", TileCategory.FOYER, 0)));
        assertEquals(2, SpawnAffinityTables.questTileLocationScore(QuestTileType.EXIT,
                tile("Servants Hall", TileCategory.ROOM, 0)));
        assertEquals(0, SpawnAffinityTables.questTileLocationScore(QuestTileType.EXIT,
                tile("Parlour", TileCategory.ROOM, 0)));
    }

    @Test
    void altarsAndConfrontationsPreferDepth() {
        Tile crypt = tile("Old Crypt", TileCategory.CRYPT, -2);

        assertEquals(7, SpawnAffinityTables.questTileLocationScore(QuestTileType.ALTAR, crypt));
        assertEquals(6, SpawnAffinityTables.questTileLocationScore(QuestTileType.FINAL_CONFRONTATION, crypt));
        assertEquals(3, SpawnAffinityTables.questTileLocationScore(QuestTileType.ALTAR,
                tile("Chapel", TileCategory.ROOM, 0)));
    }

    @Test
    void npcLocationsPreferRooms() {
        assertEquals(2, SpawnAffinityTables.questTileLocationScore(QuestTileType.NPC_LOCATION,
                tile("Parlour", TileCategory.ROOM, 0)));
        assertEquals(1, SpawnAffinityTables.questTileLocationScore(QuestTileType.NPC_LOCATION,
                tile("Street", TileCategory.STREET, 0)));
        assertEquals(4, SpawnAffinityTables.questTileLocationScore(QuestTileType.NPC_LOCATION,
                tile("Prison Cell", TileCategory.ROOM, 0)));
    }
}
