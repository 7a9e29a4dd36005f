package com.shadows.core.spawn;

import com.shadows.core.model.QuestItemType;
import com.shadows.core.model.QuestTileType;
import com.shadows.core.model.Tile;
import com.shadows.core.model.TileCategory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Room-name and tile-category lookups that steer where quest items and quest tiles appear.
 * All name matching is case-insensitive substring matching.
 */
public final class SpawnAffinityTables {

    private SpawnAffinityTables() {}

    /** Resolved quest tile kind plus its default display name. */
    public record QuestTileDescriptor(QuestTileType type, String name) {}

    private record RoomBonus(List<String> keywords, double bonus) {}

    private static final List<RoomBonus> ROOM_BONUSES = List.of(
            new RoomBonus(List.of("ritual", "altar", "sanctum"), 0.25),
            new RoomBonus(List.of("study", "library", "office"), 0.2),
            new RoomBonus(List.of("cellar", "basement", "vault"), 0.15),
            new RoomBonus(List.of("storage", "cache", "closet"), 0.1)
    );

    private static final Map<QuestItemType, Map<String, Integer>> ITEM_ROOM_SCORES = Map.of(
            QuestItemType.KEY, Map.of("study", 3, "office", 3, "bedroom", 2, "library", 2, "hall", 1),
            QuestItemType.CLUE, Map.of("library", 3, "study", 3, "archive", 3, "office", 2, "records", 2),
            QuestItemType.COLLECTIBLE, Map.of("vault", 3, "library", 2, "crypt", 2, "chapel", 2, "study", 1),
            QuestItemType.ARTIFACT, Map.of("vault", 3, "crypt", 3, "museum", 3, "sanctum", 3, "chapel", 2),
            QuestItemType.COMPONENT, Map.of("ritual", 3, "laboratory", 3, "storage", 2, "cellar", 2, "kitchen", 1)
    );

    private static final Map<QuestTileType, List<String>> QUEST_TILE_NAME_HINTS = Map.of(
            QuestTileType.EXIT, List.of("entrance", "door", "gate", "hall"),
            QuestTileType.ALTAR, List.of("ritual", "altar", "chamber", "chapel"),
            QuestTileType.FINAL_CONFRONTATION, List.of("sanctum", "chamber", "throne"),
            QuestTileType.NPC_LOCATION, List.of("cell", "prison", "bedroom")
    );

    /** Flat probability bonus for rooms where things tend to be hidden, 0 when nothing matches. */
    public static double roomSpawnBonus(String roomName) {
        String name = lower(roomName);
        for (RoomBonus entry : ROOM_BONUSES) {
            if (entry.keywords().stream().anyMatch(name::contains)) {
                return entry.bonus();
            }
        }
        return 0;
    }

    public static QuestTileDescriptor questTileTypeFor(String targetId) {
        String id = lower(targetId);
        if (id.contains("exit")) {
            return new QuestTileDescriptor(QuestTileType.EXIT, "Exit");
        }
        if (id.contains("ritual") || id.contains("altar")) {
            return new QuestTileDescriptor(QuestTileType.ALTAR, "Ritual Altar");
        }
        if (id.contains("final_confrontation") || id.contains("confront")) {
            return new QuestTileDescriptor(QuestTileType.FINAL_CONFRONTATION, "Final Confrontation");
        }
        return new QuestTileDescriptor(QuestTileType.NPC_LOCATION, "Special Location");
    }

    /** How well a room suits an item type; the best matching keyword wins. */
    public static int itemRoomScore(QuestItemType type, String roomName) {
        if (type == null) {
            return 0;
        }
        String name = lower(roomName);
        return ITEM_ROOM_SCORES.getOrDefault(type, Map.of()).entrySet().stream()
                .filter(e -> name.contains(e.getKey()))
                .mapToInt(Map.Entry::getValue)
                .max()
                .orElse(0);
    }

    /**
     * Suitability of a board tile for a quest tile. Exits favour ground-level entrances,
     * altars and confrontations favour deep crypt-like rooms.
     */
    public static int questTileLocationScore(QuestTileType type, Tile tile) {
        String name = lower(tile.name());
        int score = QUEST_TILE_NAME_HINTS.getOrDefault(type, List.of()).stream().anyMatch(name::contains) ? 2 : 0;
        int depth = Math.max(0, -tile.zoneLevel());
        TileCategory category = tile.category();
        return switch (type) {
            case EXIT -> score + (category == TileCategory.FOYER || category == TileCategory.FACADE ? 5 : 0);
            case ALTAR -> score + depth + categoryScore(category, 5, 4, 1);
            case FINAL_CONFRONTATION -> score + depth + categoryScore(category, 4, 3, 0);
            case NPC_LOCATION -> score + (category == TileCategory.ROOM ? 2 : 1);
        };
    }

    private static int categoryScore(TileCategory category, int crypt, int basement, int room) {
        if (category == null) {
            return 0;
        }
        return switch (category) {
            case CRYPT -> crypt;
            case BASEMENT -> basement;
            case ROOM -> room;
            default -> 0;
        };
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
