package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A board tile as seen by the mission core. Owned by the board subsystem; the core only reads it,
 * apart from the {@link TileModification} produced when a quest tile materializes.
 *
 * @param q         axial column
 * @param r         axial row
 * @param category  structural category (nullable for free-form tiles)
 * @param zoneLevel floor depth, negative below ground
 */
public record Tile(
    String id,
    int q,
    int r,
    String name,
    TileCategory category,
    String floorType,
    int zoneLevel,
    boolean explored,
    boolean searchable,
    List<String> items,
    String objectType,
    @JsonProperty("isGate") boolean gate,
    String description,
    boolean hasQuestItem
) implements Serializable {

    public Tile {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean occupied() {
        return hasQuestItem || objectType != null;
    }

    public Tile apply(TileModification mod) {
        if (mod == null) {
            return this;
        }
        return new Tile(id, q, r,
                mod.name() != null ? mod.name() : name,
                category,
                mod.floorType() != null ? mod.floorType() : floorType,
                zoneLevel, explored, searchable, items,
                mod.objectType() != null ? mod.objectType() : objectType,
                gate || mod.gate(),
                mod.description() != null ? mod.description() : description,
                hasQuestItem);
    }

    public Tile withQuestItem() {
        return new Tile(id, q, r, name, category, floorType, zoneLevel, explored, searchable, items,
                objectType, gate, description, true);
    }
}
