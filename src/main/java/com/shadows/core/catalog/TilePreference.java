package com.shadows.core.catalog;

import com.shadows.core.model.TileCategory;

import java.util.List;
import java.util.Set;

/**
 * How a theme steers board generation toward fitting tiles.
 */
public record TilePreference(
    List<String> preferredNames,
    List<String> avoidNames,
    Set<TileCategory> preferredCategories,
    Set<TileCategory> avoidCategories,
    String floorPreference
) {

    public TilePreference {
        preferredNames = List.copyOf(preferredNames);
        avoidNames = List.copyOf(avoidNames);
        preferredCategories = Set.copyOf(preferredCategories);
        avoidCategories = Set.copyOf(avoidCategories);
    }
}
