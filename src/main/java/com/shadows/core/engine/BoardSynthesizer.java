package com.shadows.core.engine;

import com.shadows.core.catalog.ThemeCatalog;
import com.shadows.core.catalog.TilePreference;
import com.shadows.core.model.ScenarioTheme;
import com.shadows.core.model.Tile;
import com.shadows.core.model.TileCategory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Produces a stream of themed tiles for headless play, one per exploration step.
 * The first tile is always the entrance foyer.
 */
class BoardSynthesizer {

    private static final List<String> ADJECTIVES = List.of("Dusty", "Silent", "Flooded", "Forgotten", "Cold", "Ruined");
    private static final List<String> GENERIC_NAMES = List.of("hall", "room", "storage", "study", "cellar", "chamber");
    private static final List<TileCategory> GENERIC_CATEGORIES =
            List.of(TileCategory.ROOM, TileCategory.CORRIDOR, TileCategory.ROOM, TileCategory.BASEMENT);

    private final TilePreference preference;
    private final List<TileCategory> categories;
    private final Random random;
    private int index;

    BoardSynthesizer(ScenarioTheme theme, Random random) {
        this.preference = ThemeCatalog.preferencesFor(theme);
        List<TileCategory> preferred = preference.preferredCategories().stream()
                .sorted(Comparator.comparingInt(Enum::ordinal))
                .toList();
        this.categories = preferred.isEmpty() ? GENERIC_CATEGORIES : preferred;
        this.random = random;
    }

    Tile next() {
        int i = index++;
        if (i == 0) {
            return tile(i, "Entrance Foyer", TileCategory.FOYER, 0);
        }
        TileCategory category = categories.get(random.nextInt(categories.size()));
        List<String> names = preference.preferredNames().isEmpty() ? GENERIC_NAMES : preference.preferredNames();
        String keyword = names.get(random.nextInt(names.size()));
        String name = ADJECTIVES.get(random.nextInt(ADJECTIVES.size())) + " " + capitalize(keyword);
        int zone = switch (category) {
            case BASEMENT -> -1;
            case CRYPT -> -2;
            default -> 0;
        };
        return tile(i, name, category, zone);
    }

    private Tile tile(int i, String name, TileCategory category, int zone) {
        return new Tile("sim_tile_" + i, i, 0, name, category, preference.floorPreference(), zone,
                true, !category.isPassage(), List.of(), null, false, null, false);
    }

    private static String capitalize(String word) {
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1);
    }
}
