package com.shadows.core.catalog;

import com.shadows.core.model.Atmosphere;
import com.shadows.core.model.ScenarioTheme;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.shadows.core.model.TileCategory.BASEMENT;
import static com.shadows.core.model.TileCategory.CORRIDOR;
import static com.shadows.core.model.TileCategory.CRYPT;
import static com.shadows.core.model.TileCategory.FACADE;
import static com.shadows.core.model.TileCategory.FOYER;
import static com.shadows.core.model.TileCategory.NATURE;
import static com.shadows.core.model.TileCategory.ROOM;
import static com.shadows.core.model.TileCategory.STAIRS;
import static com.shadows.core.model.TileCategory.STREET;
import static com.shadows.core.model.TileCategory.URBAN;

/**
 * Theme derivation from a start location, and the theme to tile-preference table.
 */
public final class ThemeCatalog {

    private ThemeCatalog() {}

    public static final TilePreference DEFAULT_PREFERENCE =
            new TilePreference(List.of(), List.of(), Set.of(), Set.of(), "wood");

    /** Location-name keywords checked in order before falling back to the atmosphere. */
    private static final List<Map.Entry<List<String>, ScenarioTheme>> NAME_KEYWORDS = List.of(
            Map.entry(List.of("manor", "mansion", "house", "hotel"), ScenarioTheme.MANOR),
            Map.entry(List.of("church", "chapel"), ScenarioTheme.CHURCH),
            Map.entry(List.of("asylum", "hospital"), ScenarioTheme.ASYLUM),
            Map.entry(List.of("warehouse", "factory", "industrial"), ScenarioTheme.WAREHOUSE),
            Map.entry(List.of("forest", "woods", "marsh"), ScenarioTheme.FOREST),
            Map.entry(List.of("library", "university", "campus"), ScenarioTheme.ACADEMIC),
            Map.entry(List.of("harbor", "coast", "cliff", "dock"), ScenarioTheme.COASTAL),
            Map.entry(List.of("crypt", "cave", "catacomb", "sewer"), ScenarioTheme.UNDERGROUND)
    );

    private static final Map<Atmosphere, ScenarioTheme> ATMOSPHERE_THEMES = new EnumMap<>(Map.of(
            Atmosphere.CREEPY, ScenarioTheme.MANOR,
            Atmosphere.URBAN, ScenarioTheme.URBAN,
            Atmosphere.WILDERNESS, ScenarioTheme.FOREST,
            Atmosphere.ACADEMIC, ScenarioTheme.ACADEMIC,
            Atmosphere.INDUSTRIAL, ScenarioTheme.WAREHOUSE
    ));

    private static final Map<ScenarioTheme, TilePreference> PREFERENCES = new EnumMap<>(Map.of(
            ScenarioTheme.MANOR, new TilePreference(
                    List.of("manor", "mansion", "study", "library", "bedroom", "dining", "gallery", "parlor", "foyer", "cellar", "wine"),
                    List.of("sewer", "harbor", "industrial", "factory", "asylum", "cell"),
                    Set.of(ROOM, FOYER, CORRIDOR, STAIRS, BASEMENT), Set.of(STREET, NATURE), "wood"),
            ScenarioTheme.CHURCH, new TilePreference(
                    List.of("church", "chapel", "altar", "crypt", "vestibule", "bell", "sanctum", "tomb"),
                    List.of("kitchen", "bedroom", "factory", "harbor", "sewer"),
                    Set.of(ROOM, CRYPT, FOYER), Set.of(STREET), "stone"),
            ScenarioTheme.ASYLUM, new TilePreference(
                    List.of("asylum", "hospital", "cell", "ward", "corridor", "reception", "padded", "dissection", "records"),
                    List.of("manor", "mansion", "forest", "harbor", "wine"),
                    Set.of(CORRIDOR, ROOM, BASEMENT), Set.of(NATURE), "tile"),
            ScenarioTheme.WAREHOUSE, new TilePreference(
                    List.of("warehouse", "storage", "factory", "industrial", "boiler", "loading", "crate", "dock"),
                    List.of("manor", "mansion", "church", "bedroom", "parlor", "forest"),
                    Set.of(ROOM, BASEMENT, URBAN), Set.of(NATURE), "stone"),
            ScenarioTheme.FOREST, new TilePreference(
                    List.of("forest", "clearing", "marsh", "path", "grove", "stones", "ruins", "cabin", "hollow"),
                    List.of("asylum", "factory", "warehouse", "hospital", "cell"),
                    Set.of(NATURE), Set.of(CORRIDOR, BASEMENT), "dirt"),
            ScenarioTheme.URBAN, new TilePreference(
                    List.of("street", "alley", "square", "market", "station", "bridge", "plaza", "precinct"),
                    List.of("forest", "marsh", "cave", "crypt", "manor"),
                    Set.of(STREET, URBAN, FACADE), Set.of(NATURE, CRYPT), "cobblestone"),
            ScenarioTheme.COASTAL, new TilePreference(
                    List.of("harbor", "dock", "wharf", "lighthouse", "coastal", "cliff", "boat", "pier", "fishmarket"),
                    List.of("forest", "manor", "asylum", "church"),
                    Set.of(STREET, URBAN, NATURE), Set.of(CRYPT), "cobblestone"),
            ScenarioTheme.UNDERGROUND, new TilePreference(
                    List.of("crypt", "catacomb", "cave", "tunnel", "sewer", "cellar", "tomb", "pit", "altar", "portal"),
                    List.of("street", "square", "market", "forest", "harbor"),
                    Set.of(CRYPT, BASEMENT, CORRIDOR), Set.of(STREET, FACADE), "stone"),
            ScenarioTheme.ACADEMIC, new TilePreference(
                    List.of("library", "university", "campus", "study", "laboratory", "lecture", "museum", "archive", "office"),
                    List.of("sewer", "marsh", "harbor", "factory", "asylum"),
                    Set.of(ROOM, CORRIDOR, FOYER), Set.of(NATURE), "wood")
    ));

    /**
     * Derives the visual theme for a start location. Name keywords win; otherwise the
     * atmosphere decides, and a missing atmosphere yields {@link ScenarioTheme#MANOR}.
     */
    public static ScenarioTheme themeFor(String locationName, Atmosphere atmosphere) {
        String lower = locationName == null ? "" : locationName.toLowerCase();
        for (Map.Entry<List<String>, ScenarioTheme> entry : NAME_KEYWORDS) {
            for (String keyword : entry.getKey()) {
                if (lower.contains(keyword)) {
                    return entry.getValue();
                }
            }
        }
        if (atmosphere == null) {
            return ScenarioTheme.MANOR;
        }
        return ATMOSPHERE_THEMES.getOrDefault(atmosphere, ScenarioTheme.MANOR);
    }

    public static TilePreference preferencesFor(ScenarioTheme theme) {
        if (theme == null) {
            return DEFAULT_PREFERENCE;
        }
        return PREFERENCES.getOrDefault(theme, DEFAULT_PREFERENCE);
    }
}
