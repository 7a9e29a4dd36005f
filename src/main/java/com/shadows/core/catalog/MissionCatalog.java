package com.shadows.core.catalog;

import com.shadows.core.model.Atmosphere;
import com.shadows.core.model.Difficulty;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.TileSet;
import com.shadows.core.model.VictoryType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.shadows.core.model.Atmosphere.ACADEMIC;
import static com.shadows.core.model.Atmosphere.CREEPY;
import static com.shadows.core.model.Atmosphere.INDUSTRIAL;
import static com.shadows.core.model.Atmosphere.URBAN;
import static com.shadows.core.model.Atmosphere.WILDERNESS;

/**
 * Static mission data: mission templates, start locations, enemy pools and the boss pool.
 * All lookups are total; unknown keys resolve to an empty list or a documented default.
 */
@Component
public class MissionCatalog {

    static final List<MissionTemplate> MISSIONS = List.of(
            new MissionTemplate("escape_manor", VictoryType.ESCAPE, "Escape",
                    "Find the {item} and escape from {location}.",
                    "Exit spawns after key is found.",
                    TileSet.INDOOR, doom(16, 14, 12),
                    List.of(
                            new ObjectiveTemplate("find_key",
                                    "Search the {location} to find the {item} that unlocks the exit.",
                                    "Find the {item}", ObjectiveType.FIND_ITEM,
                                    List.of("iron_key", "silver_key", "cursed_key", "skeleton_key"),
                                    null, false, false, null, 1, null),
                            new ObjectiveTemplate("find_exit", "Locate the sealed exit door.",
                                    "Find the Exit", ObjectiveType.FIND_TILE, List.of("exit_door"),
                                    null, false, true, 0, null, null),
                            new ObjectiveTemplate("escape", "Use the key to unlock the exit and escape.",
                                    "Escape", ObjectiveType.ESCAPE, List.of("exit_door"),
                                    null, false, true, 1, null, null)),
                    "Escape through the exit with the key", Difficulty.NORMAL),

            new MissionTemplate("assassination", VictoryType.ASSASSINATION, "Assassination",
                    "Find and kill the {target} before the ritual is complete.",
                    "Boss spawns when found. Enemies are alerted.",
                    TileSet.MIXED, doom(14, 12, 10),
                    List.of(
                            new ObjectiveTemplate("gather_intel",
                                    "Gather intelligence about the {target}'s location.",
                                    "Gather Intel (0/{count})", ObjectiveType.COLLECT, List.of("intel_clue"),
                                    new AmountRange(2, 3), false, false, null, 1, null),
                            new ObjectiveTemplate("find_target", "Locate the {target} in their sanctum.",
                                    "Find {target}", ObjectiveType.FIND_TILE,
                                    List.of("ritual_chamber", "sanctum", "throne_room"),
                                    null, false, true, 0, null, null),
                            new ObjectiveTemplate("kill_target",
                                    "Kill the {target} before they complete their dark work.",
                                    "Kill {target}", ObjectiveType.KILL_BOSS, List.of("priest", "boss"),
                                    null, false, true, 1, null, null)),
                    "Kill the target", Difficulty.NORMAL),

            new MissionTemplate("survival", VictoryType.SURVIVAL, "Siege",
                    "Survive for {rounds} rounds against waves of enemies.",
                    "Enemies spawn in waves. Barricades available.",
                    TileSet.MIXED, doom(14, 18, 22),
                    List.of(
                            new ObjectiveTemplate("survive_half", "Hold the line for the first {half} rounds.",
                                    "Survive {half} Rounds", ObjectiveType.SURVIVE, null,
                                    AmountRange.exactly(5), false, false, null, 1, null),
                            new ObjectiveTemplate("survive_full", "Endure the full assault for {total} rounds.",
                                    "Survive {total} Rounds", ObjectiveType.SURVIVE, null,
                                    new AmountRange(8, 10), false, true, 0, null, null)),
                    "Survive the required number of rounds", Difficulty.NORMAL),

            new MissionTemplate("collection", VictoryType.COLLECTION, "Relic Hunt",
                    "Collect {count} {items} before the enemy.",
                    "Items spawn at random explored locations.",
                    TileSet.MIXED, doom(16, 14, 12),
                    List.of(
                            new ObjectiveTemplate("collect_items", "Search for the {count} scattered {items}.",
                                    "Collect {items} (0/{count})", ObjectiveType.COLLECT,
                                    List.of("necro_page", "artifact_fragment", "seal_piece", "ritual_component"),
                                    new AmountRange(3, 5), false, false, null, 3, null)),
                    "Collect all required items", Difficulty.NORMAL),

            new MissionTemplate("rescue", VictoryType.ESCAPE, "Rescue",
                    "Find {victim} and escort them to safety.",
                    "Victim has limited HP and must survive.",
                    TileSet.INDOOR, doom(16, 14, 12),
                    List.of(
                            new ObjectiveTemplate("find_entrance", "Find the entrance to where {victim} is held.",
                                    "Find Entrance", ObjectiveType.FIND_TILE,
                                    List.of("catacomb_entrance", "dungeon_entrance", "basement_entrance"),
                                    null, false, false, null, null, null),
                            new ObjectiveTemplate("find_victim", "Locate {victim} in the depths.",
                                    "Find {victim}", ObjectiveType.FIND_TILE,
                                    List.of("prison_cell", "ritual_chamber", "holding_area"),
                                    null, false, true, 0, 1, null),
                            new ObjectiveTemplate("escort", "Lead {victim} safely back to the exit.",
                                    "Escort to Safety", ObjectiveType.ESCAPE, List.of("exit"),
                                    null, false, true, 1, null, null)),
                    "Escort the victim to safety", Difficulty.NORMAL),

            new MissionTemplate("investigation", VictoryType.INVESTIGATION, "Investigation",
                    "Uncover the truth about {mystery}.",
                    "Clues reveal the final confrontation.",
                    TileSet.MIXED, doom(18, 16, 14),
                    List.of(
                            new ObjectiveTemplate("gather_clues",
                                    "Investigate locations to gather clues about {mystery}.",
                                    "Gather Clues (0/{count})", ObjectiveType.COLLECT, List.of("evidence_clue"),
                                    new AmountRange(3, 5), false, false, null, 2, null),
                            new ObjectiveTemplate("confront_truth", "Confront what you have discovered.",
                                    "Face the Truth", ObjectiveType.INTERACT, List.of("final_confrontation"),
                                    null, false, true, 0, null, null)),
                    "Uncover and confront the truth", Difficulty.NORMAL),

            new MissionTemplate("ritual", VictoryType.RITUAL, "Counter-Ritual",
                    "Perform the banishment ritual at {location}.",
                    "Ritual requires 3 components. Each component attracts enemies.",
                    TileSet.INDOOR, doom(14, 12, 10),
                    List.of(
                            new ObjectiveTemplate("gather_components",
                                    "Gather the 3 ritual components needed for the banishment.",
                                    "Find Components (0/{count})", ObjectiveType.COLLECT,
                                    List.of("ritual_component"), AmountRange.exactly(3),
                                    false, false, null, 1, null),
                            new ObjectiveTemplate("find_altar",
                                    "Locate the ritual altar where the banishment must be performed.",
                                    "Find the Altar", ObjectiveType.FIND_TILE,
                                    List.of("sacrificial_altar", "ritual_altar", "altar_room"),
                                    null, false, true, 0, null, null),
                            new ObjectiveTemplate("perform_ritual", "Perform the banishment ritual.",
                                    "Complete Ritual", ObjectiveType.RITUAL, null,
                                    null, false, true, 1, null, null)),
                    "Complete the banishment ritual", Difficulty.NORMAL),

            new MissionTemplate("seal_portal", VictoryType.RITUAL, "Seal the Gate",
                    "Place Elder Signs at {count} ritual points to seal the portal.",
                    "Each placement triggers enemy spawn.",
                    TileSet.MIXED, doom(14, 12, 10),
                    List.of(
                            new ObjectiveTemplate("find_points",
                                    "Locate the {count} ritual binding points around the portal.",
                                    "Find Points (0/{count})", ObjectiveType.EXPLORE, List.of("ritual_point"),
                                    new AmountRange(3, 4), false, false, null, 1, null),
                            new ObjectiveTemplate("place_signs", "Place Elder Signs at all ritual points.",
                                    "Place Signs (0/{count})", ObjectiveType.INTERACT,
                                    List.of("elder_sign_placement"), new AmountRange(3, 4),
                                    false, true, 0, null, null)),
                    "Seal the portal with Elder Signs", Difficulty.NORMAL),

            new MissionTemplate("purge", VictoryType.ASSASSINATION, "Purge",
                    "Cleanse {location} by destroying all {enemies}.",
                    "All enemies must be eliminated. No reinforcements.",
                    TileSet.INDOOR, doom(16, 14, 12),
                    List.of(
                            new ObjectiveTemplate("kill_enemies", "Destroy all {enemies} infesting {location}.",
                                    "Kill {enemies} (0/{count})", ObjectiveType.KILL_ENEMY,
                                    List.of("ghoul", "cultist", "deepone"), new AmountRange(5, 8),
                                    false, false, null, null, null),
                            new ObjectiveTemplate("cleanse_area", "Ensure the area is fully cleansed.",
                                    "Cleanse Complete", ObjectiveType.KILL_ENEMY, List.of("any"),
                                    AmountRange.exactly(0), false, true, 0, null, null)),
                    "Eliminate all enemies", Difficulty.NORMAL)
    );

    static final List<LocationOption> INDOOR_LOCATIONS = List.of(
            new LocationOption("Blackwood Manor", TileSet.INDOOR, CREEPY),
            new LocationOption("Arkham Asylum", TileSet.INDOOR, CREEPY),
            new LocationOption("Miskatonic Library", TileSet.INDOOR, ACADEMIC),
            new LocationOption("Abandoned Church", TileSet.INDOOR, CREEPY),
            new LocationOption("The Gilded Hotel", TileSet.INDOOR, URBAN),
            new LocationOption("Derelict Warehouse", TileSet.INDOOR, INDUSTRIAL),
            new LocationOption("The Witch House", TileSet.INDOOR, CREEPY),
            new LocationOption("Funeral Parlor", TileSet.INDOOR, CREEPY),
            new LocationOption("Old Hospital", TileSet.INDOOR, CREEPY),
            new LocationOption("Secret Crypt", TileSet.INDOOR, CREEPY)
    );

    static final List<LocationOption> OUTDOOR_LOCATIONS = List.of(
            new LocationOption("Town Square", TileSet.OUTDOOR, URBAN),
            new LocationOption("Old Cemetery", TileSet.OUTDOOR, CREEPY),
            new LocationOption("Arkham Harbor", TileSet.OUTDOOR, INDUSTRIAL),
            new LocationOption("University Campus", TileSet.OUTDOOR, ACADEMIC),
            new LocationOption("Industrial Quarter", TileSet.OUTDOOR, INDUSTRIAL),
            new LocationOption("Blackwood Forest", TileSet.OUTDOOR, WILDERNESS),
            new LocationOption("Coastal Cliffs", TileSet.OUTDOOR, WILDERNESS),
            new LocationOption("Train Station", TileSet.OUTDOOR, URBAN)
    );

    static final List<LocationOption> MIXED_LOCATIONS = List.of(
            new LocationOption("Police Station", TileSet.MIXED, URBAN),
            new LocationOption("Merchant District", TileSet.MIXED, URBAN),
            new LocationOption("Factory Gate", TileSet.MIXED, INDUSTRIAL),
            new LocationOption("Cemetery Gate", TileSet.MIXED, CREEPY),
            new LocationOption("Miskatonic Bridge", TileSet.MIXED, URBAN)
    );

    static final Map<Difficulty, List<EnemySpawnConfig>> ENEMIES_BY_DIFFICULTY = Map.of(
            Difficulty.NORMAL, List.of(
                    new EnemySpawnConfig("cultist", new AmountRange(2, 3), "Cultists emerge from the shadows!"),
                    new EnemySpawnConfig("ghoul", new AmountRange(1, 2), "Hungry ghouls crawl from the darkness!")),
            Difficulty.HARD, List.of(
                    new EnemySpawnConfig("cultist", new AmountRange(2, 3), "Cultists have found you!"),
                    new EnemySpawnConfig("ghoul", new AmountRange(2, 3), "A ghoul pack attacks!"),
                    new EnemySpawnConfig("deepone", new AmountRange(1, 2), "Deep Ones rise from the depths!")),
            Difficulty.NIGHTMARE, List.of(
                    new EnemySpawnConfig("cultist", new AmountRange(3, 4), "Cultists swarm your position!"),
                    new EnemySpawnConfig("ghoul", new AmountRange(2, 3), "A ghoul horde descends!"),
                    new EnemySpawnConfig("deepone", new AmountRange(2, 3), "Deep Ones breach the surface!"),
                    new EnemySpawnConfig("mi-go", new AmountRange(1, 2), "Mi-Go swoop from the darkness!"))
    );

    static final Map<String, List<EnemySpawnConfig>> ENEMIES_BY_MISSION = Map.of(
            "purge", List.of(
                    new EnemySpawnConfig("ghoul", new AmountRange(2, 3), "The infestation stirs in the dark!"),
                    new EnemySpawnConfig("cultist", new AmountRange(2, 3), "More of the faithful crawl out of hiding!")),
            "survival", List.of(
                    new EnemySpawnConfig("cultist", new AmountRange(2, 4), "Another wave breaks against the barricades!"),
                    new EnemySpawnConfig("ghoul", new AmountRange(2, 3), "Ghouls scrabble at the boarded windows!")),
            "assassination", List.of(
                    new EnemySpawnConfig("cultist", new AmountRange(2, 3), "The target's bodyguards close in!"))
    );

    static final Map<Atmosphere, List<EnemySpawnConfig>> ENEMIES_BY_ATMOSPHERE = Map.of(
            WILDERNESS, List.of(
                    new EnemySpawnConfig("ghoul", new AmountRange(1, 2), "Something crashes through the undergrowth!")),
            INDUSTRIAL, List.of(
                    new EnemySpawnConfig("deepone", new AmountRange(1, 2), "Deep Ones slither out of the flooded machinery!")),
            CREEPY, List.of(
                    new EnemySpawnConfig("ghoul", new AmountRange(1, 2), "Ghouls claw their way out of the walls!")),
            URBAN, List.of(
                    new EnemySpawnConfig("cultist", new AmountRange(2, 3), "A mob of cultists pours out of the alleys!")),
            ACADEMIC, List.of(
                    new EnemySpawnConfig("cultist", new AmountRange(1, 2), "Robed students chant in the lecture halls!"))
    );

    static final List<BossConfig> BOSSES = List.of(
            new BossConfig("shoggoth", "Shoggoth", "A Shoggoth emerges! Tekeli-li!", Difficulty.NORMAL),
            new BossConfig("dark_young", "Dark Young of Shub-Niggurath", "A Dark Young crashes through!", Difficulty.HARD),
            new BossConfig("star_spawn", "Star Spawn of Cthulhu", "A Star Spawn descends!", Difficulty.NIGHTMARE),
            new BossConfig("hunting_horror", "Hunting Horror", "A Hunting Horror blocks the sky!", Difficulty.NIGHTMARE)
    );

    public List<MissionTemplate> missions() {
        return MISSIONS;
    }

    public List<MissionTemplate> missionsFor(Difficulty difficulty) {
        return MISSIONS.stream().filter(m -> m.supports(difficulty)).toList();
    }

    public Optional<MissionTemplate> mission(String id) {
        return MISSIONS.stream().filter(m -> m.id().equals(id)).findFirst();
    }

    /**
     * Candidate start locations. Indoor and outdoor missions draw from their own pool;
     * mixed missions may start anywhere.
     */
    public List<LocationOption> locationsFor(TileSet tileSet) {
        if (tileSet == TileSet.INDOOR) {
            return INDOOR_LOCATIONS;
        }
        if (tileSet == TileSet.OUTDOOR) {
            return OUTDOOR_LOCATIONS;
        }
        List<LocationOption> all = new ArrayList<>(INDOOR_LOCATIONS);
        all.addAll(OUTDOOR_LOCATIONS);
        all.addAll(MIXED_LOCATIONS);
        return List.copyOf(all);
    }

    public List<EnemySpawnConfig> enemiesFor(Difficulty difficulty) {
        return ENEMIES_BY_DIFFICULTY.getOrDefault(difficulty, List.of());
    }

    public List<EnemySpawnConfig> enemiesForMission(String missionId) {
        return missionId == null ? List.of() : ENEMIES_BY_MISSION.getOrDefault(missionId, List.of());
    }

    public List<EnemySpawnConfig> enemiesFor(Atmosphere atmosphere) {
        return atmosphere == null ? List.of() : ENEMIES_BY_ATMOSPHERE.getOrDefault(atmosphere, List.of());
    }

    /** Difficulty, mission and atmosphere pools merged, in that order. */
    public List<EnemySpawnConfig> mergedEnemyPool(Difficulty difficulty, String missionId, Atmosphere atmosphere) {
        List<EnemySpawnConfig> merged = new ArrayList<>(enemiesFor(difficulty));
        merged.addAll(enemiesForMission(missionId));
        merged.addAll(enemiesFor(atmosphere));
        return List.copyOf(merged);
    }

    public List<BossConfig> bosses() {
        return BOSSES;
    }

    /** Bosses whose minimum difficulty does not exceed {@code difficulty}. */
    public List<BossConfig> bossesFor(Difficulty difficulty) {
        return BOSSES.stream()
                .filter(b -> b.difficulty().ordinal() <= difficulty.ordinal())
                .toList();
    }

    public Optional<BossConfig> boss(String type) {
        return BOSSES.stream().filter(b -> b.type().equals(type)).findFirst();
    }

    /** Extra starting doom for locations that take longer to cross. */
    public int doomAdjustment(Atmosphere atmosphere) {
        if (atmosphere == null) {
            return 0;
        }
        return switch (atmosphere) {
            case WILDERNESS -> 2;
            case ACADEMIC -> 1;
            default -> 0;
        };
    }

    private static Map<Difficulty, Integer> doom(int normal, int hard, int nightmare) {
        Map<Difficulty, Integer> map = new EnumMap<>(Difficulty.class);
        map.put(Difficulty.NORMAL, normal);
        map.put(Difficulty.HARD, hard);
        map.put(Difficulty.NIGHTMARE, nightmare);
        return map;
    }
}
