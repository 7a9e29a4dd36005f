package com.shadows.core.catalog;

import com.shadows.core.model.Difficulty;
import com.shadows.core.model.ObjectiveType;

import java.util.List;
import java.util.Map;

/**
 * Text banks for titles, briefings, names and bonus objectives.
 */
public final class NarrativeBank {

    private NarrativeBank() {}

    public static final List<String> TARGET_NAMES = List.of(
            "Dark Priest",
            "High Cultist",
            "Warlock Theron",
            "The Hooded One",
            "Sister of the Sign",
            "Prophet of Y'golonac",
            "Keeper of the Gate"
    );

    public static final List<String> VICTIM_NAMES = List.of(
            "Professor Warren",
            "Dr. Armitage",
            "Agent Morrison",
            "Father Iwanicki",
            "Miss Tillinghast",
            "Young Thomas",
            "The Journalist"
    );

    public static final List<String> MYSTERY_NAMES = List.of(
            "the Blackwood disappearances",
            "the Harbor murders",
            "the missing students",
            "the cult's true purpose",
            "the source of the nightmares",
            "the Innsmouth connection"
    );

    public static final List<CollectibleName> COLLECTIBLES = List.of(
            new CollectibleName("necro_page", "Necronomicon Page", "Necronomicon Pages"),
            new CollectibleName("artifact_fragment", "Artifact Fragment", "Artifact Fragments"),
            new CollectibleName("seal_piece", "Seal Piece", "Seal Pieces"),
            new CollectibleName("ritual_component", "Ritual Component", "Ritual Components"),
            new CollectibleName("elder_sign", "Elder Sign", "Elder Signs"),
            new CollectibleName("evidence_clue", "Evidence", "Pieces of Evidence")
    );

    public static final List<String> BRIEFING_OPENINGS = List.of(
            "The telegram arrived at midnight, its words trembling in the candlelight.",
            "You knew this day would come. The signs have been mounting for weeks.",
            "Professor Armitage burst through your door, pale as death itself.",
            "The dream woke you again, the same vision of impossible geometry.",
            "The newspaper headline confirms your worst fears.",
            "A knock at the door. A stranger with hollow eyes hands you an envelope.",
            "The stars aligned three nights ago. Since then, nothing has been the same.",
            "You found the journal in the old bookshop. Its final entry is today's date."
    );

    /** Keyed by mission id or victory type; the generator tries the mission id first. */
    public static final Map<String, List<String>> BRIEFING_MIDDLES = Map.of(
            "escape", List.of(
                    "The doors have sealed themselves. The windows show only darkness. Something knows you are here.",
                    "You are trapped. Whatever force brought you here doesn't intend to let you leave.",
                    "Every exit is blocked by forces beyond understanding. Only one key can open the way out."),
            "assassination", List.of(
                    "The cult's leader must be stopped before the ritual is complete. There will be no trial, only cold steel.",
                    "They call him the Chosen One. Tonight, you will prove the stars chose wrong.",
                    "The high priest has evaded justice for too long. Tonight, justice finds him."),
            "survival", List.of(
                    "Wave after wave of horrors from beyond the veil. There is no escape, only survival.",
                    "Hold the line until dawn. If dawn ever comes.",
                    "They are coming. They will not stop. You must not fall."),
            "collection", List.of(
                    "The fragments are scattered across the city. Collect them before the enemy.",
                    "Each piece calls to the others. You can feel them pulling at your mind.",
                    "Pieces of a puzzle that should never have been separated."),
            "ritual", List.of(
                    "The banishment must be performed before the alignment completes.",
                    "Three components. One ritual. The fate of reality hangs in the balance.",
                    "The old rites can seal what has been opened. But at what cost?"),
            "rescue", List.of(
                    "They took someone important. The catacombs don't give up their prisoners easily.",
                    "Time is running out. Every moment in the darkness costs them more of their sanity.",
                    "Find them. Save them. Try not to join them in eternal imprisonment."),
            "investigation", List.of(
                    "The truth is buried beneath layers of lies and madness. Dig deep enough, and you might survive what you find.",
                    "Every clue leads deeper into the conspiracy. Some truths are better left unknown.",
                    "Connect the threads before you become another loose end.")
    );

    public static final Map<Difficulty, List<String>> BRIEFING_CLOSINGS = Map.of(
            Difficulty.NORMAL, List.of(
                    "The investigation begins. May fortune favor the brave.",
                    "Steel your nerves. The night is young.",
                    "Time is short, but not yet critical. Move carefully."),
            Difficulty.HARD, List.of(
                    "The clock is ticking. There will be no second chances.",
                    "Whatever awaits you down there isn't expecting company. Keep it that way.",
                    "Failure is not an option. The cost is too high."),
            Difficulty.NIGHTMARE, List.of(
                    "Some who enter will not return. Make your peace with that.",
                    "The stars themselves conspire against you. Prove them wrong.",
                    "This may be a one-way trip. Make it count.")
    );

    /** Keyed by mission id or victory type, mission id first. */
    public static final Map<String, List<String>> TITLE_TEMPLATES = Map.of(
            "escape", List.of("Escape from {location}", "The {location} Trap", "No Exit at {location}",
                    "Prisoner of {location}"),
            "assassination", List.of("The {target} Must Die", "Death to the {target}", "Hunt for the {target}",
                    "Silencing the {target}"),
            "survival", List.of("The Siege of {location}", "Last Stand at {location}", "Night of Terror",
                    "Hold the Line"),
            "collection", List.of("The {item} Hunt", "Scattered {items}", "Race for the {items}",
                    "Gathering the {items}"),
            "rescue", List.of("Save {victim}", "The {victim} Rescue", "Into the Dark for {victim}",
                    "No One Left Behind"),
            "ritual", List.of("The Banishment Rite", "Counter-Ritual", "Breaking the Seal", "The Final Incantation"),
            "investigation", List.of("The {mystery} Case", "Uncovering {mystery}", "The Truth About {mystery}",
                    "Investigating {mystery}"),
            "seal_portal", List.of("Seal the Gate", "Closing the Rift", "The Elder Seal", "Binding the Portal"),
            "purge", List.of("Cleanse {location}", "Purge of {location}", "Extermination at {location}",
                    "The {location} Purge")
    );

    private static final Map<String, String> ENEMY_PLURALS = Map.of(
            "cultist", "Cultists",
            "ghoul", "Ghouls",
            "deepone", "Deep Ones",
            "mi-go", "Mi-Go"
    );

    public static final String FALLBACK_TITLE = "The {location} Incident";

    /** Shared bonus objectives, always optional. */
    public static final List<ObjectiveTemplate> BONUS_OBJECTIVES = List.of(
            new ObjectiveTemplate("bonus_journal", "Find hidden journal pages scattered throughout.",
                    "Find Journals (0/{count})", ObjectiveType.COLLECT, List.of("journal_page"),
                    new AmountRange(2, 4), true, false, null, 2, List.of("elder_sign", "occult_tome")),
            new ObjectiveTemplate("bonus_kill", "Eliminate the elite guards.",
                    "Kill Elites (0/{count})", ObjectiveType.KILL_ENEMY, List.of("cultist", "ghoul"),
                    new AmountRange(3, 5), true, false, null, 1, null),
            new ObjectiveTemplate("bonus_artifact", "Recover the lost artifact.",
                    "Find Artifact", ObjectiveType.FIND_ITEM,
                    List.of("lost_artifact", "cursed_idol", "ancient_relic"),
                    null, true, true, null, null, List.of("elder_sign", "ritual_candles", "protective_ward")),
            new ObjectiveTemplate("bonus_explore", "Fully explore the area.",
                    "Explore All (0/{count})", ObjectiveType.EXPLORE, null,
                    new AmountRange(6, 10), true, false, null, 2, null)
    );

    public static List<String> titleTemplates(String missionId, String victoryKey) {
        List<String> byMission = TITLE_TEMPLATES.get(missionId);
        if (byMission != null) {
            return byMission;
        }
        return TITLE_TEMPLATES.getOrDefault(victoryKey, List.of(FALLBACK_TITLE));
    }

    public static List<String> briefingMiddles(String missionId, String victoryKey) {
        List<String> byMission = BRIEFING_MIDDLES.get(missionId);
        if (byMission != null) {
            return byMission;
        }
        return BRIEFING_MIDDLES.getOrDefault(victoryKey, BRIEFING_MIDDLES.get("escape"));
    }

    public static List<String> briefingClosings(Difficulty difficulty) {
        return BRIEFING_CLOSINGS.getOrDefault(difficulty, BRIEFING_CLOSINGS.get(Difficulty.NORMAL));
    }

    /** Plural display name for an enemy type, "enemies" when unknown. */
    public static String enemyPlural(String enemyType) {
        if (enemyType == null) {
            return "enemies";
        }
        return ENEMY_PLURALS.getOrDefault(enemyType, "enemies");
    }

    public static CollectibleName collectible(String key) {
        return COLLECTIBLES.stream().filter(c -> c.key().equals(key)).findFirst().orElse(null);
    }
}
