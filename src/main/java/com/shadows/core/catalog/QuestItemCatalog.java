package com.shadows.core.catalog;

import java.util.Map;

/**
 * Display names and descriptions for quest items, keyed by objective target id.
 */
public final class QuestItemCatalog {

    private QuestItemCatalog() {}

    public static final QuestItemDefinition FALLBACK =
            new QuestItemDefinition("Mysterious Item", "An item of unknown purpose.");

    private static final Map<String, QuestItemDefinition> DEFINITIONS = Map.ofEntries(
            Map.entry("iron_key", new QuestItemDefinition("Iron Key",
                    "A heavy iron key, cold to the touch. It seems to absorb light.")),
            Map.entry("silver_key", new QuestItemDefinition("Silver Key",
                    "An ornate silver key with strange symbols etched into the bow.")),
            Map.entry("cursed_key", new QuestItemDefinition("Cursed Key",
                    "This key feels wrong. Holding it makes your hands tremble.")),
            Map.entry("skeleton_key", new QuestItemDefinition("Skeleton Key",
                    "A master key made from what appears to be actual bone.")),
            Map.entry("quest_key", new QuestItemDefinition("Sealed Key",
                    "The key that will unlock the way out. It pulses with faint energy.")),
            Map.entry("intel_clue", new QuestItemDefinition("Cultist Note",
                    "A scrap of paper with cryptic writings about the cult's activities.")),
            Map.entry("evidence_clue", new QuestItemDefinition("Evidence",
                    "Damning evidence of what has been happening here.")),
            Map.entry("investigation_clue", new QuestItemDefinition("Investigation Clue",
                    "A piece of the puzzle falls into place.")),
            Map.entry("artifact_clue", new QuestItemDefinition("Ancient Inscription",
                    "Weathered text that hints at the location of something powerful.")),
            Map.entry("necro_page", new QuestItemDefinition("Necronomicon Page",
                    "A page torn from the dread book. The text writhes before your eyes.")),
            Map.entry("artifact_fragment", new QuestItemDefinition("Artifact Fragment",
                    "Part of something greater. It hums with residual power.")),
            Map.entry("seal_piece", new QuestItemDefinition("Seal Fragment",
                    "A piece of an ancient seal. Perhaps it can be reassembled.")),
            Map.entry("ritual_component", new QuestItemDefinition("Ritual Component",
                    "An ingredient for dark rituals. Handle with care.")),
            Map.entry("journal_page", new QuestItemDefinition("Journal Page",
                    "A page from someone's private journal. The handwriting grows more frantic.")),
            Map.entry("elder_sign", new QuestItemDefinition("Elder Sign",
                    "An ancient symbol of protection against the outer dark.")),
            Map.entry("barricade_supply", new QuestItemDefinition("Barricade Supplies",
                    "Boards, nails, and tools. Useful for fortification.")),
            Map.entry("occult_item", new QuestItemDefinition("Occult Artifact",
                    "An item of dark power. Its purpose is unclear."))
    );

    public static QuestItemDefinition definitionFor(String targetId) {
        if (targetId == null) {
            return FALLBACK;
        }
        return DEFINITIONS.getOrDefault(targetId, FALLBACK);
    }
}
