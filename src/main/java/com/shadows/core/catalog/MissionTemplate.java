package com.shadows.core.catalog;

import com.shadows.core.model.Difficulty;
import com.shadows.core.model.TileSet;
import com.shadows.core.model.VictoryType;

import java.util.List;
import java.util.Map;

/**
 * A mission type: the fixed skeleton that the generator fills with concrete names and amounts.
 *
 * @param baseDoom            starting doom per difficulty
 * @param victoryDescription  description of the single victory condition built from this template
 * @param minimumDifficulty   lowest difficulty the mission may be generated for
 */
public record MissionTemplate(
    String id,
    VictoryType victoryType,
    String name,
    String goalTemplate,
    String specialRuleTemplate,
    TileSet tileSet,
    Map<Difficulty, Integer> baseDoom,
    List<ObjectiveTemplate> objectiveTemplates,
    String victoryDescription,
    Difficulty minimumDifficulty
) {

    public MissionTemplate {
        baseDoom = Map.copyOf(baseDoom);
        objectiveTemplates = List.copyOf(objectiveTemplates);
    }

    public int baseDoomFor(Difficulty difficulty) {
        return baseDoom.get(difficulty);
    }

    public boolean supports(Difficulty difficulty) {
        return difficulty.ordinal() >= minimumDifficulty.ordinal();
    }
}
