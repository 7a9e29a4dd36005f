package com.shadows.core.validation;

import com.shadows.core.model.DoomEvent;
import com.shadows.core.model.DoomEventType;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.model.ScenarioObjective;

/**
 * Structural facts about a scenario shared by the validator, the pre-filter and the auto-fixer,
 * so all three agree on what "needs a boss" or "enough enemies" means.
 */
public final class ScenarioRules {

    private ScenarioRules() {}

    /** A required kill_boss objective needs a boss to appear. */
    public static boolean requiresBossSpawn(Scenario scenario) {
        return scenario.objectives().stream()
                .anyMatch(o -> o.required() && o.type() == ObjectiveType.KILL_BOSS);
    }

    public static boolean hasBossSpawn(Scenario scenario) {
        return scenario.doomEvents().stream().anyMatch(e -> e.type() == DoomEventType.SPAWN_BOSS);
    }

    /** Sum of {@code spawn_enemy} amounts. */
    public static int enemySpawnCapacity(Scenario scenario) {
        return scenario.doomEvents().stream()
                .filter(e -> e.type() == DoomEventType.SPAWN_ENEMY)
                .mapToInt(e -> Math.max(0, e.amount()))
                .sum();
    }

    /** Regular enemies plus one per boss event (or its amount when larger). */
    public static int totalEnemiesFromEvents(Scenario scenario) {
        int bosses = scenario.doomEvents().stream()
                .filter(e -> e.type() == DoomEventType.SPAWN_BOSS)
                .mapToInt(e -> Math.max(1, e.amount()))
                .sum();
        return enemySpawnCapacity(scenario) + bosses;
    }

    /** Kills demanded by required kill_enemy objectives that carry a positive target. */
    public static int requiredEnemyKills(Scenario scenario) {
        return scenario.objectives().stream()
                .filter(o -> o.required() && o.type() == ObjectiveType.KILL_ENEMY)
                .mapToInt(o -> Math.max(0, o.targetOr(0)))
                .sum();
    }

    /** Longest required survival target, 0 when there is none. */
    public static int survivalRoundsRequired(Scenario scenario) {
        return scenario.objectives().stream()
                .filter(o -> o.required() && o.type() == ObjectiveType.SURVIVE)
                .mapToInt(o -> o.targetOr(0))
                .max()
                .orElse(0);
    }

    public static String bossTypeOf(Scenario scenario) {
        return scenario.doomEvents().stream()
                .filter(e -> e.type() == DoomEventType.SPAWN_BOSS)
                .map(DoomEvent::targetId)
                .findFirst()
                .orElse(null);
    }

    public static ScenarioObjective firstRequired(Scenario scenario, ObjectiveType type) {
        return scenario.objectives().stream()
                .filter(o -> o.required() && o.type() == type)
                .findFirst()
                .orElse(null);
    }
}
