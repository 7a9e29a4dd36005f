package com.shadows.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A complete, concrete mission. Structural data is fixed once generated and validated;
 * during play only objective progress and doom-event trigger flags change, always by
 * producing a new value.
 * <p>
 * {@code doomEvents} is kept sorted by threshold, highest first.
 */
public record Scenario(
    String id,
    String title,
    String description,
    String briefing,
    String goal,
    String specialRule,
    String startLocation,
    TileSet tileSet,
    Difficulty difficulty,
    int startDoom,
    int doomOnDeath,
    int doomOnSurvivorRescue,
    VictoryType victoryType,
    ScenarioTheme theme,
    String missionTypeId,
    List<ScenarioObjective> objectives,
    List<VictoryCondition> victoryConditions,
    List<DefeatCondition> defeatConditions,
    List<DoomEvent> doomEvents,
    List<String> doomProphecy,
    String estimatedTime,
    String recommendedPlayers
) implements Serializable {

    public Scenario {
        objectives = objectives == null ? List.of() : List.copyOf(objectives);
        victoryConditions = victoryConditions == null ? List.of() : List.copyOf(victoryConditions);
        defeatConditions = defeatConditions == null ? List.of() : List.copyOf(defeatConditions);
        doomEvents = sortDescending(doomEvents);
        doomProphecy = doomProphecy == null ? List.of() : List.copyOf(doomProphecy);
    }

    private static List<DoomEvent> sortDescending(List<DoomEvent> events) {
        if (events == null) {
            return List.of();
        }
        List<DoomEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingInt(DoomEvent::threshold).reversed());
        return List.copyOf(sorted);
    }

    public Optional<ScenarioObjective> findObjective(String objectiveId) {
        if (objectiveId == null) {
            return Optional.empty();
        }
        return objectives.stream().filter(o -> objectiveId.equals(o.id())).findFirst();
    }

    public List<ScenarioObjective> requiredObjectives() {
        return objectives.stream().filter(ScenarioObjective::required).toList();
    }

    public Scenario withStartDoom(int doom) {
        return new Scenario(id, title, description, briefing, goal, specialRule, startLocation, tileSet, difficulty,
                doom, doomOnDeath, doomOnSurvivorRescue, victoryType, theme, missionTypeId, objectives,
                victoryConditions, defeatConditions, doomEvents, doomProphecy, estimatedTime, recommendedPlayers);
    }

    public Scenario withDoomEvents(List<DoomEvent> events) {
        return new Scenario(id, title, description, briefing, goal, specialRule, startLocation, tileSet, difficulty,
                startDoom, doomOnDeath, doomOnSurvivorRescue, victoryType, theme, missionTypeId, objectives,
                victoryConditions, defeatConditions, events, doomProphecy, estimatedTime, recommendedPlayers);
    }

    public Scenario withDoomProphecy(List<String> lines) {
        return new Scenario(id, title, description, briefing, goal, specialRule, startLocation, tileSet, difficulty,
                startDoom, doomOnDeath, doomOnSurvivorRescue, victoryType, theme, missionTypeId, objectives,
                victoryConditions, defeatConditions, doomEvents, lines, estimatedTime, recommendedPlayers);
    }

    public Scenario withObjectives(List<ScenarioObjective> updated) {
        return new Scenario(id, title, description, briefing, goal, specialRule, startLocation, tileSet, difficulty,
                startDoom, doomOnDeath, doomOnSurvivorRescue, victoryType, theme, missionTypeId, updated,
                victoryConditions, defeatConditions, doomEvents, doomProphecy, estimatedTime, recommendedPlayers);
    }

    public Scenario withVictoryConditions(List<VictoryCondition> conditions) {
        return new Scenario(id, title, description, briefing, goal, specialRule, startLocation, tileSet, difficulty,
                startDoom, doomOnDeath, doomOnSurvivorRescue, victoryType, theme, missionTypeId, objectives,
                conditions, defeatConditions, doomEvents, doomProphecy, estimatedTime, recommendedPlayers);
    }

    /** Replaces the objective with the same id; unknown ids leave the scenario unchanged. */
    public Scenario withObjective(ScenarioObjective updated) {
        List<ScenarioObjective> list = objectives.stream()
                .map(o -> o.id().equals(updated.id()) ? updated : o)
                .toList();
        return withObjectives(list);
    }
}
