package com.shadows.core.objectives;

import com.shadows.core.catalog.MissionCatalog;
import com.shadows.core.model.DefeatCondition;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.model.ScenarioObjective;
import com.shadows.core.model.VictoryCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Objective progress, reveal chains, and victory/defeat evaluation.
 * <p>
 * Operations return a new {@link Scenario}; completing an objective reveals every hidden
 * objective chained to it, transitively.
 */
@Service
public class ObjectiveTracker {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveTracker.class);

    private static final Pattern PROGRESS_MARKER = Pattern.compile("\\(\\d+/\\d+\\)");

    private final MissionCatalog catalog;

    public ObjectiveTracker(MissionCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Adds {@code amount} to an objective's progress. Objectives without a target complete on any progress.
     *
     * @throws IllegalArgumentException if the scenario has no such objective
     */
    public Scenario updateObjectiveProgress(Scenario scenario, String objectiveId, int amount) {
        ScenarioObjective objective = require(scenario, objectiveId);
        if (objective.completed()) {
            return scenario;
        }
        return applyObjective(scenario, progressed(objective, objective.currentAmount() + amount));
    }

    public Scenario completeObjective(Scenario scenario, String objectiveId) {
        ScenarioObjective objective = require(scenario, objectiveId);
        if (objective.completed()) {
            return scenario;
        }
        return applyObjective(scenario, objective.withCompleted(true));
    }

    /** Stores an updated objective and reveals anything its completion unlocks. */
    public Scenario applyObjective(Scenario scenario, ScenarioObjective updated) {
        Scenario result = scenario.withObjective(updated);
        if (updated.completed()) {
            log.info("Objective {} complete", updated.id());
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (ScenarioObjective objective : result.objectives()) {
                if (objective.hidden() && isComplete(result, objective.revealedBy())) {
                    result = result.withObjective(objective.withHidden(false));
                    log.info("Objective {} revealed", objective.id());
                    changed = true;
                }
            }
        }
        return result;
    }

    /**
     * Advances every visible kill objective the defeated enemy counts toward. Bosses also count
     * toward final-confrontation objectives.
     */
    public Scenario recordKill(Scenario scenario, String enemyType) {
        if (enemyType == null) {
            throw new IllegalArgumentException("enemyType must not be null");
        }
        boolean isBoss = catalog.boss(enemyType).isPresent();
        Scenario result = scenario;
        for (ScenarioObjective objective : scenario.objectives()) {
            if (objective.completed() || objective.hidden()) {
                continue;
            }
            boolean counts = switch (objective.type()) {
                case KILL_BOSS -> isBoss || enemyType.equals(objective.targetId());
                case KILL_ENEMY -> objective.targetId() == null
                        || "any".equals(objective.targetId())
                        || enemyType.equals(objective.targetId());
                case INTERACT -> isBoss && "final_confrontation".equals(objective.targetId());
                default -> false;
            };
            if (counts) {
                result = applyObjective(result, progressed(objective, objective.currentAmount() + 1));
            }
        }
        return result;
    }

    public Scenario updateSurvivalObjectives(Scenario scenario, int round) {
        return trackCount(scenario, ObjectiveType.SURVIVE, round);
    }

    public Scenario updateExploreObjectives(Scenario scenario, int tilesExplored) {
        return trackCount(scenario, ObjectiveType.EXPLORE, tilesExplored);
    }

    private Scenario trackCount(Scenario scenario, ObjectiveType type, int count) {
        Scenario result = scenario;
        for (ScenarioObjective objective : scenario.objectives()) {
            if (objective.type() == type && !objective.completed() && !objective.hidden()
                    && count > objective.currentAmount()) {
                result = applyObjective(result, progressed(objective, count));
            }
        }
        return result;
    }

    public List<String> completedObjectiveIds(Scenario scenario) {
        return scenario.objectives().stream().filter(ScenarioObjective::completed).map(ScenarioObjective::id).toList();
    }

    public List<ScenarioObjective> visibleObjectives(Scenario scenario) {
        return scenario.objectives().stream().filter(o -> !o.hidden()).toList();
    }

    public List<ScenarioObjective> requiredObjectives(Scenario scenario) {
        return scenario.requiredObjectives();
    }

    public List<ScenarioObjective> bonusObjectives(Scenario scenario) {
        return scenario.objectives().stream().filter(ScenarioObjective::optional).toList();
    }

    /** Share of required objectives completed, 0 to 100. */
    public int completionPercentage(Scenario scenario) {
        List<ScenarioObjective> required = scenario.requiredObjectives();
        if (required.isEmpty()) {
            return 100;
        }
        long done = required.stream().filter(ScenarioObjective::completed).count();
        return (int) (done * 100 / required.size());
    }

    public String progressText(ScenarioObjective objective) {
        if (objective.targetAmount() != null) {
            return Math.min(objective.currentAmount(), objective.targetAmount()) + "/" + objective.targetAmount();
        }
        return objective.completed() ? "Done" : "Pending";
    }

    public Optional<VictoryCondition> checkVictory(Scenario scenario) {
        return scenario.victoryConditions().stream()
                .filter(c -> !c.requiredObjectives().isEmpty())
                .filter(c -> c.requiredObjectives().stream().allMatch(id -> isComplete(scenario, id)))
                .findFirst();
    }

    public Optional<DefeatCondition> checkDefeat(Scenario scenario, int doom, boolean allInvestigatorsDead) {
        return checkDefeat(scenario, doom, allInvestigatorsDead, List.of());
    }

    /**
     * @param failedObjectiveIds objectives the host has marked as failed, e.g. an escorted survivor died
     */
    public Optional<DefeatCondition> checkDefeat(Scenario scenario, int doom, boolean allInvestigatorsDead,
                                                 Collection<String> failedObjectiveIds) {
        return scenario.defeatConditions().stream()
                .filter(c -> switch (c.type()) {
                    case ALL_DEAD -> allInvestigatorsDead;
                    case DOOM_ZERO -> doom <= 0;
                    case OBJECTIVE_FAILED -> c.objectiveId() != null && failedObjectiveIds.contains(c.objectiveId());
                })
                .findFirst();
    }

    private static ScenarioObjective progressed(ScenarioObjective objective, int amount) {
        boolean done = objective.targetAmount() == null || amount >= objective.targetAmount();
        String text = objective.shortDescription();
        if (text != null && objective.targetAmount() != null) {
            int shown = Math.min(amount, objective.targetAmount());
            text = PROGRESS_MARKER.matcher(text).replaceFirst("(" + shown + "/" + objective.targetAmount() + ")");
        }
        return objective.withProgress(amount, done, text);
    }

    private static boolean isComplete(Scenario scenario, String objectiveId) {
        return scenario.findObjective(objectiveId).map(ScenarioObjective::completed).orElse(false);
    }

    private static ScenarioObjective require(Scenario scenario, String objectiveId) {
        return scenario.findObjective(objectiveId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown objective: " + objectiveId));
    }
}
