package com.shadows.core.validation;

import com.shadows.core.balance.BalanceProperties;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.model.ScenarioObjective;
import com.shadows.core.model.VictoryCondition;
import com.shadows.core.model.VictoryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static analysis of a scenario: decides whether it can be won at all and how comfortably.
 * <p>
 * Every check is deterministic and side-effect free. Errors make a scenario unwinnable,
 * warnings only lower the confidence score.
 */
@Service
public class WinnabilityValidator {

    private static final Logger log = LoggerFactory.getLogger(WinnabilityValidator.class);

    private final BalanceProperties balance;

    public WinnabilityValidator(BalanceProperties balance) {
        this.balance = balance;
    }

    public ValidationResult validateScenarioWinnability(Scenario scenario) {
        if (scenario == null) {
            throw new IllegalArgumentException("scenario must not be null");
        }
        var analysis = analyze(scenario);
        List<ValidationIssue> issues = new ArrayList<>();

        checkVictoryPath(scenario, issues);
        checkObjectiveChain(scenario, issues);
        checkDoomBudget(scenario, analysis, issues);
        checkSurvival(scenario, analysis, issues);
        checkEnemySpawns(scenario, analysis, issues);
        checkResources(scenario, analysis, issues);
        checkCollection(scenario, analysis, issues);
        checkAchievableVictory(scenario, analysis, issues);

        long errors = issues.stream().filter(ValidationIssue::isError).count();
        long warnings = issues.size() - errors;
        var confidenceCfg = balance.getConfidence();
        int confidence = (int) (100 - errors * confidenceCfg.getErrorPenalty()
                - warnings * confidenceCfg.getWarningPenalty());
        confidence = Math.max(0, Math.min(100, confidence));

        log.debug("Validated scenario {}: {} error(s), {} warning(s), confidence {}",
                scenario.id(), errors, warnings, confidence);
        return new ValidationResult(errors == 0, confidence, issues, analysis);
    }

    /**
     * Cheap pre-filter run before the full validation. Only looks at the structural
     * problems that make a scenario hopeless.
     */
    public boolean isScenarioBasicallyWinnable(Scenario scenario) {
        if (scenario == null || scenario.victoryConditions().isEmpty()) {
            return false;
        }
        if (scenario.startDoom() < balance.getDoom().getMinimumStartDoom()) {
            return false;
        }
        int survivalRounds = ScenarioRules.survivalRoundsRequired(scenario);
        if (survivalRounds > 0 && survivalRounds >= scenario.startDoom()) {
            return false;
        }
        return !ScenarioRules.requiresBossSpawn(scenario) || ScenarioRules.hasBossSpawn(scenario);
    }

    public String getValidationSummary(ValidationResult result) {
        var confidenceCfg = balance.getConfidence();
        int errorCount = result.errors().size();
        if (errorCount > 0 || result.confidence() < confidenceCfg.getChallengingThreshold()) {
            return "Scenario is NOT winnable - " + errorCount + " critical issue(s) found.";
        }
        if (result.confidence() >= confidenceCfg.getDefiniteThreshold()) {
            return "Scenario is definitely winnable with good strategy.";
        }
        return "Scenario is winnable but may be challenging.";
    }

    public ScenarioAnalysis analyze(Scenario scenario) {
        double rounds = 0;
        int survivalRounds = ScenarioRules.survivalRoundsRequired(scenario);
        int requiredCollectibles = 0;
        boolean hasEscapeRoute = false;

        for (ScenarioObjective objective : scenario.requiredObjectives()) {
            ObjectiveType type = objective.type();
            double unitCost = balance.roundCostFor(type);
            rounds += switch (type) {
                case KILL_ENEMY, COLLECT, EXPLORE -> unitCost * Math.max(1, objective.targetOr(1));
                case SURVIVE -> 0;
                default -> unitCost;
            };
            if (type == ObjectiveType.COLLECT) {
                requiredCollectibles += objective.targetOr(1);
            }
            if (type == ObjectiveType.ESCAPE || isExitTile(objective)) {
                hasEscapeRoute = true;
            }
        }
        int estimatedMinRounds = (int) Math.ceil(Math.max(rounds, survivalRounds));
        int effectiveBudget = (int) Math.floor(scenario.startDoom() * balance.efficiencyFor(scenario.difficulty()));

        long bossKills = scenario.requiredObjectives().stream()
                .filter(o -> o.type() == ObjectiveType.KILL_BOSS)
                .count();

        var doomCfg = balance.getDoom();
        int expectedTiles = (int) Math.floor(scenario.startDoom() * doomCfg.getExpectedTilesPerDoom());
        int availableCollectibles = (int) Math.floor(expectedTiles * doomCfg.getCollectibleRate());

        return new ScenarioAnalysis(
                estimatedMinRounds,
                effectiveBudget,
                ScenarioRules.totalEnemiesFromEvents(scenario),
                ScenarioRules.enemySpawnCapacity(scenario),
                ScenarioRules.hasBossSpawn(scenario),
                ScenarioRules.requiredEnemyKills(scenario) + (int) bossKills,
                survivalRounds,
                requiredCollectibles,
                availableCollectibles,
                hasEscapeRoute,
                findBrokenChains(scenario).isEmpty() && findCycles(scenario).isEmpty());
    }

    private void checkVictoryPath(Scenario scenario, List<ValidationIssue> issues) {
        if (scenario.victoryConditions().isEmpty()) {
            issues.add(ValidationIssue.of(IssueCode.NO_VICTORY_CONDITIONS,
                    "Scenario has no victory conditions",
                    "Add a victory condition listing the required objectives"));
            return;
        }
        for (VictoryCondition condition : scenario.victoryConditions()) {
            for (String ref : condition.requiredObjectives()) {
                if (scenario.findObjective(ref).isEmpty()) {
                    issues.add(ValidationIssue.forObjective(IssueCode.INVALID_VICTORY_OBJECTIVE_REF,
                            "Victory condition references unknown objective '" + ref + "'",
                            "Remove the reference or add the missing objective", ref));
                }
            }
        }
    }

    private void checkObjectiveChain(Scenario scenario, List<ValidationIssue> issues) {
        issues.addAll(findBrokenChains(scenario));
        for (String objectiveId : findCycles(scenario)) {
            issues.add(ValidationIssue.forObjective(IssueCode.CIRCULAR_REVEAL_CHAIN,
                    "Objective '" + objectiveId + "' is part of a circular reveal chain",
                    "Break the cycle so one objective in the chain starts visible", objectiveId));
        }
    }

    private List<ValidationIssue> findBrokenChains(Scenario scenario) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ScenarioObjective objective : scenario.objectives()) {
            if (objective.revealedBy() != null && scenario.findObjective(objective.revealedBy()).isEmpty()) {
                issues.add(ValidationIssue.forObjective(IssueCode.INVALID_REVEAL_REFERENCE,
                        "Objective '" + objective.id() + "' is revealed by unknown objective '"
                                + objective.revealedBy() + "'",
                        "Point revealedBy at an existing objective", objective.id()));
            }
            if (objective.required() && objective.hidden() && objective.revealedBy() == null) {
                issues.add(ValidationIssue.forObjective(IssueCode.UNREVEALED_REQUIRED_OBJECTIVE,
                        "Required objective '" + objective.id() + "' is hidden and nothing reveals it",
                        "Set revealedBy or make the objective visible", objective.id()));
            }
        }
        return issues;
    }

    /** Ids of objectives whose revealedBy chain leads back to themselves. */
    private List<String> findCycles(Scenario scenario) {
        Map<String, String> revealedBy = scenario.objectives().stream()
                .filter(o -> o.revealedBy() != null)
                .collect(Collectors.toMap(ScenarioObjective::id, ScenarioObjective::revealedBy, (a, b) -> a));
        List<String> cyclic = new ArrayList<>();
        for (ScenarioObjective objective : scenario.objectives()) {
            Set<String> seen = new HashSet<>();
            String current = revealedBy.get(objective.id());
            while (current != null && seen.add(current)) {
                if (current.equals(objective.id())) {
                    cyclic.add(objective.id());
                    break;
                }
                current = revealedBy.get(current);
            }
        }
        return cyclic;
    }

    private void checkDoomBudget(Scenario scenario, ScenarioAnalysis analysis, List<ValidationIssue> issues) {
        var doomCfg = balance.getDoom();
        if (scenario.startDoom() < doomCfg.getMinimumStartDoom()) {
            issues.add(ValidationIssue.of(IssueCode.DOOM_TOO_LOW,
                    "Start doom " + scenario.startDoom() + " is below the minimum of "
                            + doomCfg.getMinimumStartDoom(),
                    "Raise startDoom to at least " + doomCfg.getMinimumStartDoom()));
            return;
        }
        // survival time is judged against raw doom below
        if (scenario.victoryType() == VictoryType.SURVIVAL) {
            return;
        }
        int buffer = analysis.effectiveDoomBudget() - analysis.estimatedMinRounds();
        if (buffer < 0) {
            issues.add(ValidationIssue.of(IssueCode.DOOM_TOO_LOW,
                    String.format("Effective doom budget %d is below the estimated %d rounds needed",
                            analysis.effectiveDoomBudget(), analysis.estimatedMinRounds()),
                    "Raise startDoom or reduce objective targets"));
        } else if (buffer < doomCfg.getTightMargin()) {
            issues.add(ValidationIssue.of(IssueCode.DOOM_TIGHT,
                    "Only " + buffer + " round(s) of slack in the doom budget",
                    "Consider raising startDoom by a point or two"));
        }
    }

    private void checkSurvival(Scenario scenario, ScenarioAnalysis analysis, List<ValidationIssue> issues) {
        int rounds = analysis.survivalRoundsRequired();
        if (rounds <= 0) {
            return;
        }
        var survive = ScenarioRules.firstRequired(scenario, ObjectiveType.SURVIVE);
        String objectiveId = survive != null ? survive.id() : null;
        if (rounds >= scenario.startDoom()) {
            issues.add(ValidationIssue.forObjective(IssueCode.SURVIVAL_DOOM_MISMATCH,
                    String.format("Survival needs %d rounds but doom reaches zero after %d",
                            rounds, scenario.startDoom()),
                    "Raise startDoom above " + rounds, objectiveId));
        }
        double pressure = (double) analysis.totalEnemiesFromEvents() / rounds;
        if (pressure > balance.getDoom().getEnemyPressureTolerance()) {
            issues.add(ValidationIssue.forObjective(IssueCode.HIGH_ENEMY_PRESSURE,
                    String.format("%.1f enemies per survival round", pressure),
                    "Spread enemy waves out or reduce their size", objectiveId));
        }
    }

    private void checkEnemySpawns(Scenario scenario, ScenarioAnalysis analysis, List<ValidationIssue> issues) {
        if (ScenarioRules.requiresBossSpawn(scenario) && !analysis.hasBossSpawn()) {
            var boss = ScenarioRules.firstRequired(scenario, ObjectiveType.KILL_BOSS);
            issues.add(ValidationIssue.forObjective(IssueCode.MISSING_BOSS_SPAWN,
                    "A boss must be killed but no doom event spawns one",
                    "Add a spawn_boss doom event", boss != null ? boss.id() : null));
        }
        int requiredKills = ScenarioRules.requiredEnemyKills(scenario);
        int capacity = analysis.enemySpawnCapacity();
        if (requiredKills > capacity) {
            issues.add(ValidationIssue.of(IssueCode.INSUFFICIENT_ENEMY_SPAWNS,
                    String.format("Objectives require %d kills but only %d enemies spawn", requiredKills, capacity),
                    "Add or enlarge spawn_enemy doom events"));
        }
        int purgeThreshold = balance.getDoom().getPurgeThreshold();
        for (ScenarioObjective objective : scenario.requiredObjectives()) {
            int target = objective.targetOr(0);
            if (objective.type() == ObjectiveType.KILL_ENEMY && target > purgeThreshold && target > capacity) {
                issues.add(ValidationIssue.forObjective(IssueCode.PURGE_IMPOSSIBLE,
                        String.format("Objective '%s' needs %d kills, only %d enemies spawn",
                                objective.id(), target, capacity),
                        "Increase spawn_enemy amounts to at least " + target, objective.id()));
            }
        }
    }

    private void checkResources(Scenario scenario, ScenarioAnalysis analysis, List<ValidationIssue> issues) {
        for (ScenarioObjective objective : scenario.requiredObjectives()) {
            if (objective.type() == ObjectiveType.FIND_ITEM && objective.targetId() == null) {
                issues.add(ValidationIssue.forObjective(IssueCode.MISSING_TARGET_ID,
                        "Objective '" + objective.id() + "' does not name the item to find",
                        "Set a targetId so the item can spawn", objective.id()));
            }
        }
        if (scenario.victoryType() == VictoryType.ESCAPE && !analysis.hasEscapeRoute()) {
            issues.add(ValidationIssue.of(IssueCode.ESCAPE_PATH_UNCLEAR,
                    "Escape scenario has no required escape or exit objective",
                    "Add an escape objective targeting an exit"));
        }
    }

    private void checkCollection(Scenario scenario, ScenarioAnalysis analysis, List<ValidationIssue> issues) {
        if (analysis.requiredCollectibles() > 0
                && analysis.availableCollectibles() < analysis.requiredCollectibles()) {
            issues.add(ValidationIssue.of(IssueCode.COLLECTION_UNLIKELY,
                    String.format("About %d collectibles expected, %d required",
                            analysis.availableCollectibles(), analysis.requiredCollectibles()),
                    "Lower collection targets or raise startDoom"));
        }
        int high = balance.getDoom().getHighCollectionTarget();
        for (ScenarioObjective objective : scenario.objectives()) {
            if (objective.type() == ObjectiveType.COLLECT && objective.targetOr(1) > high) {
                issues.add(ValidationIssue.forObjective(IssueCode.HIGH_COLLECTION_TARGET,
                        "Objective '" + objective.id() + "' asks for " + objective.targetOr(1) + " items",
                        "Keep collection targets at " + high + " or fewer", objective.id()));
            }
        }
    }

    private void checkAchievableVictory(Scenario scenario, ScenarioAnalysis analysis, List<ValidationIssue> issues) {
        if (scenario.victoryConditions().isEmpty()) {
            return;
        }
        Map<String, ScenarioObjective> byId = scenario.objectives().stream()
                .collect(Collectors.toMap(ScenarioObjective::id, Function.identity(), (a, b) -> a));
        boolean achievable = scenario.victoryConditions().stream()
                .anyMatch(condition -> condition.requiredObjectives().stream()
                        .allMatch(ref -> byId.containsKey(ref) && isAchievable(byId.get(ref), scenario, analysis)));
        if (!achievable) {
            issues.add(ValidationIssue.of(IssueCode.NO_ACHIEVABLE_VICTORY,
                    "No victory condition can be satisfied",
                    "Repair the blocking objectives listed above"));
        }
    }

    private boolean isAchievable(ScenarioObjective objective, Scenario scenario, ScenarioAnalysis analysis) {
        return switch (objective.type()) {
            case KILL_BOSS -> analysis.hasBossSpawn();
            case KILL_ENEMY -> objective.targetOr(0) <= analysis.enemySpawnCapacity();
            case SURVIVE -> objective.targetOr(0) < scenario.startDoom();
            default -> true;
        };
    }

    private static boolean isExitTile(ScenarioObjective objective) {
        return objective.type() == ObjectiveType.FIND_TILE
                && objective.targetId() != null
                && objective.targetId().contains("exit");
    }
}
