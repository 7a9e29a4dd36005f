package com.shadows.core.repair;

import com.shadows.core.balance.BalanceProperties;
import com.shadows.core.model.DoomEvent;
import com.shadows.core.model.DoomEventType;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.model.ScenarioObjective;
import com.shadows.core.model.VictoryType;
import com.shadows.core.validation.ScenarioRules;
import com.shadows.core.validation.WinnabilityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies targeted repairs to scenarios that failed validation. Always returns a copy;
 * the input scenario is never touched.
 * <p>
 * Repairs run in a fixed order (doom first, then spawn events) so that new events are
 * placed relative to the final start doom.
 */
@Service
public class ScenarioAutoFixer {

    private static final Logger log = LoggerFactory.getLogger(ScenarioAutoFixer.class);

    private final BalanceProperties balance;
    private final WinnabilityValidator validator;

    public ScenarioAutoFixer(BalanceProperties balance, WinnabilityValidator validator) {
        this.balance = balance;
        this.validator = validator;
    }

    public AutoFixResult autoFixScenario(Scenario scenario) {
        if (scenario == null) {
            throw new IllegalArgumentException("scenario must not be null");
        }
        List<String> changes = new ArrayList<>();
        Scenario fixed = fixSurvivalDoom(scenario, changes);
        fixed = fixMinimumDoom(fixed, changes);
        fixed = fixDoomBudget(fixed, changes);
        fixed = fixBossSpawn(fixed, changes);
        fixed = fixEnemyCapacity(fixed, changes);
        fixed = normalizeThresholds(fixed, changes);

        if (!changes.isEmpty()) {
            fixed = fixed.withDoomProphecy(fixed.doomEvents().stream().map(DoomEvent::prophecyLine).toList());
            log.info("Auto-fixed scenario {} with {} change(s)", scenario.id(), changes.size());
        }
        return new AutoFixResult(fixed, changes);
    }

    private Scenario fixSurvivalDoom(Scenario scenario, List<String> changes) {
        int rounds = ScenarioRules.survivalRoundsRequired(scenario);
        if (rounds <= 0 || rounds < scenario.startDoom()) {
            return scenario;
        }
        int newDoom = rounds + balance.getRepair().getSurvivalSafetyMargin();
        changes.add(String.format("Raised startDoom from %d to %d to cover %d survival rounds",
                scenario.startDoom(), newDoom, rounds));
        return scenario.withStartDoom(newDoom);
    }

    private Scenario fixMinimumDoom(Scenario scenario, List<String> changes) {
        int minimum = balance.getDoom().getMinimumStartDoom();
        if (scenario.startDoom() >= minimum) {
            return scenario;
        }
        changes.add(String.format("Raised startDoom from %d to the minimum of %d", scenario.startDoom(), minimum));
        return scenario.withStartDoom(minimum);
    }

    private Scenario fixDoomBudget(Scenario scenario, List<String> changes) {
        if (scenario.victoryType() == VictoryType.SURVIVAL) {
            return scenario;
        }
        var analysis = validator.analyze(scenario);
        if (analysis.effectiveDoomBudget() >= analysis.estimatedMinRounds()) {
            return scenario;
        }
        double efficiency = balance.efficiencyFor(scenario.difficulty());
        int newDoom = (int) Math.ceil(analysis.estimatedMinRounds() / efficiency)
                + balance.getRepair().getDoomSafetyMargin();
        changes.add(String.format("Raised startDoom from %d to %d for an estimated %d rounds of objectives",
                scenario.startDoom(), newDoom, analysis.estimatedMinRounds()));
        return scenario.withStartDoom(newDoom);
    }

    private Scenario fixBossSpawn(Scenario scenario, List<String> changes) {
        if (!ScenarioRules.requiresBossSpawn(scenario) || ScenarioRules.hasBossSpawn(scenario)) {
            return scenario;
        }
        ScenarioObjective killBoss = ScenarioRules.firstRequired(scenario, ObjectiveType.KILL_BOSS);
        String bossType = killBoss != null && killBoss.targetId() != null ? killBoss.targetId() : "boss";
        int threshold = thresholdAt(scenario, balance.getRepair().getBossThresholdFraction());
        var event = DoomEvent.of(threshold, DoomEventType.SPAWN_BOSS, bossType, 1,
                "The master of this place reveals itself!");
        changes.add(String.format("Added spawn_boss event (%s) at doom %d", bossType, threshold));
        return withAddedEvent(scenario, event);
    }

    private Scenario fixEnemyCapacity(Scenario scenario, List<String> changes) {
        int capacity = ScenarioRules.enemySpawnCapacity(scenario);
        int deficit = ScenarioRules.requiredEnemyKills(scenario) - capacity;
        if (deficit <= 0) {
            return scenario;
        }
        List<DoomEvent> events = new ArrayList<>(scenario.doomEvents());
        for (int i = 0; i < events.size(); i++) {
            DoomEvent e = events.get(i);
            if (e.type() == DoomEventType.SPAWN_ENEMY) {
                events.set(i, new DoomEvent(e.threshold(), e.type(), e.targetId(), e.amount() + deficit,
                        e.message(), e.triggered()));
                changes.add(String.format("Increased %s spawn at doom %d from %d to %d",
                        e.targetId(), e.threshold(), e.amount(), e.amount() + deficit));
                return scenario.withDoomEvents(events);
            }
        }
        ScenarioObjective kill = ScenarioRules.firstRequired(scenario, ObjectiveType.KILL_ENEMY);
        String enemy = kill != null && kill.targetId() != null && !"any".equals(kill.targetId())
                ? kill.targetId()
                : balance.getRepair().getReinforcementEnemy();
        int threshold = thresholdAt(scenario, balance.getRepair().getReinforcementThresholdFraction());
        var event = DoomEvent.of(threshold, DoomEventType.SPAWN_ENEMY, enemy, deficit,
                "Reinforcements pour in from the shadows!");
        changes.add(String.format("Added spawn_enemy event (%d %s) at doom %d", deficit, enemy, threshold));
        return withAddedEvent(scenario, event);
    }

    /**
     * Keeps thresholds unique, strictly decreasing and at least 1. Works upward from the
     * lowest event so late events stay where they are when possible.
     */
    private Scenario normalizeThresholds(Scenario scenario, List<String> changes) {
        List<DoomEvent> ascending = new ArrayList<>(scenario.doomEvents());
        ascending.sort(Comparator.comparingInt(DoomEvent::threshold));
        boolean moved = false;
        int floor = 1;
        for (int i = 0; i < ascending.size(); i++) {
            DoomEvent e = ascending.get(i);
            if (e.threshold() < floor) {
                ascending.set(i, e.withThreshold(floor));
                moved = true;
            }
            floor = ascending.get(i).threshold() + 1;
        }
        if (!moved) {
            return scenario;
        }
        changes.add("Spread doom event thresholds so each fires at a distinct doom value");
        return scenario.withDoomEvents(ascending);
    }

    private static int thresholdAt(Scenario scenario, double fraction) {
        return Math.max(1, (int) Math.ceil(scenario.startDoom() * fraction));
    }

    private static Scenario withAddedEvent(Scenario scenario, DoomEvent event) {
        List<DoomEvent> events = new ArrayList<>(scenario.doomEvents());
        events.add(event);
        return scenario.withDoomEvents(events);
    }
}
