package com.shadows.core.engine;

import com.shadows.core.events.EventBus;
import com.shadows.core.events.ShadowsEvent;
import com.shadows.core.logging.MdcContext;
import com.shadows.core.metrics.ShadowsMetrics;
import com.shadows.core.model.DoomEvent;
import com.shadows.core.model.DoomEventType;
import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.QuestItem;
import com.shadows.core.model.QuestTile;
import com.shadows.core.model.Scenario;
import com.shadows.core.model.ScenarioObjective;
import com.shadows.core.model.Tile;
import com.shadows.core.objectives.DoomEventScheduler;
import com.shadows.core.objectives.ObjectiveTracker;
import com.shadows.core.spawn.ObjectiveSpawnService;
import com.shadows.core.spawn.QuestTileSpawnResult;
import com.shadows.core.spawn.SpawnUrgency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Headless host loop used to sanity-check balance. Plays a scenario with an idealized party:
 * one new tile per round, every spawned item picked up at once, at most {@value #KILLS_PER_ROUND}
 * enemies defeated per round, and every revealed quest location reached immediately.
 * <p>
 * The simulator owns the doom counter and lowers it once per round, as a real host would.
 */
@Service
public class PlaythroughSimulator {

    private static final Logger log = LoggerFactory.getLogger(PlaythroughSimulator.class);

    static final int KILLS_PER_ROUND = 2;

    private final ObjectiveSpawnService spawnService;
    private final ObjectiveTracker tracker;
    private final DoomEventScheduler scheduler;
    private final EventBus eventBus;
    private final ShadowsMetrics metrics;
    private final Random random;

    public PlaythroughSimulator(ObjectiveSpawnService spawnService,
                                ObjectiveTracker tracker,
                                DoomEventScheduler scheduler,
                                EventBus eventBus,
                                ShadowsMetrics metrics,
                                Random random) {
        this.spawnService = spawnService;
        this.tracker = tracker;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.random = random;
    }

    public SimulationReport simulate(Scenario scenario, int maxRounds) {
        if (scenario == null) {
            throw new IllegalArgumentException("scenario must not be null");
        }
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1, got " + maxRounds);
        }
        var run = new Run(scenario);
        try {
            for (int round = 1; round <= maxRounds; round++) {
                MdcContext.setRound(scenario.id(), round);
                run.rounds = round;
                playRound(run, round);
                SimulationOutcome outcome = verdict(run);
                if (outcome != null) {
                    return finish(run, outcome);
                }
            }
            return finish(run, SimulationOutcome.STALLED);
        } finally {
            MdcContext.clear();
        }
    }

    private void playRound(Run run, int round) {
        fightPendingEnemies(run);

        Tile tile = run.board.next();
        run.tiles.add(tile);
        var explored = spawnService.onTileExplored(run.state, tile, run.scenario, completedIds(run));
        run.state = explored.updatedState();
        if (explored.spawnedItem() != null) {
            run.itemsSpawned++;
            publish(run, "quest_item.spawned", explored.spawnedItem().id(), Map.of("tile", tile.name()));
            collect(run, explored.spawnedItem());
        }
        if (explored.spawnedQuestTile() != null) {
            onQuestTilePlaced(run, new QuestTileSpawnResult(run.state, explored.spawnedQuestTile(), tile.id(),
                    explored.tileModification(), explored.bossSpawn()));
        }
        for (QuestTile revealed : explored.revealedQuestTiles()) {
            placeImmediately(run, revealed);
        }

        run.scenario = tracker.updateExploreObjectives(run.scenario, run.state.tilesExplored());
        run.scenario = tracker.updateSurvivalObjectives(run.scenario, round);
        advanceInteractions(run);

        run.doom--;
        var tick = scheduler.onDoomChanged(run.scenario, run.doom);
        run.scenario = tick.updatedScenario();
        for (DoomEvent event : tick.firedEvents()) {
            run.firedEvents.add(event.prophecyLine());
            publish(run, "doom.event", null, Map.of("threshold", event.threshold(), "message", event.message()));
            if (event.type() == DoomEventType.SPAWN_ENEMY || event.type() == DoomEventType.SPAWN_BOSS) {
                for (int i = 0; i < Math.max(1, event.amount()); i++) {
                    run.pendingEnemies.add(event.targetId());
                }
            }
        }

        applyGuaranteedSpawns(run);
        announceCompletions(run);
    }

    private void fightPendingEnemies(Run run) {
        for (int i = 0; i < KILLS_PER_ROUND && !run.pendingEnemies.isEmpty(); i++) {
            run.scenario = tracker.recordKill(run.scenario, run.pendingEnemies.poll());
        }
    }

    private void collect(Run run, QuestItem item) {
        var collected = spawnService.collectQuestItem(run.state, item, run.scenario);
        run.state = collected.updatedState();
        if (collected.updatedObjective() != null) {
            run.scenario = tracker.applyObjective(run.scenario, collected.updatedObjective());
        }
        publish(run, "quest_item.collected", item.id(), Map.of("name", item.name()));
    }

    private void placeImmediately(Run run, QuestTile questTile) {
        var result = spawnService.spawnRevealedQuestTileImmediately(run.state, questTile, run.tiles);
        run.state = result.updatedState();
        if (result.spawned()) {
            onQuestTilePlaced(run, result);
        }
    }

    private void onQuestTilePlaced(Run run, QuestTileSpawnResult result) {
        run.questTilesPlaced++;
        QuestTile placed = result.spawnedQuestTile();
        if (result.tileModification() != null && result.targetTileId() != null) {
            run.tiles.replaceAll(t -> t.id().equals(result.targetTileId()) ? t.apply(result.tileModification()) : t);
        }
        publish(run, "quest_tile.materialized", placed.id(), Map.of("type", placed.type().name()));
        if (result.bossSpawn() != null) {
            run.pendingEnemies.add(result.bossSpawn().bossType());
            publish(run, "boss.spawn", placed.id(), Map.of("boss", result.bossSpawn().bossType()));
            return;
        }
        // the party walks to the location and uses it
        run.scenario.findObjective(placed.objectiveId())
                .filter(o -> !o.completed() && !o.hidden())
                .filter(o -> o.type() != ObjectiveType.INTERACT)
                .ifPresent(o -> run.scenario = tracker.completeObjective(run.scenario, o.id()));
    }

    /** Interaction objectives without a quest location advance one step per round. */
    private void advanceInteractions(Run run) {
        Set<String> withLocation = new HashSet<>();
        run.state.questTiles().forEach(qt -> withLocation.add(qt.objectiveId()));
        for (ScenarioObjective objective : run.scenario.objectives()) {
            if (objective.type() == ObjectiveType.INTERACT && !objective.completed() && !objective.hidden()
                    && !withLocation.contains(objective.id())) {
                run.scenario = tracker.updateObjectiveProgress(run.scenario, objective.id(), 1);
                return;
            }
        }
    }

    private void applyGuaranteedSpawns(Run run) {
        var check = spawnService.checkGuaranteedSpawns(run.state, run.scenario, run.doom, completedIds(run));
        if (!check.hasForcedSpawns()) {
            return;
        }
        var execution = spawnService.executeGuaranteedSpawns(run.state, check, run.tiles);
        run.state = execution.updatedState();
        if (check.urgency() != SpawnUrgency.NONE && !execution.itemPlacements().isEmpty()) {
            metrics.recordForcedSpawn(check.urgency().name().toLowerCase(), execution.itemPlacements().size());
        }
        for (var placement : execution.itemPlacements()) {
            run.itemsForced++;
            publish(run, "quest_item.spawned", placement.item().id(), Map.of("forced", true));
            collect(run, placement.item());
        }
        for (QuestTileSpawnResult tileSpawn : execution.questTileSpawns()) {
            onQuestTilePlaced(run, tileSpawn);
        }
    }

    private void announceCompletions(Run run) {
        for (String id : completedIds(run)) {
            if (run.announced.add(id)) {
                publish(run, "objective.completed", id, Map.of());
            }
        }
    }

    private SimulationOutcome verdict(Run run) {
        if (tracker.checkVictory(run.scenario).isPresent()) {
            return SimulationOutcome.VICTORY;
        }
        if (tracker.checkDefeat(run.scenario, run.doom, false).isPresent()) {
            return SimulationOutcome.DEFEAT;
        }
        return null;
    }

    private SimulationReport finish(Run run, SimulationOutcome outcome) {
        var report = new SimulationReport(run.scenario.id(), outcome, run.rounds, run.doom, run.itemsSpawned,
                run.itemsForced, run.questTilesPlaced, run.firedEvents, tracker.completionPercentage(run.scenario));
        log.info("Simulation of {} ended in {} after {} round(s) at doom {}", run.scenario.id(), outcome,
                run.rounds, run.doom);
        metrics.recordSimulation(outcome.name().toLowerCase(), run.rounds);
        publish(run, "simulation.finished", null, Map.of("outcome", outcome.name(), "rounds", run.rounds));
        return report;
    }

    private List<String> completedIds(Run run) {
        return tracker.completedObjectiveIds(run.scenario);
    }

    private void publish(Run run, String type, String subjectId, Map<String, Object> payload) {
        eventBus.publish(ShadowsEvent.of(type, run.scenario.id(), subjectId, payload));
    }

    /** Mutable bookkeeping for one playthrough. */
    private final class Run {
        Scenario scenario;
        ObjectiveSpawnState state;
        int doom;
        int rounds;
        int itemsSpawned;
        int itemsForced;
        int questTilesPlaced;
        final BoardSynthesizer board;
        final List<Tile> tiles = new ArrayList<>();
        final Deque<String> pendingEnemies = new ArrayDeque<>();
        final List<String> firedEvents = new ArrayList<>();
        final Set<String> announced = new HashSet<>();

        Run(Scenario scenario) {
            this.scenario = scenario;
            this.state = spawnService.initializeObjectiveSpawns(scenario);
            this.doom = scenario.startDoom();
            this.board = new BoardSynthesizer(scenario.theme(), random);
        }
    }
}
