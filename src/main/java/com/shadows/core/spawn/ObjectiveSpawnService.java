package com.shadows.core.spawn;

import com.shadows.core.balance.SpawnProperties;
import com.shadows.core.catalog.QuestItemCatalog;
import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.QuestItem;
import com.shadows.core.model.QuestItemType;
import com.shadows.core.model.QuestTile;
import com.shadows.core.model.QuestTileType;
import com.shadows.core.model.RevealCondition;
import com.shadows.core.model.Scenario;
import com.shadows.core.model.ScenarioObjective;
import com.shadows.core.model.Tile;
import com.shadows.core.model.TileModification;
import com.shadows.core.validation.ScenarioRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Runtime that makes objectives physically reachable: decides when quest items appear on
 * explored tiles, when quest tiles are revealed and where they materialize, and applies
 * item pickups to objective progress.
 * <p>
 * Every operation takes the current {@link ObjectiveSpawnState} and returns a new one;
 * the host game loop owns the state and applies one event at a time.
 */
@Service
public class ObjectiveSpawnService {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveSpawnService.class);

    private static final Pattern PROGRESS_MARKER = Pattern.compile("\\(\\d+/\\d+\\)");

    private final SpawnProperties properties;
    private final Random random;

    public ObjectiveSpawnService(SpawnProperties properties, Random random) {
        this.properties = properties;
        this.random = random;
    }

    // -- Initialization --

    public ObjectiveSpawnState initializeObjectiveSpawns(Scenario scenario) {
        List<QuestItem> items = new ArrayList<>();
        List<QuestTile> tiles = new ArrayList<>();
        String bossType = ScenarioRules.bossTypeOf(scenario);

        for (ScenarioObjective objective : scenario.objectives()) {
            switch (objective.type()) {
                case FIND_ITEM -> items.add(questItem(scenario, objective, itemTypeFor(objective), 0));
                case COLLECT -> {
                    int amount = Math.max(1, objective.targetOr(1));
                    for (int i = 0; i < amount; i++) {
                        items.add(questItem(scenario, objective, itemTypeFor(objective), i));
                    }
                }
                case FIND_TILE -> tiles.add(questTile(objective,
                        SpawnAffinityTables.questTileTypeFor(objective.targetId()), bossType));
                case ESCAPE -> tiles.add(questTile(objective,
                        new SpawnAffinityTables.QuestTileDescriptor(QuestTileType.EXIT, "Escape Exit"), bossType));
                case RITUAL -> tiles.add(questTile(objective,
                        new SpawnAffinityTables.QuestTileDescriptor(QuestTileType.ALTAR, "Ritual Altar"), bossType));
                case INTERACT -> {
                    var descriptor = SpawnAffinityTables.questTileTypeFor(objective.targetId());
                    if (objective.targetId() != null && descriptor.type() != QuestTileType.NPC_LOCATION) {
                        tiles.add(questTile(objective, descriptor, bossType));
                    }
                }
                default -> { }
            }
        }
        log.debug("Initialized spawns for {}: {} item(s), {} quest tile(s)", scenario.id(), items.size(), tiles.size());
        return new ObjectiveSpawnState(items, tiles, 0, 0, 0);
    }

    private static QuestItem questItem(Scenario scenario, ScenarioObjective objective, QuestItemType type, int index) {
        var definition = QuestItemCatalog.definitionFor(objective.targetId());
        return new QuestItem("quest_item_" + objective.id() + "_" + index, objective.id(), scenario.id(), type,
                definition.name(), definition.description(), false, null, false);
    }

    private static QuestTile questTile(ScenarioObjective objective, SpawnAffinityTables.QuestTileDescriptor descriptor,
                                       String bossType) {
        boolean chained = objective.revealedBy() != null;
        return new QuestTile("quest_tile_" + objective.id(), objective.id(), descriptor.type(), descriptor.name(),
                false, !objective.hidden(),
                chained ? RevealCondition.OBJECTIVE_COMPLETE : null,
                objective.revealedBy(),
                descriptor.type() == QuestTileType.FINAL_CONFRONTATION ? bossType : null,
                null);
    }

    private static QuestItemType itemTypeFor(ScenarioObjective objective) {
        String target = objective.targetId() == null ? "" : objective.targetId();
        if (objective.type() == ObjectiveType.FIND_ITEM) {
            if (target.contains("artifact") || target.contains("idol") || target.contains("relic")) {
                return QuestItemType.ARTIFACT;
            }
            return QuestItemType.KEY;
        }
        if (target.contains("clue")) {
            return QuestItemType.CLUE;
        }
        if (target.contains("component")) {
            return QuestItemType.COMPONENT;
        }
        return QuestItemType.COLLECTIBLE;
    }

    // -- Per-tile spawning --

    /**
     * Decides whether an item appears on the tile just explored. The pity timer forces a spawn once
     * too many eligible tiles in a row came up empty.
     */
    public Optional<QuestItem> shouldSpawnQuestItem(ObjectiveSpawnState state, Tile tile, Scenario scenario) {
        if (!isEligibleForItems(tile)) {
            return Optional.empty();
        }
        List<QuestItem> unspawned = state.questItems().stream().filter(qi -> !qi.spawned()).toList();
        if (unspawned.isEmpty()) {
            return Optional.empty();
        }
        int requiredCount = (int) state.questItems().stream().filter(qi -> isRequired(qi.objectiveId(), scenario)).count();
        QuestItem candidate = selectItem(unspawned, tile, scenario);

        int pityTiles = properties.pityTilesFor(scenario.difficulty(), requiredCount);
        if (state.tilesSinceLastSpawn() >= pityTiles) {
            log.debug("Pity timer forced {} on tile {}", candidate.id(), tile.id());
            return Optional.of(candidate);
        }

        double chance = spawnChance(state, scenario, requiredCount)
                + SpawnAffinityTables.roomSpawnBonus(tile.name())
                + SpawnAffinityTables.itemRoomScore(candidate.type(), tile.name())
                        * properties.getProbability().getAffinityWeight();
        chance = Math.min(properties.getProbability().getMaxChance(), chance);
        return random.nextDouble() < chance ? Optional.of(candidate) : Optional.empty();
    }

    private double spawnChance(ObjectiveSpawnState state, Scenario scenario, int requiredCount) {
        var probability = properties.getProbability();
        double expectedTiles = scenario.startDoom() * probability.getExpectedTilesPerDoom();
        double progress = expectedTiles > 0 ? state.tilesExplored() / expectedTiles : 1.0;

        double chance;
        if (progress < probability.getEarlyGameThreshold()) {
            chance = probability.getEarlyChance();
        } else {
            double window = probability.getFullScheduleThreshold() - probability.getEarlyGameThreshold();
            double scheduled = Math.min(1.0, (progress - probability.getEarlyGameThreshold()) / window);
            int targetSpawned = (int) Math.ceil(scheduled * state.questItems().size());
            long spawned = state.questItems().stream().filter(QuestItem::spawned).count();
            chance = spawned < targetSpawned ? probability.getBehindScheduleChance() : probability.getNormalChance();
        }
        if (requiredCount >= properties.getCollection().getThreshold()) {
            chance += properties.getCollection().getChanceBoost();
        }
        return chance;
    }

    /** Required items first, then best room affinity, then list order. */
    private static QuestItem selectItem(List<QuestItem> unspawned, Tile tile, Scenario scenario) {
        List<QuestItem> required = unspawned.stream().filter(qi -> isRequired(qi.objectiveId(), scenario)).toList();
        List<QuestItem> pool = required.isEmpty() ? unspawned : required;
        QuestItem best = pool.get(0);
        int bestScore = SpawnAffinityTables.itemRoomScore(best.type(), tile.name());
        for (QuestItem item : pool) {
            int score = SpawnAffinityTables.itemRoomScore(item.type(), tile.name());
            if (score > bestScore) {
                best = item;
                bestScore = score;
            }
        }
        return best;
    }

    public TileExplorationResult onTileExplored(ObjectiveSpawnState state, Tile tile, Scenario scenario,
                                                Collection<String> completedObjectiveIds) {
        ObjectiveSpawnState updated = state.withCounters(state.tilesExplored() + 1, state.itemsCollected(),
                state.tilesSinceLastSpawn());

        QuestItem spawnedItem = shouldSpawnQuestItem(updated, tile, scenario).orElse(null);
        if (spawnedItem != null) {
            updated = updated.withItem(spawnedItem.id(), qi -> qi.spawnedOn(tile.id()))
                    .withCounters(updated.tilesExplored(), updated.itemsCollected(), 0);
            spawnedItem = spawnedItem.spawnedOn(tile.id());
            log.info("Quest item {} appeared on {}", spawnedItem.name(), tile.name());
        } else if (isEligibleForItems(tile) && updated.questItems().stream().anyMatch(qi -> !qi.spawned())) {
            // only searchable rooms with something left to find count toward the pity timer
            updated = updated.withCounters(updated.tilesExplored(), updated.itemsCollected(),
                    updated.tilesSinceLastSpawn() + 1);
        }

        List<QuestTile> revealed = new ArrayList<>();
        for (QuestTile questTile : updated.questTiles()) {
            if (!questTile.revealed() && shouldRevealQuestTile(questTile, completedObjectiveIds)) {
                revealed.add(questTile.asRevealed());
            }
        }
        for (QuestTile questTile : revealed) {
            updated = updated.withQuestTile(questTile.id(), QuestTile::asRevealed);
            log.info("Quest tile {} revealed", questTile.name());
        }

        // a revealed quest tile waiting for a suitable spot may take this one
        if (spawnedItem == null && !tile.occupied()) {
            for (QuestTile questTile : updated.questTiles()) {
                if (questTile.revealed() && !questTile.spawned()
                        && SpawnAffinityTables.questTileLocationScore(questTile.type(), tile) > 0) {
                    var placed = materialize(updated, questTile, tile);
                    return new TileExplorationResult(placed.updatedState(), null, revealed,
                            placed.spawnedQuestTile(), placed.tileModification(), placed.bossSpawn());
                }
            }
        }
        return new TileExplorationResult(updated, spawnedItem, revealed, null, null, null);
    }

    public boolean shouldRevealQuestTile(QuestTile questTile, Collection<String> completedObjectiveIds) {
        if (questTile.revealed()) {
            return true;
        }
        return questTile.revealCondition() == RevealCondition.OBJECTIVE_COMPLETE
                && questTile.revealObjectiveId() != null
                && completedObjectiveIds.contains(questTile.revealObjectiveId());
    }

    // -- Collection --

    /**
     * Picks up a quest item and advances its objective. Collecting an item twice, or an item
     * the state does not track, changes nothing.
     */
    public CollectionResult collectQuestItem(ObjectiveSpawnState state, QuestItem item, Scenario scenario) {
        QuestItem current = state.questItems().stream()
                .filter(qi -> qi.id().equals(item.id()))
                .findFirst()
                .orElse(null);
        if (current == null) {
            log.warn("Ignoring pickup of untracked quest item {} in {}", item.id(), scenario.id());
            return new CollectionResult(state, null, false);
        }
        ScenarioObjective objective = scenario.findObjective(current.objectiveId()).orElse(null);
        if (current.collected()) {
            return new CollectionResult(state, objective, objective != null && objective.completed());
        }

        ObjectiveSpawnState updated = state.withItem(current.id(), QuestItem::asCollected)
                .withCounters(state.tilesExplored(), state.itemsCollected() + 1, state.tilesSinceLastSpawn());
        if (objective == null) {
            return new CollectionResult(updated, null, false);
        }

        int amount = objective.currentAmount() + 1;
        int target = Math.max(1, objective.targetOr(1));
        boolean done = objective.completed()
                || objective.type() == ObjectiveType.FIND_ITEM
                || amount >= target;
        String text = objective.shortDescription() == null ? null
                : PROGRESS_MARKER.matcher(objective.shortDescription())
                        .replaceFirst("(" + Math.min(amount, target) + "/" + target + ")");
        ScenarioObjective progressed = objective.withProgress(amount, done, text);
        log.info("Collected {} for {} ({}/{})", current.name(), objective.id(), amount, target);
        return new CollectionResult(updated, progressed, done);
    }

    // -- Guaranteed spawns --

    /**
     * Doom-driven backstop. At critical doom every remaining required item is forced; at warning
     * doom with most of the expected map explored the next required item is forced.
     */
    public GuaranteedSpawnCheck checkGuaranteedSpawns(ObjectiveSpawnState state, Scenario scenario, int doom,
                                                      Collection<String> completedObjectiveIds) {
        List<QuestItem> missing = state.questItems().stream()
                .filter(qi -> !qi.spawned() && isRequired(qi.objectiveId(), scenario))
                .toList();
        List<QuestTile> pendingTiles = state.questTiles().stream()
                .filter(qt -> !qt.spawned() && shouldRevealQuestTile(qt, completedObjectiveIds))
                .toList();
        var guaranteed = properties.getGuaranteed();

        if (doom <= guaranteed.getDoomCritical() && (!missing.isEmpty() || !pendingTiles.isEmpty())) {
            List<String> warnings = new ArrayList<>();
            if (!missing.isEmpty()) {
                warnings.add("The darkness closes in: " + missing.size() + " objective item(s) surface at once");
            }
            log.warn("Critical doom {} for {}: forcing {} item(s) and {} tile(s)", doom, scenario.id(),
                    missing.size(), pendingTiles.size());
            return new GuaranteedSpawnCheck(SpawnUrgency.CRITICAL, missing, pendingTiles, warnings);
        }

        if (doom <= guaranteed.getDoomWarning()) {
            double expectedTiles = scenario.startDoom() * properties.getProbability().getExpectedTilesPerDoom();
            double ratio = expectedTiles > 0 ? state.tilesExplored() / expectedTiles : 1.0;
            if (ratio >= guaranteed.getExplorationForce() && (!missing.isEmpty() || !pendingTiles.isEmpty())) {
                List<QuestItem> next = missing.isEmpty() ? List.of() : List.of(missing.get(0));
                List<String> warnings = next.isEmpty() ? List.of()
                        : List.of("Something important reveals itself: " + next.get(0).name());
                return new GuaranteedSpawnCheck(SpawnUrgency.WARNING, next, pendingTiles, warnings);
            }
        }
        return GuaranteedSpawnCheck.none();
    }

    public GuaranteedSpawnExecution executeGuaranteedSpawns(ObjectiveSpawnState state, GuaranteedSpawnCheck check,
                                                            List<Tile> tiles) {
        Set<String> used = new HashSet<>();
        state.questItems().stream()
                .filter(qi -> qi.spawned() && qi.spawnedOnTileId() != null)
                .forEach(qi -> used.add(qi.spawnedOnTileId()));

        ObjectiveSpawnState updated = state;
        List<GuaranteedSpawnExecution.ItemPlacement> placements = new ArrayList<>();
        List<QuestItem> deferred = new ArrayList<>();
        for (QuestItem item : check.forcedItems()) {
            var tile = findBestSpawnTile(item, tiles, used);
            if (tile.isEmpty()) {
                deferred.add(item);
                continue;
            }
            String tileId = tile.get().id();
            used.add(tileId);
            updated = updated.withItem(item.id(), qi -> qi.spawnedOn(tileId));
            placements.add(new GuaranteedSpawnExecution.ItemPlacement(item.spawnedOn(tileId), tileId));
        }
        if (!placements.isEmpty()) {
            updated = updated.withCounters(updated.tilesExplored(), updated.itemsCollected(), 0);
        }

        List<QuestTileSpawnResult> tileSpawns = new ArrayList<>();
        for (QuestTile questTile : check.forcedTiles()) {
            updated = updated.withQuestTile(questTile.id(), QuestTile::asRevealed);
            var result = spawnRevealedQuestTileImmediately(updated, questTile, tiles);
            updated = result.updatedState();
            if (result.spawned()) {
                tileSpawns.add(result);
            }
        }
        if (!deferred.isEmpty()) {
            log.info("Deferred {} forced item(s): no eligible explored tile", deferred.size());
        }
        return new GuaranteedSpawnExecution(updated, placements, tileSpawns, deferred);
    }

    /**
     * Best explored tile for an item: searchable, not a passage, not holding anything yet and not
     * in {@code usedTileIds}. Ties go to the smallest tile id.
     */
    public Optional<Tile> findBestSpawnTile(QuestItem item, List<Tile> tiles, Set<String> usedTileIds) {
        Comparator<Tile> byScore = Comparator.comparingDouble(t -> itemTileScore(item, t));
        return tiles.stream()
                .filter(ObjectiveSpawnService::isEligibleForItems)
                .filter(Tile::explored)
                .filter(t -> !t.occupied())
                .filter(t -> !usedTileIds.contains(t.id()))
                .max(byScore.thenComparing(Tile::id, Comparator.reverseOrder()));
    }

    private static double itemTileScore(QuestItem item, Tile tile) {
        return SpawnAffinityTables.itemRoomScore(item.type(), tile.name())
                + SpawnAffinityTables.roomSpawnBonus(tile.name());
    }

    // -- Quest tiles --

    /**
     * Materializes a revealed quest tile on the best already-explored tile, so the player never has to
     * explore further to reach something a completed objective just unlocked.
     */
    public QuestTileSpawnResult spawnRevealedQuestTileImmediately(ObjectiveSpawnState state, QuestTile questTile,
                                                                  List<Tile> exploredTiles) {
        QuestTile current = state.questTiles().stream()
                .filter(qt -> qt.id().equals(questTile.id()))
                .findFirst()
                .orElse(questTile);
        if (current.spawned()) {
            return QuestTileSpawnResult.none(state);
        }
        List<Tile> explored = exploredTiles.stream().filter(Tile::explored).toList();
        List<Tile> free = explored.stream().filter(t -> !t.occupied()).toList();
        List<Tile> candidates = free.isEmpty() ? explored : free;

        Comparator<Tile> byScore = Comparator.comparingInt(
                t -> SpawnAffinityTables.questTileLocationScore(current.type(), t));
        Optional<Tile> target = candidates.stream()
                .max(byScore.thenComparing(Tile::id, Comparator.reverseOrder()));

        if (target.isEmpty()) {
            if (current.type() == QuestTileType.FINAL_CONFRONTATION) {
                return materializeConfrontation(state, current, null);
            }
            log.debug("No explored tile available for {}; waiting for exploration", current.id());
            return QuestTileSpawnResult.none(state);
        }
        return materialize(state, current, target.get());
    }

    private QuestTileSpawnResult materialize(ObjectiveSpawnState state, QuestTile questTile, Tile tile) {
        if (questTile.type() == QuestTileType.FINAL_CONFRONTATION) {
            return materializeConfrontation(state, questTile, tile.id());
        }
        TileModification modification = switch (questTile.type()) {
            case EXIT -> new TileModification("Exit Door", "The way out! But can you make it in time?",
                    null, "exit_door", true);
            case ALTAR -> new TileModification("Ritual Altar",
                    "An ancient altar for dark rituals. You can perform the ritual here.", "ritual", "altar", false);
            default -> new TileModification(questTile.name(), "Someone is waiting here.", null, "npc", false);
        };
        QuestTile placed = questTile.spawnedOn(tile.id());
        log.info("Quest tile {} materialized on {}", questTile.name(), tile.name());
        return new QuestTileSpawnResult(state.withQuestTile(questTile.id(), qt -> placed), placed, tile.id(),
                modification, null);
    }

    private QuestTileSpawnResult materializeConfrontation(ObjectiveSpawnState state, QuestTile questTile,
                                                          String tileId) {
        String bossType = questTile.bossType() != null ? questTile.bossType() : properties.getFallbackBossType();
        QuestTile placed = questTile.spawnedOn(tileId);
        log.info("Final confrontation begins: {} awakens", bossType);
        return new QuestTileSpawnResult(state.withQuestTile(questTile.id(), qt -> placed), placed, tileId, null,
                new BossSpawnSignal(bossType, tileId, questTile.id()));
    }

    // -- Reporting --

    public SpawnStatus getSpawnStatus(ObjectiveSpawnState state, Scenario scenario) {
        List<String> missing = new ArrayList<>();
        state.questItems().stream()
                .filter(qi -> !qi.spawned() && isRequired(qi.objectiveId(), scenario))
                .forEach(qi -> missing.add("Item: " + qi.name()));
        state.questTiles().stream()
                .filter(qt -> !qt.spawned() && isRequired(qt.objectiveId(), scenario))
                .forEach(qt -> missing.add("Tile: " + qt.name()));
        return new SpawnStatus(
                state.questItems().size(),
                (int) state.questItems().stream().filter(QuestItem::spawned).count(),
                (int) state.questItems().stream().filter(QuestItem::collected).count(),
                state.questTiles().size(),
                (int) state.questTiles().stream().filter(QuestTile::spawned).count(),
                missing);
    }

    public List<ObjectiveProgress> getObjectiveProgress(ObjectiveSpawnState state, Scenario scenario) {
        return scenario.objectives().stream()
                .map(objective -> {
                    List<QuestItem> related = state.questItems().stream()
                            .filter(qi -> qi.objectiveId().equals(objective.id()))
                            .toList();
                    long collected = related.stream().filter(QuestItem::collected).count();
                    int total = related.isEmpty() ? Math.max(1, objective.targetOr(1)) : related.size();
                    boolean done = objective.completed() || (!related.isEmpty() && collected >= total);
                    return new ObjectiveProgress(objective.id(), collected + "/" + total, done);
                })
                .toList();
    }

    /** True when the exit has materialized and the investigator stands on the exit door. */
    public boolean canEscape(ObjectiveSpawnState state, int q, int r, List<Tile> tiles) {
        boolean exitPlaced = state.questTiles().stream()
                .anyMatch(qt -> qt.type() == QuestTileType.EXIT && qt.spawned());
        if (!exitPlaced) {
            return false;
        }
        return tiles.stream()
                .filter(t -> t.gate() && "Exit Door".equals(t.name()))
                .anyMatch(t -> t.q() == q && t.r() == r);
    }

    private static boolean isEligibleForItems(Tile tile) {
        return tile.searchable() && (tile.category() == null || !tile.category().isPassage());
    }

    private static boolean isRequired(String objectiveId, Scenario scenario) {
        return scenario.findObjective(objectiveId).map(ScenarioObjective::required).orElse(false);
    }
}
