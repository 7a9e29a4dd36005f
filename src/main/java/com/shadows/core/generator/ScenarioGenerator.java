package com.shadows.core.generator;

import com.shadows.core.balance.BalanceProperties;
import com.shadows.core.balance.GenerationProperties;
import com.shadows.core.catalog.BossConfig;
import com.shadows.core.catalog.CollectibleName;
import com.shadows.core.catalog.EnemySpawnConfig;
import com.shadows.core.catalog.LocationOption;
import com.shadows.core.catalog.MissionCatalog;
import com.shadows.core.catalog.MissionTemplate;
import com.shadows.core.catalog.NarrativeBank;
import com.shadows.core.catalog.ObjectiveTemplate;
import com.shadows.core.catalog.QuestItemCatalog;
import com.shadows.core.catalog.ThemeCatalog;
import com.shadows.core.model.DefeatCondition;
import com.shadows.core.model.DefeatType;
import com.shadows.core.model.Difficulty;
import com.shadows.core.model.DoomEvent;
import com.shadows.core.model.DoomEventType;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.model.ScenarioObjective;
import com.shadows.core.model.ScenarioTheme;
import com.shadows.core.model.VictoryCondition;
import com.shadows.core.model.VictoryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Assembles concrete scenarios from the mission catalog.
 * <p>
 * Every generated scenario has a unique id, at least one required objective,
 * a non-empty objective list and a non-empty doom-event list sorted by threshold descending.
 */
@Service
public class ScenarioGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScenarioGenerator.class);

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final MissionCatalog catalog;
    private final BalanceProperties balance;
    private final GenerationProperties generation;
    private final Random random;
    private final AtomicLong sequence = new AtomicLong();

    public ScenarioGenerator(MissionCatalog catalog, BalanceProperties balance,
                             GenerationProperties generation, Random random) {
        this.catalog = catalog;
        this.balance = balance;
        this.generation = generation;
        this.random = random;
    }

    /**
     * Generates one random scenario for the given difficulty.
     */
    public Scenario generateRandomScenario(Difficulty difficulty) {
        if (difficulty == null) {
            throw new IllegalArgumentException("difficulty must not be null");
        }
        MissionTemplate mission = pick(catalog.missionsFor(difficulty));
        LocationOption location = pick(catalog.locationsFor(mission.tileSet()));
        ScenarioTheme theme = ThemeCatalog.themeFor(location.name(), location.atmosphere());

        List<RolledTemplate> rolled = mission.objectiveTemplates().stream().map(this::roll).toList();
        TemplateContext ctx = buildContext(location, rolled);

        List<ScenarioObjective> objectives = new ArrayList<>(expandObjectives(mission, rolled, ctx));
        int bonusCount = rangeRoll(generation.getMinBonusObjectives(), generation.getMaxBonusObjectives());
        objectives.addAll(bonusObjectives(bonusCount, objectives.get(0).id(), ctx));

        TemplateContext goalCtx = ctx.withAmounts(
                rolled.get(0).amount() != null ? rolled.get(0).amount() : 3,
                ctx.half(), ctx.total(), survivalRounds(objectives));
        String goal = goalCtx.interpolate(mission.goalTemplate());

        int startDoom = mission.baseDoomFor(difficulty) + catalog.doomAdjustment(location.atmosphere());
        List<DoomEvent> doomEvents = buildDoomEvents(difficulty, mission, location, startDoom);

        String id = nextId();
        Scenario scenario = new Scenario(
                id,
                goalCtx.interpolate(pick(NarrativeBank.titleTemplates(mission.id(), mission.victoryType().key()))),
                mission.name() + " mission at " + location.name() + ". " + goal,
                buildBriefing(mission, difficulty, location.name(), goal),
                goal,
                mission.specialRuleTemplate(),
                location.name(),
                mission.tileSet(),
                difficulty,
                startDoom,
                -1,
                1,
                mission.victoryType(),
                theme,
                mission.id(),
                objectives,
                List.of(buildVictoryCondition(mission, objectives)),
                buildDefeatConditions(mission, ctx.victim(), objectives),
                doomEvents,
                prophecy(doomEvents),
                estimatedTime(difficulty),
                recommendedPlayers(difficulty)
        );
        log.info("Generated scenario {} ({}, {}, doom {}) at {}", id, mission.id(), difficulty.label(),
                startDoom, location.name());
        return scenario;
    }

    /**
     * Generates {@code count} scenarios, re-rolling up to the configured retry limit whenever a
     * victory type repeats. Diversity is best effort.
     */
    public List<Scenario> generateScenarioPool(Difficulty difficulty, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
        List<Scenario> pool = new ArrayList<>();
        Set<VictoryType> used = new HashSet<>();
        for (int i = 0; i < count; i++) {
            Scenario scenario;
            int attempts = 0;
            do {
                scenario = generateRandomScenario(difficulty);
                attempts++;
            } while (used.contains(scenario.victoryType()) && attempts < generation.getPoolDiversityRetries());
            used.add(scenario.victoryType());
            pool.add(scenario);
        }
        return pool;
    }

    // -- Objectives --

    private record RolledTemplate(ObjectiveTemplate template, String targetId, Integer amount) {}

    private RolledTemplate roll(ObjectiveTemplate template) {
        Integer amount = template.targetAmount() != null ? template.targetAmount().roll(random) : null;
        String targetId = template.targetIdOptions().isEmpty() ? null : pick(template.targetIdOptions());
        return new RolledTemplate(template, targetId, amount);
    }

    private TemplateContext buildContext(LocationOption location, List<RolledTemplate> rolled) {
        CollectibleName collectible = pick(NarrativeBank.COLLECTIBLES);
        String item = collectible.singular();
        String items = collectible.plural();
        String enemies = "enemies";
        for (RolledTemplate r : rolled) {
            ObjectiveType type = r.template().type();
            if (type == ObjectiveType.FIND_ITEM && r.targetId() != null) {
                item = QuestItemCatalog.definitionFor(r.targetId()).name();
                break;
            }
            if (type == ObjectiveType.COLLECT) {
                CollectibleName named = NarrativeBank.collectible(r.targetId());
                if (named != null) {
                    item = named.singular();
                    items = named.plural();
                }
                break;
            }
        }
        for (RolledTemplate r : rolled) {
            if (r.template().type() == ObjectiveType.KILL_ENEMY) {
                enemies = NarrativeBank.enemyPlural(r.targetId());
                break;
            }
        }
        return new TemplateContext(location.name(), pick(NarrativeBank.TARGET_NAMES),
                pick(NarrativeBank.VICTIM_NAMES), pick(NarrativeBank.MYSTERY_NAMES),
                item, items, enemies, 1, null, null, null);
    }

    private List<ScenarioObjective> expandObjectives(MissionTemplate mission, List<RolledTemplate> rolled,
                                                     TemplateContext ctx) {
        List<ScenarioObjective> objectives = new ArrayList<>();
        for (int i = 0; i < rolled.size(); i++) {
            RolledTemplate r = rolled.get(i);
            ObjectiveTemplate t = r.template();
            TemplateContext objCtx = r.amount() != null
                    ? ctx.withAmounts(r.amount(), r.amount(), r.amount(), r.amount())
                    : ctx;
            String revealedBy = t.revealedByIndex() != null
                    ? objectiveId(mission.objectiveTemplates().get(t.revealedByIndex()).id(), t.revealedByIndex())
                    : null;
            objectives.add(new ScenarioObjective(
                    objectiveId(t.id(), i),
                    objCtx.interpolate(t.descriptionTemplate()),
                    objCtx.interpolate(t.shortDescriptionTemplate()),
                    t.type(),
                    r.targetId(),
                    r.amount(),
                    0,
                    t.optional(),
                    t.hidden(),
                    revealedBy,
                    false,
                    t.rewardInsight(),
                    t.rewardItemOptions().isEmpty() ? null : pick(t.rewardItemOptions())
            ));
        }
        return objectives;
    }

    /** Hidden bonus objectives are revealed by the first main objective. */
    private List<ScenarioObjective> bonusObjectives(int count, String firstObjectiveId, TemplateContext ctx) {
        List<ObjectiveTemplate> shuffled = new ArrayList<>(NarrativeBank.BONUS_OBJECTIVES);
        Collections.shuffle(shuffled, random);
        List<ScenarioObjective> bonus = new ArrayList<>();
        for (int i = 0; i < count && i < shuffled.size(); i++) {
            RolledTemplate r = roll(shuffled.get(i));
            ObjectiveTemplate t = r.template();
            TemplateContext objCtx = ctx.withAmounts(r.amount() != null ? r.amount() : 1, null, null, null);
            bonus.add(new ScenarioObjective(
                    "obj_bonus_" + i,
                    objCtx.interpolate(t.descriptionTemplate()),
                    objCtx.interpolate(t.shortDescriptionTemplate()),
                    t.type(),
                    r.targetId(),
                    r.amount(),
                    0,
                    true,
                    t.hidden(),
                    t.hidden() ? firstObjectiveId : null,
                    false,
                    t.rewardInsight(),
                    t.rewardItemOptions().isEmpty() ? null : pick(t.rewardItemOptions())
            ));
        }
        return bonus;
    }

    private static String objectiveId(String templateId, int index) {
        return "obj_" + templateId + "_" + index;
    }

    private static Integer survivalRounds(List<ScenarioObjective> objectives) {
        return objectives.stream()
                .filter(o -> o.type() == ObjectiveType.SURVIVE && o.targetAmount() != null)
                .map(ScenarioObjective::targetAmount)
                .max(Integer::compare)
                .orElse(10);
    }

    // -- Conditions --

    private static VictoryCondition buildVictoryCondition(MissionTemplate mission, List<ScenarioObjective> objectives) {
        List<String> required = objectives.stream()
                .filter(ScenarioObjective::required)
                .map(ScenarioObjective::id)
                .toList();
        return new VictoryCondition(mission.victoryType(), mission.victoryDescription(), required);
    }

    private static List<DefeatCondition> buildDefeatConditions(MissionTemplate mission, String victim,
                                                               List<ScenarioObjective> objectives) {
        List<DefeatCondition> conditions = new ArrayList<>();
        conditions.add(new DefeatCondition(DefeatType.ALL_DEAD, "All investigators have been killed", null));
        conditions.add(new DefeatCondition(DefeatType.DOOM_ZERO, "The doom counter reaches zero", null));
        if ("rescue".equals(mission.id())) {
            objectives.stream()
                    .filter(o -> o.type() == ObjectiveType.ESCAPE)
                    .findFirst()
                    .ifPresent(escort -> conditions.add(new DefeatCondition(DefeatType.OBJECTIVE_FAILED,
                            victim + " has been killed", escort.id())));
        }
        return conditions;
    }

    // -- Doom events --

    private List<DoomEvent> buildDoomEvents(Difficulty difficulty, MissionTemplate mission,
                                            LocationOption location, int startDoom) {
        List<EnemySpawnConfig> pool = catalog.mergedEnemyPool(difficulty, mission.id(), location.atmosphere());
        BalanceProperties.Waves waves = balance.getWaves();

        int late = Math.max(1, (int) Math.ceil(startDoom * waves.getLate()));
        int mid = Math.max(late + 1, (int) Math.ceil(startDoom * waves.getMid()));
        int early = Math.max(mid + 1, (int) Math.ceil(startDoom * waves.getEarly()));

        EnemySpawnConfig earlyWave = pick(pool);
        EnemySpawnConfig midWave = pick(pool);
        BossConfig boss = pick(catalog.bossesFor(difficulty));

        return List.of(
                DoomEvent.of(early, DoomEventType.SPAWN_ENEMY, earlyWave.type(),
                        earlyWave.amount().roll(random), earlyWave.message()),
                DoomEvent.of(mid, DoomEventType.SPAWN_ENEMY, midWave.type(),
                        midWave.amount().roll(random), midWave.message()),
                DoomEvent.of(late, DoomEventType.SPAWN_BOSS, boss.type(), 1, boss.spawnMessage())
        );
    }

    private static List<String> prophecy(List<DoomEvent> events) {
        return events.stream()
                .map(DoomEvent::prophecyLine)
                .toList();
    }

    // -- Narrative --

    private String buildBriefing(MissionTemplate mission, Difficulty difficulty, String location, String goal) {
        String opening = pick(NarrativeBank.BRIEFING_OPENINGS);
        String middle = pick(NarrativeBank.briefingMiddles(mission.id(), mission.victoryType().key()));
        String closing = pick(NarrativeBank.briefingClosings(difficulty));
        return opening + "\n\n" + middle + "\n\n" + closing + "\n\nLocation: " + location + "\nObjective: " + goal;
    }

    private static String estimatedTime(Difficulty difficulty) {
        return switch (difficulty) {
            case NIGHTMARE -> "60-90 min";
            case HARD -> "45-60 min";
            case NORMAL -> "30-45 min";
        };
    }

    private static String recommendedPlayers(Difficulty difficulty) {
        return switch (difficulty) {
            case NIGHTMARE -> "3-4";
            case HARD -> "2-3";
            case NORMAL -> "1-2";
        };
    }

    // -- Randomness --

    private String nextId() {
        StringBuilder suffix = new StringBuilder();
        for (int i = 0; i < 7; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "gen_" + System.currentTimeMillis() + "_" + suffix + "_" + sequence.incrementAndGet();
    }

    private int rangeRoll(int min, int max) {
        return max <= min ? min : min + random.nextInt(max - min + 1);
    }

    private <T> T pick(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }
}
