package com.shadows.core.balance;

import com.shadows.core.model.Difficulty;
import com.shadows.core.model.ObjectiveType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunable balance table used by generation, validation and repair.
 * Values are policy; the algorithms only read them.
 */
@Component
@ConfigurationProperties(prefix = "shadows.balance")
public class BalanceProperties {

    private Efficiency efficiency = new Efficiency();
    private RoundCosts roundCosts = new RoundCosts();
    private Confidence confidence = new Confidence();
    private Doom doom = new Doom();
    private Waves waves = new Waves();
    private Repair repair = new Repair();

    /** Share of each doom unit that turns into real progress at the given difficulty. */
    public double efficiencyFor(Difficulty difficulty) {
        if (difficulty == null) {
            return efficiency.hard;
        }
        return switch (difficulty) {
            case NORMAL -> efficiency.normal;
            case HARD -> efficiency.hard;
            case NIGHTMARE -> efficiency.nightmare;
        };
    }

    /** Estimated rounds for one unit of the given objective type. */
    public double roundCostFor(ObjectiveType type) {
        if (type == null) {
            return 0;
        }
        return switch (type) {
            case FIND_ITEM -> roundCosts.findItem;
            case FIND_TILE -> roundCosts.findTile;
            case KILL_ENEMY -> roundCosts.killEnemy;
            case KILL_BOSS -> roundCosts.killBoss;
            case COLLECT -> roundCosts.collect;
            case EXPLORE -> roundCosts.explore;
            case ESCAPE -> roundCosts.escape;
            case RITUAL -> roundCosts.ritual;
            case INTERACT -> roundCosts.interact;
            case PROTECT, ESCORT -> roundCosts.escort;
            case SURVIVE -> 0;
        };
    }

    public Efficiency getEfficiency() { return efficiency; }
    public void setEfficiency(Efficiency efficiency) { this.efficiency = efficiency; }
    public RoundCosts getRoundCosts() { return roundCosts; }
    public void setRoundCosts(RoundCosts roundCosts) { this.roundCosts = roundCosts; }
    public Confidence getConfidence() { return confidence; }
    public void setConfidence(Confidence confidence) { this.confidence = confidence; }
    public Doom getDoom() { return doom; }
    public void setDoom(Doom doom) { this.doom = doom; }
    public Waves getWaves() { return waves; }
    public void setWaves(Waves waves) { this.waves = waves; }
    public Repair getRepair() { return repair; }
    public void setRepair(Repair repair) { this.repair = repair; }

    public static class Efficiency {
        private double normal = 0.8;
        private double hard = 0.7;
        private double nightmare = 0.6;

        public double getNormal() { return normal; }
        public void setNormal(double normal) { this.normal = normal; }
        public double getHard() { return hard; }
        public void setHard(double hard) { this.hard = hard; }
        public double getNightmare() { return nightmare; }
        public void setNightmare(double nightmare) { this.nightmare = nightmare; }
    }

    public static class RoundCosts {
        private double findItem = 2;
        private double findTile = 3;
        private double killEnemy = 1;
        private double killBoss = 3;
        private double collect = 1.5;
        private double explore = 1;
        private double escape = 2;
        private double ritual = 1;
        private double interact = 1;
        private double escort = 2;

        public double getFindItem() { return findItem; }
        public void setFindItem(double findItem) { this.findItem = findItem; }
        public double getFindTile() { return findTile; }
        public void setFindTile(double findTile) { this.findTile = findTile; }
        public double getKillEnemy() { return killEnemy; }
        public void setKillEnemy(double killEnemy) { this.killEnemy = killEnemy; }
        public double getKillBoss() { return killBoss; }
        public void setKillBoss(double killBoss) { this.killBoss = killBoss; }
        public double getCollect() { return collect; }
        public void setCollect(double collect) { this.collect = collect; }
        public double getExplore() { return explore; }
        public void setExplore(double explore) { this.explore = explore; }
        public double getEscape() { return escape; }
        public void setEscape(double escape) { this.escape = escape; }
        public double getRitual() { return ritual; }
        public void setRitual(double ritual) { this.ritual = ritual; }
        public double getInteract() { return interact; }
        public void setInteract(double interact) { this.interact = interact; }
        public double getEscort() { return escort; }
        public void setEscort(double escort) { this.escort = escort; }
    }

    public static class Confidence {
        private int errorPenalty = 40;
        private int warningPenalty = 10;
        private int definiteThreshold = 90;
        private int challengingThreshold = 60;

        public int getErrorPenalty() { return errorPenalty; }
        public void setErrorPenalty(int errorPenalty) { this.errorPenalty = errorPenalty; }
        public int getWarningPenalty() { return warningPenalty; }
        public void setWarningPenalty(int warningPenalty) { this.warningPenalty = warningPenalty; }
        public int getDefiniteThreshold() { return definiteThreshold; }
        public void setDefiniteThreshold(int definiteThreshold) { this.definiteThreshold = definiteThreshold; }
        public int getChallengingThreshold() { return challengingThreshold; }
        public void setChallengingThreshold(int challengingThreshold) { this.challengingThreshold = challengingThreshold; }
    }

    public static class Doom {
        private int minimumStartDoom = 3;
        private int tightMargin = 2;
        private double enemyPressureTolerance = 2.0;
        private int purgeThreshold = 3;
        private int highCollectionTarget = 5;
        private double expectedTilesPerDoom = 1.5;
        private double collectibleRate = 0.3;

        public int getMinimumStartDoom() { return minimumStartDoom; }
        public void setMinimumStartDoom(int minimumStartDoom) { this.minimumStartDoom = minimumStartDoom; }
        public int getTightMargin() { return tightMargin; }
        public void setTightMargin(int tightMargin) { this.tightMargin = tightMargin; }
        public double getEnemyPressureTolerance() { return enemyPressureTolerance; }
        public void setEnemyPressureTolerance(double enemyPressureTolerance) { this.enemyPressureTolerance = enemyPressureTolerance; }
        public int getPurgeThreshold() { return purgeThreshold; }
        public void setPurgeThreshold(int purgeThreshold) { this.purgeThreshold = purgeThreshold; }
        public int getHighCollectionTarget() { return highCollectionTarget; }
        public void setHighCollectionTarget(int highCollectionTarget) { this.highCollectionTarget = highCollectionTarget; }
        public double getExpectedTilesPerDoom() { return expectedTilesPerDoom; }
        public void setExpectedTilesPerDoom(double expectedTilesPerDoom) { this.expectedTilesPerDoom = expectedTilesPerDoom; }
        public double getCollectibleRate() { return collectibleRate; }
        public void setCollectibleRate(double collectibleRate) { this.collectibleRate = collectibleRate; }
    }

    /** Doom-counter fractions at which generated enemy waves and the boss arrive. */
    public static class Waves {
        private double early = 0.55;
        private double mid = 0.35;
        private double late = 0.15;

        public double getEarly() { return early; }
        public void setEarly(double early) { this.early = early; }
        public double getMid() { return mid; }
        public void setMid(double mid) { this.mid = mid; }
        public double getLate() { return late; }
        public void setLate(double late) { this.late = late; }
    }

    public static class Repair {
        private int survivalSafetyMargin = 2;
        private int doomSafetyMargin = 2;
        private double bossThresholdFraction = 0.3;
        private double reinforcementThresholdFraction = 0.6;
        private String reinforcementEnemy = "cultist";

        public int getSurvivalSafetyMargin() { return survivalSafetyMargin; }
        public void setSurvivalSafetyMargin(int survivalSafetyMargin) { this.survivalSafetyMargin = survivalSafetyMargin; }
        public int getDoomSafetyMargin() { return doomSafetyMargin; }
        public void setDoomSafetyMargin(int doomSafetyMargin) { this.doomSafetyMargin = doomSafetyMargin; }
        public double getBossThresholdFraction() { return bossThresholdFraction; }
        public void setBossThresholdFraction(double bossThresholdFraction) { this.bossThresholdFraction = bossThresholdFraction; }
        public double getReinforcementThresholdFraction() { return reinforcementThresholdFraction; }
        public void setReinforcementThresholdFraction(double reinforcementThresholdFraction) { this.reinforcementThresholdFraction = reinforcementThresholdFraction; }
        public String getReinforcementEnemy() { return reinforcementEnemy; }
        public void setReinforcementEnemy(String reinforcementEnemy) { this.reinforcementEnemy = reinforcementEnemy; }
    }
}
