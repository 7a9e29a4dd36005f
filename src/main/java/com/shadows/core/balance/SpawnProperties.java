package com.shadows.core.balance;

import com.shadows.core.model.Difficulty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spawn pacing for quest items and tiles: per-tile probability tiers, the pity timer,
 * and the doom-driven guaranteed-spawn backstop.
 */
@Component
@ConfigurationProperties(prefix = "shadows.spawn")
public class SpawnProperties {

    private Probability probability = new Probability();
    private Pity pity = new Pity();
    private CollectionBoost collection = new CollectionBoost();
    private Guaranteed guaranteed = new Guaranteed();
    private String fallbackBossType = "shoggoth";

    /**
     * Pity window for a scenario, adjusted for difficulty and collection-heavy missions,
     * clamped to the configured bounds.
     */
    public int pityTilesFor(Difficulty difficulty, int requiredItemCount) {
        int tiles = requiredItemCount >= collection.threshold ? collection.pityTiles : pity.tiles;
        if (difficulty == Difficulty.HARD) {
            tiles += pity.hardOffset;
        } else if (difficulty == Difficulty.NIGHTMARE) {
            tiles += pity.nightmareOffset;
        }
        return Math.max(pity.min, Math.min(pity.max, tiles));
    }

    public Probability getProbability() { return probability; }
    public void setProbability(Probability probability) { this.probability = probability; }
    public Pity getPity() { return pity; }
    public void setPity(Pity pity) { this.pity = pity; }
    public CollectionBoost getCollection() { return collection; }
    public void setCollection(CollectionBoost collection) { this.collection = collection; }
    public Guaranteed getGuaranteed() { return guaranteed; }
    public void setGuaranteed(Guaranteed guaranteed) { this.guaranteed = guaranteed; }
    public String getFallbackBossType() { return fallbackBossType; }
    public void setFallbackBossType(String fallbackBossType) { this.fallbackBossType = fallbackBossType; }

    public static class Probability {
        /** Fraction of the expected exploration below which the early tier applies. */
        private double earlyGameThreshold = 0.2;
        /** Fraction of the expected exploration by which every item should have spawned. */
        private double fullScheduleThreshold = 0.8;
        private double earlyChance = 0.10;
        private double normalChance = 0.25;
        private double behindScheduleChance = 0.5;
        private double maxChance = 0.85;
        private double affinityWeight = 0.05;
        private double expectedTilesPerDoom = 1.5;

        public double getEarlyGameThreshold() { return earlyGameThreshold; }
        public void setEarlyGameThreshold(double earlyGameThreshold) { this.earlyGameThreshold = earlyGameThreshold; }
        public double getFullScheduleThreshold() { return fullScheduleThreshold; }
        public void setFullScheduleThreshold(double fullScheduleThreshold) { this.fullScheduleThreshold = fullScheduleThreshold; }
        public double getEarlyChance() { return earlyChance; }
        public void setEarlyChance(double earlyChance) { this.earlyChance = earlyChance; }
        public double getNormalChance() { return normalChance; }
        public void setNormalChance(double normalChance) { this.normalChance = normalChance; }
        public double getBehindScheduleChance() { return behindScheduleChance; }
        public void setBehindScheduleChance(double behindScheduleChance) { this.behindScheduleChance = behindScheduleChance; }
        public double getMaxChance() { return maxChance; }
        public void setMaxChance(double maxChance) { this.maxChance = maxChance; }
        public double getAffinityWeight() { return affinityWeight; }
        public void setAffinityWeight(double affinityWeight) { this.affinityWeight = affinityWeight; }
        public double getExpectedTilesPerDoom() { return expectedTilesPerDoom; }
        public void setExpectedTilesPerDoom(double expectedTilesPerDoom) { this.expectedTilesPerDoom = expectedTilesPerDoom; }
    }

    public static class Pity {
        private int tiles = 4;
        private int hardOffset = 0;
        private int nightmareOffset = 1;
        private int min = 2;
        private int max = 10;

        public int getTiles() { return tiles; }
        public void setTiles(int tiles) { this.tiles = tiles; }
        public int getHardOffset() { return hardOffset; }
        public void setHardOffset(int hardOffset) { this.hardOffset = hardOffset; }
        public int getNightmareOffset() { return nightmareOffset; }
        public void setNightmareOffset(int nightmareOffset) { this.nightmareOffset = nightmareOffset; }
        public int getMin() { return min; }
        public void setMin(int min) { this.min = min; }
        public int getMax() { return max; }
        public void setMax(int max) { this.max = max; }
    }

    /** Boost for missions with many required pickups. */
    public static class CollectionBoost {
        private int threshold = 5;
        private double chanceBoost = 0.15;
        private int pityTiles = 3;

        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }
        public double getChanceBoost() { return chanceBoost; }
        public void setChanceBoost(double chanceBoost) { this.chanceBoost = chanceBoost; }
        public int getPityTiles() { return pityTiles; }
        public void setPityTiles(int pityTiles) { this.pityTiles = pityTiles; }
    }

    public static class Guaranteed {
        private int doomCritical = 3;
        private int doomWarning = 6;
        /** Explored share of the expected board at which a warning-level force kicks in. */
        private double explorationForce = 0.6;

        public int getDoomCritical() { return doomCritical; }
        public void setDoomCritical(int doomCritical) { this.doomCritical = doomCritical; }
        public int getDoomWarning() { return doomWarning; }
        public void setDoomWarning(int doomWarning) { this.doomWarning = doomWarning; }
        public double getExplorationForce() { return explorationForce; }
        public void setExplorationForce(double explorationForce) { this.explorationForce = explorationForce; }
    }
}
