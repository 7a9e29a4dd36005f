package com.shadows.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single goal within a scenario. Only {@code currentAmount}, {@code completed}, {@code hidden}
 * and the progress text in {@code shortDescription} change during play.
 *
 * @param id               unique within the scenario (e.g. "obj_find_key_0")
 * @param description      long-form text shown in the journal
 * @param shortDescription compact text, may carry a "(n/m)" progress marker
 * @param type             objective kind
 * @param targetId         item, tile or enemy identifier the objective refers to (nullable)
 * @param targetAmount     required count (nullable, treated as 1 where a count is needed)
 * @param currentAmount    progress so far
 * @param optional         bonus objectives are optional and never gate victory
 * @param hidden           hidden objectives are invisible until revealed
 * @param revealedBy       id of the objective whose completion reveals this one (nullable)
 * @param completed        whether the objective is done
 * @param rewardInsight    insight granted on completion (nullable)
 * @param rewardItem       item granted on completion (nullable)
 */
public record ScenarioObjective(
    String id,
    String description,
    String shortDescription,
    ObjectiveType type,
    String targetId,
    Integer targetAmount,
    int currentAmount,
    @JsonProperty("isOptional") boolean optional,
    @JsonProperty("isHidden") boolean hidden,
    String revealedBy,
    boolean completed,
    Integer rewardInsight,
    String rewardItem
) implements Serializable {

    /** Target amount, or {@code fallback} when none is set. */
    public int targetOr(int fallback) {
        return targetAmount != null ? targetAmount : fallback;
    }

    public boolean required() {
        return !optional;
    }

    public ScenarioObjective withProgress(int amount, boolean done, String shortText) {
        return new ScenarioObjective(id, description, shortText, type, targetId, targetAmount, amount,
                optional, hidden, revealedBy, done, rewardInsight, rewardItem);
    }

    public ScenarioObjective withCompleted(boolean done) {
        return withProgress(currentAmount, done, shortDescription);
    }

    public ScenarioObjective withHidden(boolean isHidden) {
        return new ScenarioObjective(id, description, shortDescription, type, targetId, targetAmount, currentAmount,
                optional, isHidden, revealedBy, completed, rewardInsight, rewardItem);
    }
}
