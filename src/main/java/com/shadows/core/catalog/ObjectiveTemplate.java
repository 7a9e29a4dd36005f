package com.shadows.core.catalog;

import com.shadows.core.model.ObjectiveType;

import java.util.List;

/**
 * Blueprint for one objective of a mission. Text fields may contain {@code {placeholder}} tokens.
 *
 * @param targetIdOptions   candidate target ids, one is picked at random (empty for none)
 * @param targetAmount      required count range (nullable)
 * @param revealedByIndex   index, within the same mission, of the objective that reveals this one (nullable)
 * @param rewardItemOptions candidate reward items (empty for none)
 */
public record ObjectiveTemplate(
    String id,
    String descriptionTemplate,
    String shortDescriptionTemplate,
    ObjectiveType type,
    List<String> targetIdOptions,
    AmountRange targetAmount,
    boolean optional,
    boolean hidden,
    Integer revealedByIndex,
    Integer rewardInsight,
    List<String> rewardItemOptions
) {

    public ObjectiveTemplate {
        targetIdOptions = targetIdOptions == null ? List.of() : List.copyOf(targetIdOptions);
        rewardItemOptions = rewardItemOptions == null ? List.of() : List.copyOf(rewardItemOptions);
    }
}
