package com.shadows.core.model;

import java.io.Serializable;

/**
 * @param objectiveId objective whose failure ends the game, only for {@link DefeatType#OBJECTIVE_FAILED}
 */
public record DefeatCondition(
    DefeatType type,
    String description,
    String objectiveId
) implements Serializable {}
