package com.shadows.core.repair;

import com.shadows.core.model.Scenario;

import java.io.Serializable;
import java.util.List;

/**
 * @param fixed   repaired copy of the input scenario
 * @param changes one human-readable line per repair applied, empty when nothing needed fixing
 */
public record AutoFixResult(Scenario fixed, List<String> changes) implements Serializable {

    public AutoFixResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public boolean changed() {
        return !changes.isEmpty();
    }
}
