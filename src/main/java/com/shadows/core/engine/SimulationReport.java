package com.shadows.core.engine;

import java.util.List;

/**
 * Summary of one headless playthrough.
 *
 * @param itemsSpawned          quest items that appeared through exploration rolls or the pity timer
 * @param itemsForced           quest items placed by the doom-driven guarantee
 * @param questTilesMaterialized quest tiles placed on the board
 * @param firedDoomEvents       prophecy lines of the doom events that fired, in order
 * @param completion            share of required objectives completed, 0 to 100
 */
public record SimulationReport(
    String scenarioId,
    SimulationOutcome outcome,
    int roundsPlayed,
    int finalDoom,
    int itemsSpawned,
    int itemsForced,
    int questTilesMaterialized,
    List<String> firedDoomEvents,
    int completion
) {

    public SimulationReport {
        firedDoomEvents = List.copyOf(firedDoomEvents);
    }
}
