package com.shadows.dispatch.cli;

import com.shadows.core.engine.SimulationReport;
import com.shadows.core.events.ShadowsEvent;
import com.shadows.core.model.Scenario;
import com.shadows.core.validation.ValidationIssue;
import com.shadows.core.validation.ValidationResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Shadows CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) SHADOWS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SHADOWS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void scenario(Scenario scenario) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + scenario.title() + "|@ (" + scenario.id() + ")"));
        System.out.println("  " + scenario.difficulty().label() + " | " + scenario.victoryType()
                + " | start doom " + scenario.startDoom() + " | " + scenario.startLocation());
        scenario.objectives().forEach(o -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    " + (o.optional() ? "@|fg(blue) bonus|@" : "@|fg(yellow) main |@")
                        + " " + o.shortDescription() + (o.hidden() ? " (hidden)" : ""))));
        scenario.doomProphecy().forEach(line -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(magenta) ~|@ " + line)));
    }

    public static void validation(ValidationResult result, String summary) {
        String color = result.winnable() ? "fg(green)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + ",bold [" + (result.winnable() ? "WINNABLE" : "NOT WINNABLE") + "]|@ "
                        + "confidence " + result.confidence() + "% - " + summary));
        for (ValidationIssue issue : result.issues()) {
            issue(issue);
        }
    }

    public static void issue(ValidationIssue issue) {
        String tag = issue.isError() ? "@|fg(red) ERROR|@" : "@|fg(yellow) WARN |@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + tag + " " + issue.code() + ": " + issue.message()));
        if (issue.suggestion() != null) {
            System.out.println("        -> " + issue.suggestion());
        }
    }

    public static void fixChange(String change) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) ~|@ " + change));
    }

    public static void simulation(SimulationReport report) {
        String color = switch (report.outcome()) {
            case VICTORY -> "fg(green)";
            case DEFEAT -> "fg(red)";
            case STALLED -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + ",bold [" + report.outcome() + "]|@ " + report.scenarioId()
                        + " after " + report.roundsPlayed() + " rounds, doom " + report.finalDoom()
                        + ", " + report.completion() + "% complete"));
        System.out.println("  Items: " + report.itemsSpawned() + " spawned, " + report.itemsForced() + " forced"
                + " | Quest tiles: " + report.questTilesMaterialized()
                + " | Doom events: " + report.firedDoomEvents().size());
    }

    public static void liveEvent(ShadowsEvent event) {
        String prefix = switch (event.eventType()) {
            case "scenario.generated", "scenario.fixed" -> "@|fg(cyan) [SCENARIO]|@";
            case "scenario.rejected" -> "@|fg(red) [REJECTED]|@";
            case "quest_item.spawned", "quest_item.collected" -> "@|fg(blue) [ITEM]|@";
            case "quest_tile.materialized" -> "@|fg(magenta) [TILE]|@";
            case "doom.event" -> "@|bold,fg(red) [DOOM]|@";
            case "boss.spawn" -> "@|bold,fg(red) [BOSS]|@";
            case "objective.completed" -> "@|fg(green) [OBJECTIVE]|@";
            case "simulation.finished" -> "@|bold,fg(yellow) [END]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.subjectId() != null ? event.subjectId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.payload()));
    }
}
