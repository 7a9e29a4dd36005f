package com.shadows.dispatch.cli;

import com.shadows.core.engine.PlaythroughSimulator;
import com.shadows.core.engine.SimulationOutcome;
import com.shadows.core.engine.SimulationReport;
import com.shadows.core.events.EventBus;
import com.shadows.core.model.Difficulty;
import com.shadows.core.repair.ValidatedScenario;
import com.shadows.core.repair.ValidatedScenarioGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: shadows simulate [-d difficulty] [--runs N]
 * <p>
 * Generates validated scenarios and plays each one headlessly, printing a
 * victory/defeat tally. {@code --live} streams every game event as it happens.
 */
@Command(name = "simulate", mixinStandardHelpOptions = true,
        description = "Play generated scenarios headlessly to sanity-check balance")
@Component
public class SimulateCommand implements Callable<Integer> {

    @Option(names = {"--difficulty", "-d"}, description = "Normal, Hard or Nightmare", defaultValue = "Normal")
    private String difficulty;

    @Option(names = "--runs", description = "Number of scenarios to play", defaultValue = "1")
    private int runs;

    @Option(names = "--max-rounds", description = "Round cap per playthrough", defaultValue = "40")
    private int maxRounds;

    @Option(names = "--live", description = "Print game events as they happen")
    private boolean live;

    private final ValidatedScenarioGenerator generator;
    private final PlaythroughSimulator simulator;
    private final EventBus eventBus;

    public SimulateCommand(ValidatedScenarioGenerator generator, PlaythroughSimulator simulator, EventBus eventBus) {
        this.generator = generator;
        this.simulator = simulator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Difficulty level;
        try {
            level = Difficulty.fromLabel(difficulty);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid difficulty: " + difficulty + ". Valid: Normal, Hard, Nightmare");
            return 2;
        }
        if (runs < 1 || maxRounds < 1) {
            ConsoleOutput.error("--runs and --max-rounds must be at least 1");
            return 2;
        }

        Map<SimulationOutcome, Integer> tally = new EnumMap<>(SimulationOutcome.class);
        EventBus.Subscription subscription = live ? eventBus.subscribeAll(ConsoleOutput::liveEvent) : null;
        try {
            for (int i = 0; i < runs; i++) {
                Optional<ValidatedScenario> validated = generator.generateValidatedScenario(level);
                if (validated.isEmpty()) {
                    ConsoleOutput.error("Run " + (i + 1) + ": no winnable scenario generated");
                    return 1;
                }
                SimulationReport report = simulator.simulate(validated.get().scenario(), maxRounds);
                ConsoleOutput.simulation(report);
                tally.merge(report.outcome(), 1, Integer::sum);
            }
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        System.out.println("──────────────────────────────────");
        ConsoleOutput.info(String.format("%d run(s): %d victory, %d defeat, %d stalled",
                runs,
                tally.getOrDefault(SimulationOutcome.VICTORY, 0),
                tally.getOrDefault(SimulationOutcome.DEFEAT, 0),
                tally.getOrDefault(SimulationOutcome.STALLED, 0)));
        return 0;
    }
}
