package com.shadows.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for the mission engine.
 * Routes to subcommands: generate, validate, simulate, serve.
 */
@Command(
        name = "shadows",
        mixinStandardHelpOptions = true,
        version = "Shadows 0.1.0",
        description = "Procedural mission generator and balance checker for Shadows",
        subcommands = {
                GenerateCommand.class,
                ValidateCommand.class,
                SimulateCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShadowsCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
