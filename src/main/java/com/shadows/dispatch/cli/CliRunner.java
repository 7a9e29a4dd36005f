package com.shadows.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring context and hands its exit code back to
 * {@link com.shadows.ShadowsApplication}. A {@code serve} invocation is left to the embedded
 * web server, which keeps the JVM alive on its own.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private static final String SERVE = "serve";

    private final ShadowsCommand shadowsCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ShadowsCommand shadowsCommand, IFactory factory) {
        this.shadowsCommand = shadowsCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand is {@code serve}. The root command takes only flags, so the
     * first non-option argument names the subcommand; a later {@code serve}, such as the value
     * of {@code generate --out serve}, does not count.
     */
    public static boolean isServeInvocation(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return SERVE.equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) {
        if (isServeInvocation(args)) {
            log.debug("Serve mode, leaving the command line to the web server");
            return;
        }
        exitCode = new CommandLine(shadowsCommand, factory).execute(args);
        log.debug("Command '{}' finished with exit code {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
