package com.sourcelint;

import ch.qos.logback.classic.Level;
import com.sourcelint.cli.LintCommand;
import com.sourcelint.cli.RulesCommand;
import com.sourcelint.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for SourceLint.
 *
 * <p>SourceLint checks Swift sources against style rules, using syntax trees dumped
 * by SourceKitten next to each source file.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code lint} - Lint files and print violations</li>
 *   <li>{@code rules} - List rules or describe one rule</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * sourcekitten structure --file App.swift > App.swift.structure.json
 * sourcekitten syntax --file App.swift > App.swift.syntax.json
 * sourcelint lint App.swift
 * }</pre>
 */
@Command(
    name = "sourcelint",
    mixinStandardHelpOptions = true,
    version = "SourceLint 1.0.0-SNAPSHOT",
    description = "Checks source files against configurable style rules",
    subcommands = {
        LintCommand.class,
        RulesCommand.class,
        ValidateCommand.class
    }
)
public class SourceLintCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SourceLintCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("SourceLint - configurable style rules for Swift sources");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sourcelint --help' to see available commands");
        System.out.println("Use 'sourcelint <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        SourceLintCLI cli = new SourceLintCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
