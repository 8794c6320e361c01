package com.sourcelint.cli;

import com.sourcelint.core.config.ConfigLoader;
import com.sourcelint.core.config.LintConfig;
import com.sourcelint.core.report.ReporterRegistry;
import com.sourcelint.core.rule.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file.
 *
 * <p>Reports YAML errors, unknown rule identifiers, rule entries that cannot be
 * applied, and unknown reporters. Exits with 1 if any problem is found.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = LintConfig.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        log.debug("Validating configuration: {}", configFile);

        if (!Files.isRegularFile(configFile)) {
            err.println("✗ Configuration file not found: " + configFile);
            return 1;
        }

        LintConfig config;
        try {
            config = ConfigLoader.parse(Files.readString(configFile));
        } catch (IOException e) {
            err.println("✗ Invalid configuration file " + configFile + ": " + e.getMessage());
            return 1;
        }

        List<String> problems = new ArrayList<>(
            RuleRegistry.fromRules(RuleRegistry.discoverAll(), config).getConfigurationProblems());
        if (config.reporter() != null && ReporterRegistry.find(config.reporter()).isEmpty()) {
            problems.add("Unknown reporter: '" + config.reporter() + "'");
        }

        if (problems.isEmpty()) {
            out.println("✓ Configuration is valid: " + configFile);
            return 0;
        }

        err.println("✗ Configuration has " + problems.size() + " problem(s):");
        problems.forEach(problem -> err.println("  - " + problem));
        return 1;
    }
}
