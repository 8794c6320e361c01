package com.sourcelint.cli;

import com.sourcelint.core.config.ConfigLoader;
import com.sourcelint.core.config.LintConfig;
import com.sourcelint.core.lint.LintResult;
import com.sourcelint.core.lint.Linter;
import com.sourcelint.core.model.Violation;
import com.sourcelint.core.report.ReporterRegistry;
import com.sourcelint.core.report.ViolationReporter;
import com.sourcelint.core.rule.RuleRegistry;
import com.sourcelint.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to lint source files and print their violations.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration and build the rule registry</li>
 *   <li>Discover source files under the given paths (or the configured {@code included} paths)</li>
 *   <li>Lint every file, optionally in parallel</li>
 *   <li>Print the report and a summary</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> 0 when no serious violation was found, 1 when linting failed,
 * 2 when an error-severity violation was found (or any violation with {@code --strict}).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sourcelint lint
 * sourcelint lint Sources --reporter json
 * sourcelint lint --strict --parallel
 * }</pre>
 */
@Command(
    name = "lint",
    description = "Lint source files and print violations",
    mixinStandardHelpOptions = true
)
public class LintCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LintCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_VIOLATIONS = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(
        arity = "0..*",
        description = "Files or directories to lint (default: configured 'included' paths or current directory)"
    )
    private List<Path> paths = new ArrayList<>();

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: .sourcelint.yml)"
    )
    private Path configPath = Paths.get(LintConfig.DEFAULT_FILE_NAME);

    @Option(
        names = {"-r", "--reporter"},
        description = "Reporter to use (overrides config): xcode, json"
    )
    private String reporterId;

    @Option(
        names = {"--strict"},
        description = "Fail on warnings as well as errors"
    )
    private boolean strict;

    @Option(
        names = {"--parallel"},
        description = "Lint files in parallel"
    )
    private boolean parallel;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            LintConfig config = ConfigLoader.load(configPath);
            RuleRegistry registry = RuleRegistry.fromConfig(config);
            registry.getConfigurationProblems().forEach(problem -> err.println("⚠ " + problem));

            String selectedReporter = reporterId != null ? reporterId : config.reporter();
            Optional<ViolationReporter> reporter = ReporterRegistry.find(selectedReporter);
            if (reporter.isEmpty()) {
                err.println("✗ Unknown reporter: " + selectedReporter);
                return EXIT_FAILURE;
            }

            List<Path> files = FileUtils.findSourceFiles(resolveRoots(config), resolveExcluded(config));
            if (files.isEmpty()) {
                err.println("⚠ No source files found to lint");
                return EXIT_OK;
            }

            List<LintResult> results = new Linter(registry).lintFiles(files, parallel);
            return report(results, reporter.get(), out, err);

        } catch (IOException e) {
            log.error("Lint failed", e);
            err.println("✗ Lint failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int report(List<LintResult> results, ViolationReporter reporter, PrintWriter out, PrintWriter err) {
        List<Violation> violations = new ArrayList<>();
        boolean failed = false;
        for (LintResult result : results) {
            violations.addAll(result.violations());
            result.warnings().forEach(warning -> log.warn("{}: {}", result.file(), warning));
            if (!result.success()) {
                failed = true;
                result.errors().forEach(error -> err.println("✗ " + result.file() + ": " + error));
            }
        }

        String report = reporter.generateReport(violations);
        if (!report.isEmpty()) {
            out.println(report);
        }
        out.flush();

        long serious = violations.stream().filter(Violation::isSerious).count();
        err.printf("Done linting! Found %d violation%s, %d serious in %d file%s.%n",
            violations.size(), violations.size() == 1 ? "" : "s",
            serious, results.size(), results.size() == 1 ? "" : "s");
        err.flush();

        if (failed) {
            return EXIT_FAILURE;
        }
        if (serious > 0 || (strict && !violations.isEmpty())) {
            return EXIT_VIOLATIONS;
        }
        return EXIT_OK;
    }

    private List<Path> resolveRoots(LintConfig config) {
        if (!paths.isEmpty()) {
            return paths;
        }
        if (!config.included().isEmpty()) {
            return config.included().stream().map(this::relativeToConfig).toList();
        }
        return List.of(Paths.get("."));
    }

    private List<Path> resolveExcluded(LintConfig config) {
        return config.excluded().stream().map(this::relativeToConfig).toList();
    }

    private Path relativeToConfig(String path) {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(path) : Paths.get(path);
    }
}
