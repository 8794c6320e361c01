package com.sourcelint.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private CommandTestSupport cli;

    @BeforeEach
    void setUp() {
        cli = new CommandTestSupport();
    }

    @Test
    void validate_validConfig_exitsWithZero() throws IOException {
        Path config = tempDir.resolve(".sourcelint.yml");
        Files.writeString(config, """
            opt_in_rules:
              - object_literal
            line_length:
              warning: 100
              error: 150
            object_literal: error
            reporter: json
            """);

        int exitCode = cli.execute("validate", config.toString());

        assertThat(exitCode).isZero();
        assertThat(cli.out()).contains("Configuration is valid");
    }

    @Test
    void validate_problems_areListed() throws IOException {
        Path config = tempDir.resolve(".sourcelint.yml");
        Files.writeString(config, """
            disabled_rules:
              - trailing_whitespace
            cyclomatic_complexity: [1, 2, 3]
            reporter: html
            """);

        int exitCode = cli.execute("validate", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err())
            .contains("3 problem(s)")
            .contains("Unknown rule identifier: 'trailing_whitespace'")
            .contains("Invalid configuration for 'cyclomatic_complexity'")
            .contains("Unknown reporter: 'html'");
    }

    @Test
    void validate_malformedYaml_exitsWithOne() throws IOException {
        Path config = tempDir.resolve(".sourcelint.yml");
        Files.writeString(config, "line_length: [100\n");

        int exitCode = cli.execute("validate", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err()).contains("Invalid configuration file");
    }

    @Test
    void validate_missingFile_exitsWithOne() {
        int exitCode = cli.execute("validate", tempDir.resolve("absent.yml").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err()).contains("Configuration file not found");
    }
}
