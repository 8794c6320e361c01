package com.sourcelint.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RulesCommand}.
 */
class RulesCommandTest {

    private CommandTestSupport cli;

    @BeforeEach
    void setUp() {
        cli = new CommandTestSupport();
    }

    @Test
    void rules_listsAllRulesWithDefaults() {
        int exitCode = cli.execute("rules");

        assertThat(exitCode).isZero();
        assertThat(cli.out())
            .contains("Cyclomatic Complexity (ID: cyclomatic_complexity)")
            .contains("Configuration: error: 20, warning: 10")
            .contains("Line Length (ID: line_length)")
            .contains("Object Literal (ID: object_literal)")
            .contains("Opt-in: yes");
    }

    @Test
    void rules_withId_printsExamples() {
        int exitCode = cli.execute("rules", "object_literal");

        assertThat(exitCode).isZero();
        assertThat(cli.out())
            .contains("Object Literal (object_literal): Prefer object literals over image and color inits.")
            .contains("Default configuration: warning")
            .contains("let image = ↓UIImage(named: \"foo\")");
    }

    @Test
    void rules_unknownId_exitsWithOne() {
        int exitCode = cli.execute("rules", "no_such_rule");

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err()).contains("Unknown rule: no_such_rule");
    }
}
