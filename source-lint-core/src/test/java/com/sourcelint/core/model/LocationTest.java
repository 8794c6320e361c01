package com.sourcelint.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Location} and {@link Violation}.
 */
class LocationTest {

    @Test
    void describe_omitsMissingParts() {
        assertThat(Location.atOffset("App.swift", 10, 2, 4).describe()).isEqualTo("App.swift:2:4");
        assertThat(Location.atLine("App.swift", 7).describe()).isEqualTo("App.swift:7");
        assertThat(Location.atOffset(null, 10, null, null).describe()).isEqualTo("<nopath>");
    }

    @Test
    void violation_defaultsNameToRuleId() {
        Violation violation = new Violation("line_length", null, Severity.ERROR, Location.atLine(null, 1), "reason");

        assertThat(violation.ruleName()).isEqualTo("line_length");
        assertThat(violation.isSerious()).isTrue();
    }

    @Test
    void violation_missingReason_throwsException() {
        assertThatThrownBy(() -> new Violation("line_length", "Line Length", Severity.WARNING,
                Location.atLine(null, 1), null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("reason");
    }

    @Test
    void severity_fromIdentifier_ignoresCase() {
        assertThat(Severity.fromIdentifier(" Error ")).isEqualTo(Severity.ERROR);
        assertThat(Severity.WARNING.identifier()).isEqualTo("warning");
        assertThatThrownBy(() -> Severity.fromIdentifier("fatal"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
