package com.sourcelint.core.model;

import java.util.Objects;

/**
 * A single rule violation.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Violation violation = new Violation(
 *     "line_length",
 *     "Line Length",
 *     Severity.WARNING,
 *     Location.atLine("Sources/App.swift", 12),
 *     "Line should be 120 characters or less: currently 134 characters"
 * );
 * }</pre>
 *
 * @param ruleId identifier of the rule that produced the violation
 * @param ruleName display name of that rule
 * @param severity reported severity
 * @param location where the violation was found
 * @param reason human readable explanation
 */
public record Violation(
    String ruleId,
    String ruleName,
    Severity severity,
    Location location,
    String reason
) {

    public Violation {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        if (ruleName == null) {
            ruleName = ruleId;
        }
    }

    public boolean isSerious() {
        return severity == Severity.ERROR;
    }
}
