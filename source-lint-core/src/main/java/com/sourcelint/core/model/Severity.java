package com.sourcelint.core.model;

import java.util.Locale;

/**
 * Severity of a rule violation.
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Style issue that should be fixed but does not fail the run.
     */
    WARNING,

    /**
     * Serious issue; a run containing one exits with a failure code.
     */
    ERROR;

    /**
     * Returns the lowercase name used in configuration files and reports.
     *
     * @return "warning" or "error"
     */
    public String identifier() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a configuration value ("warning", "error"), ignoring case and surrounding blanks.
     *
     * @param value raw value
     * @return parsed severity
     * @throws IllegalArgumentException if the value names no severity
     */
    public static Severity fromIdentifier(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "warning" -> WARNING;
            case "error" -> ERROR;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }
}
