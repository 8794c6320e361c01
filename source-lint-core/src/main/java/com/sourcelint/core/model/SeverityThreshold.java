package com.sourcelint.core.model;

import java.util.Objects;

/**
 * A (value, severity) pair: a metric strictly greater than {@code value}
 * violates at {@code severity}.
 *
 * @param value threshold value
 * @param severity severity reported when the value is exceeded
 */
public record SeverityThreshold(int value, Severity severity) {

    public SeverityThreshold {
        Objects.requireNonNull(severity, "severity must not be null");
    }

    public static SeverityThreshold warning(int value) {
        return new SeverityThreshold(value, Severity.WARNING);
    }

    public static SeverityThreshold error(int value) {
        return new SeverityThreshold(value, Severity.ERROR);
    }

    public boolean isExceededBy(int metric) {
        return metric > value;
    }
}
