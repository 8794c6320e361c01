package com.sourcelint.core.config;

import com.sourcelint.core.model.Severity;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration of rules that report at a single fixed severity.
 *
 * <p>Accepted YAML forms:
 * <pre>{@code
 * object_literal: error
 * object_literal:
 *   severity: error
 * }</pre>
 *
 * @param severity severity every violation is reported at
 */
public record SeverityConfiguration(Severity severity) {

    public SeverityConfiguration {
        Objects.requireNonNull(severity, "severity must not be null");
    }

    public static SeverityConfiguration warning() {
        return new SeverityConfiguration(Severity.WARNING);
    }

    public static SeverityConfiguration error() {
        return new SeverityConfiguration(Severity.ERROR);
    }

    /**
     * Parses a raw configuration value.
     *
     * @param ruleId rule the value belongs to, used in error messages
     * @param raw value as read from YAML (String or Map)
     * @return parsed configuration
     * @throws RuleConfigurationException if the value has an unsupported shape
     */
    public static SeverityConfiguration parse(String ruleId, Object raw) throws RuleConfigurationException {
        Object value = raw instanceof Map<?, ?> map ? map.get("severity") : raw;
        if (!(value instanceof String text)) {
            throw new RuleConfigurationException(ruleId, "Expected 'warning' or 'error', got: " + raw);
        }
        try {
            return new SeverityConfiguration(Severity.fromIdentifier(text));
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException(ruleId, e.getMessage(), e);
        }
    }

    public String describe() {
        return severity.identifier();
    }
}
