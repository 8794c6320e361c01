package com.sourcelint.core.config;

import com.sourcelint.core.model.Severity;
import com.sourcelint.core.model.SeverityThreshold;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered severity thresholds for metric rules (line length, complexity).
 *
 * <p>Thresholds are evaluated in the stored order and the first one the metric
 * exceeds decides the severity. {@link #of(int, int)} stores the error threshold
 * first so that a metric above both limits reports {@link Severity#ERROR}.
 * Explicit threshold lists keep the order they were written in.
 *
 * <p>Accepted YAML forms:
 * <pre>{@code
 * line_length: 150              # warning only
 * line_length: [150, 200]       # warning, error
 * line_length:
 *   warning: 150
 *   error: 200
 * line_length:
 *   thresholds:                 # evaluated top to bottom
 *     - {value: 200, severity: error}
 *     - {value: 150, severity: warning}
 * }</pre>
 *
 * @param thresholds thresholds in evaluation order, never empty
 */
public record SeverityLevelsConfiguration(List<SeverityThreshold> thresholds) {

    public SeverityLevelsConfiguration {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new IllegalArgumentException("At least one threshold is required");
        }
        thresholds = List.copyOf(thresholds);
    }

    /**
     * Creates a warning-only configuration.
     *
     * @param warning warning threshold
     * @return configuration
     */
    public static SeverityLevelsConfiguration of(int warning) {
        return new SeverityLevelsConfiguration(List.of(SeverityThreshold.warning(warning)));
    }

    /**
     * Creates a warning/error configuration, error evaluated first.
     *
     * @param warning warning threshold
     * @param error error threshold
     * @return configuration
     */
    public static SeverityLevelsConfiguration of(int warning, int error) {
        return new SeverityLevelsConfiguration(List.of(
            SeverityThreshold.error(error),
            SeverityThreshold.warning(warning)));
    }

    /**
     * Returns the first threshold, in configured order, that the metric exceeds.
     *
     * @param metric measured value
     * @return exceeded threshold, or empty if none is exceeded
     */
    public Optional<SeverityThreshold> firstExceededBy(int metric) {
        for (SeverityThreshold threshold : thresholds) {
            if (threshold.isExceededBy(metric)) {
                return Optional.of(threshold);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the configured warning value quoted in violation messages; falls back
     * to the first threshold when no warning level is configured.
     *
     * @return warning threshold value
     */
    public int warning() {
        return thresholds.stream()
            .filter(threshold -> threshold.severity() == Severity.WARNING)
            .findFirst()
            .orElse(thresholds.get(0))
            .value();
    }

    /**
     * Returns the smallest configured value; metrics at or below it never violate.
     *
     * @return minimum threshold value
     */
    public int minimumValue() {
        return thresholds.stream().mapToInt(SeverityThreshold::value).min().orElseThrow();
    }

    public String describe() {
        return thresholds.stream()
            .map(threshold -> threshold.severity().identifier() + ": " + threshold.value())
            .collect(Collectors.joining(", "));
    }

    /**
     * Parses a raw configuration value.
     *
     * @param ruleId rule the value belongs to, used in error messages
     * @param raw value as read from YAML (Integer, List or Map)
     * @return parsed configuration
     * @throws RuleConfigurationException if the value has an unsupported shape
     */
    public static SeverityLevelsConfiguration parse(String ruleId, Object raw) throws RuleConfigurationException {
        if (raw instanceof Number number) {
            return of(number.intValue());
        }
        if (raw instanceof List<?> list) {
            return parseList(ruleId, list);
        }
        if (raw instanceof Map<?, ?> map) {
            if (map.containsKey("thresholds")) {
                return parseThresholds(ruleId, map.get("thresholds"));
            }
            Object warning = map.get("warning");
            Object error = map.get("error");
            if (!(warning instanceof Number warningValue)) {
                throw new RuleConfigurationException(ruleId, "Missing numeric 'warning' threshold: " + raw);
            }
            if (error == null) {
                return of(warningValue.intValue());
            }
            if (!(error instanceof Number errorValue)) {
                throw new RuleConfigurationException(ruleId, "'error' threshold must be numeric: " + error);
            }
            return of(warningValue.intValue(), errorValue.intValue());
        }
        throw new RuleConfigurationException(ruleId, "Unsupported threshold configuration: " + raw);
    }

    private static SeverityLevelsConfiguration parseList(String ruleId, List<?> list) throws RuleConfigurationException {
        if (list.size() == 1 && list.get(0) instanceof Number warning) {
            return of(warning.intValue());
        }
        if (list.size() == 2 && list.get(0) instanceof Number warning && list.get(1) instanceof Number error) {
            return of(warning.intValue(), error.intValue());
        }
        throw new RuleConfigurationException(ruleId, "Expected [warning] or [warning, error], got: " + list);
    }

    private static SeverityLevelsConfiguration parseThresholds(String ruleId, Object raw)
            throws RuleConfigurationException {
        if (!(raw instanceof List<?> entries) || entries.isEmpty()) {
            throw new RuleConfigurationException(ruleId, "'thresholds' must be a non-empty list");
        }
        List<SeverityThreshold> thresholds = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map) || !(map.get("value") instanceof Number value)
                    || !(map.get("severity") instanceof String severity)) {
                throw new RuleConfigurationException(ruleId, "Threshold entries need 'value' and 'severity': " + entry);
            }
            try {
                thresholds.add(new SeverityThreshold(value.intValue(), Severity.fromIdentifier(severity)));
            } catch (IllegalArgumentException e) {
                throw new RuleConfigurationException(ruleId, e.getMessage(), e);
            }
        }
        return new SeverityLevelsConfiguration(thresholds);
    }
}
