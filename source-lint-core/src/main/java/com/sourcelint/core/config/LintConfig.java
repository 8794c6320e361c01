package com.sourcelint.core.config;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Root configuration for a lint run.
 *
 * <p>Loaded from {@code .sourcelint.yml} by {@link ConfigLoader}. Every top-level key
 * that is not a reserved key is treated as the configuration entry of the rule with
 * that identifier.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * disabled_rules:
 *   - line_length
 * opt_in_rules:
 *   - object_literal
 * included:
 *   - Sources
 * excluded:
 *   - Sources/Generated
 * reporter: json
 *
 * cyclomatic_complexity:
 *   warning: 12
 *   error: 25
 * object_literal: error
 * }</pre>
 *
 * @param disabledRules rules switched off
 * @param optInRules opt-in rules switched on
 * @param onlyRules when non-empty, the exact set of rules to run (overrides the two lists above)
 * @param included paths to lint, relative to the working directory
 * @param excluded paths skipped during file discovery
 * @param reporter reporter id, null for the default
 * @param ruleConfigurations raw rule entries keyed by rule id
 */
public record LintConfig(
    List<String> disabledRules,
    List<String> optInRules,
    List<String> onlyRules,
    List<String> included,
    List<String> excluded,
    String reporter,
    Map<String, Object> ruleConfigurations
) {
    /**
     * Top-level keys that do not name a rule.
     */
    public static final Set<String> RESERVED_KEYS = Set.of(
        "disabled_rules", "opt_in_rules", "only_rules", "included", "excluded", "reporter");

    /**
     * Default configuration file name.
     */
    public static final String DEFAULT_FILE_NAME = ".sourcelint.yml";

    public LintConfig {
        disabledRules = disabledRules == null ? List.of() : List.copyOf(disabledRules);
        optInRules = optInRules == null ? List.of() : List.copyOf(optInRules);
        onlyRules = onlyRules == null ? List.of() : List.copyOf(onlyRules);
        included = included == null ? List.of() : List.copyOf(included);
        excluded = excluded == null ? List.of() : List.copyOf(excluded);
        ruleConfigurations = ruleConfigurations == null ? Map.of() : Map.copyOf(ruleConfigurations);
    }

    /**
     * Creates the default configuration: every non opt-in rule with its default settings.
     *
     * @return default configuration
     */
    public static LintConfig defaults() {
        return new LintConfig(List.of(), List.of(), List.of(), List.of(), List.of(), null, Map.of());
    }

    /**
     * Decides whether a rule runs.
     *
     * @param ruleId rule identifier
     * @param optIn whether the rule is opt-in
     * @return true if the rule is enabled
     */
    public boolean isEnabled(String ruleId, boolean optIn) {
        if (!onlyRules.isEmpty()) {
            return onlyRules.contains(ruleId);
        }
        if (disabledRules.contains(ruleId)) {
            return false;
        }
        return !optIn || optInRules.contains(ruleId);
    }

    /**
     * Returns the raw configuration entry of a rule.
     *
     * @param ruleId rule identifier
     * @return raw value or null when the rule is not configured
     */
    public Object ruleConfiguration(String ruleId) {
        return ruleConfigurations.get(ruleId);
    }

    /**
     * Returns every rule id the configuration refers to, in any of its lists or entries.
     *
     * @return referenced rule ids
     */
    public Set<String> referencedRuleIds() {
        Set<String> ids = new TreeSet<>(ruleConfigurations.keySet());
        ids.addAll(disabledRules);
        ids.addAll(optInRules);
        ids.addAll(onlyRules);
        return ids;
    }
}
