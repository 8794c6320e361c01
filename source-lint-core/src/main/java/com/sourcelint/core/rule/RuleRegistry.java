package com.sourcelint.core.rule;

import com.sourcelint.core.config.LintConfig;
import com.sourcelint.core.config.RuleConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The set of rules enabled for a lint run, configured from a {@link LintConfig}.
 *
 * <p>Rules are discovered via {@link ServiceLoader}. Each registry instantiates its
 * own rule objects, so configuration applied here never leaks between registries.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RuleRegistry registry = RuleRegistry.fromConfig(ConfigLoader.load(configPath));
 * registry.getConfigurationProblems().forEach(System.err::println);
 * Linter linter = new Linter(registry);
 * }</pre>
 */
public final class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final List<Rule> rules;
    private final List<String> configurationProblems;

    private RuleRegistry(List<Rule> rules, List<String> configurationProblems) {
        this.rules = List.copyOf(rules);
        this.configurationProblems = List.copyOf(configurationProblems);
    }

    /**
     * Discovers every registered rule with its default configuration, sorted by id.
     *
     * @return all available rules
     */
    public static List<Rule> discoverAll() {
        log.debug("Discovering rules via ServiceLoader");
        List<Rule> discovered = ServiceLoader.load(Rule.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(Rule::getId))
            .collect(Collectors.toList());
        log.debug("Discovered {} rules", discovered.size());
        return discovered;
    }

    /**
     * Builds a registry of the rules enabled by the configuration, each configured
     * from its entry. Invalid entries are reported and the rule keeps its defaults.
     *
     * @param config lint configuration
     * @return configured registry
     */
    public static RuleRegistry fromConfig(LintConfig config) {
        return fromRules(discoverAll(), config);
    }

    /**
     * Builds a registry from explicit rule instances.
     *
     * @param candidates rule instances, owned by the registry afterwards
     * @param config lint configuration
     * @return configured registry
     */
    public static RuleRegistry fromRules(List<Rule> candidates, LintConfig config) {
        List<String> problems = new ArrayList<>();
        Set<String> knownIds = candidates.stream().map(Rule::getId).collect(Collectors.toSet());

        for (String referenced : config.referencedRuleIds()) {
            if (!knownIds.contains(referenced)) {
                log.warn("Configuration references unknown rule: {}", referenced);
                problems.add("Unknown rule identifier: '" + referenced + "'");
            }
        }

        List<Rule> enabled = new ArrayList<>();
        for (Rule rule : candidates) {
            if (!config.isEnabled(rule.getId(), rule.isOptIn())) {
                log.debug("Rule {} is disabled", rule.getId());
                continue;
            }
            Object raw = config.ruleConfiguration(rule.getId());
            if (raw != null && rule instanceof ConfigurableRule configurable) {
                try {
                    configurable.applyConfiguration(raw);
                } catch (RuleConfigurationException e) {
                    log.warn("Invalid configuration for '{}': {}. Falling back to default.",
                        e.getRuleId(), e.getMessage());
                    problems.add("Invalid configuration for '" + e.getRuleId() + "': " + e.getMessage());
                }
            }
            enabled.add(rule);
        }

        log.info("Enabled {} of {} rules", enabled.size(), candidates.size());
        return new RuleRegistry(enabled, problems);
    }

    /**
     * Returns the enabled rules in id order.
     *
     * @return enabled rules
     */
    public List<Rule> getRules() {
        return rules;
    }

    public List<AstRule> getAstRules() {
        return rules.stream()
            .filter(AstRule.class::isInstance)
            .map(AstRule.class::cast)
            .toList();
    }

    /**
     * Returns the enabled rules that are not AST rules; they run once per file.
     *
     * @return whole-file rules
     */
    public List<Rule> getFileRules() {
        return rules.stream()
            .filter(rule -> !(rule instanceof AstRule))
            .toList();
    }

    public Optional<Rule> find(String ruleId) {
        return rules.stream().filter(rule -> rule.getId().equals(ruleId)).findFirst();
    }

    /**
     * Returns problems found while applying the configuration (unknown ids, invalid entries).
     *
     * @return problem messages, empty when the configuration is clean
     */
    public List<String> getConfigurationProblems() {
        return configurationProblems;
    }
}
