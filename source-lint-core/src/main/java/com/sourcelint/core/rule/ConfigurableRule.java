package com.sourcelint.core.rule;

import com.sourcelint.core.config.RuleConfigurationException;

/**
 * A rule whose behaviour can be tuned from the configuration file.
 *
 * <p>Configuration is applied once, right after instantiation and before any file is
 * validated.
 */
public interface ConfigurableRule extends Rule {

    /**
     * Applies the raw YAML entry stored under this rule's identifier.
     *
     * @param raw raw value (String, Number, List or Map)
     * @throws RuleConfigurationException if the value cannot be applied; the rule keeps
     *         its previous configuration
     */
    void applyConfiguration(Object raw) throws RuleConfigurationException;

    /**
     * Describes the effective configuration, e.g. {@code "error: 200, warning: 120"}.
     *
     * @return configuration summary
     */
    String getConfigurationDescription();
}
