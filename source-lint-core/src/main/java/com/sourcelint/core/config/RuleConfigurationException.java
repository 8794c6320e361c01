package com.sourcelint.core.config;

/**
 * Thrown when a rule's configuration entry cannot be applied.
 *
 * <p>The registry catches it, logs a warning and keeps the rule's defaults.
 */
public class RuleConfigurationException extends Exception {

    private final String ruleId;

    public RuleConfigurationException(String ruleId, String message) {
        super(message);
        this.ruleId = ruleId;
    }

    public RuleConfigurationException(String ruleId, String message, Throwable cause) {
        super(message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
