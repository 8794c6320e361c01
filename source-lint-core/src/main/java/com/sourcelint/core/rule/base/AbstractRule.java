package com.sourcelint.core.rule.base;

import com.sourcelint.core.model.Location;
import com.sourcelint.core.model.RuleDescription;
import com.sourcelint.core.model.Severity;
import com.sourcelint.core.model.Violation;
import com.sourcelint.core.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for rule implementations providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per rule class)</li>
 *   <li>Violation creation helpers bound to this rule's description</li>
 * </ul>
 *
 * <p>Concrete rules expose their description as a {@code public static final
 * RuleDescription DESCRIPTION} constant and return it from {@link #getDescription()}.
 *
 * @see Rule
 * @since 1.0.0
 */
public abstract class AbstractRule implements Rule {

    /**
     * Logger instance for this rule.
     * Automatically initialized with the concrete rule class name.
     */
    protected final Logger log;

    protected AbstractRule() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Creates a violation attributed to this rule.
     *
     * @param severity severity to report
     * @param location violation location
     * @param reason explanation shown to the user
     * @return new violation
     */
    protected Violation violation(Severity severity, Location location, String reason) {
        RuleDescription description = getDescription();
        return new Violation(description.identifier(), description.name(), severity, location, reason);
    }

    /**
     * Creates a violation whose reason is the rule description text.
     *
     * @param severity severity to report
     * @param location violation location
     * @return new violation
     */
    protected Violation violation(Severity severity, Location location) {
        return violation(severity, location, getDescription().description());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getId() + "]";
    }
}
