package com.sourcelint.core.rule;

import com.sourcelint.core.model.RuleDescription;
import com.sourcelint.core.model.Violation;

import java.util.List;

/**
 * A lint rule that inspects one source file and reports violations.
 *
 * <p>Rules are discovered via Java Service Provider Interface (SPI). Each call to
 * {@link #validate(LintContext)} is a pure function of the context: rules keep no
 * state between files, so the engine may run them in parallel.
 *
 * <p>Rules never throw from {@code validate}. Missing offsets, unresolved token kinds
 * and absent bodies mean "no match" for the node in question.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sourcelint.core.rule.Rule}
 *
 * @see AstRule
 * @see FileRule
 * @see LintContext
 */
public interface Rule {

    /**
     * Returns the static description of this rule, including its conformance examples.
     *
     * @return rule description
     */
    RuleDescription getDescription();

    /**
     * Returns the unique identifier of this rule (snake_case, e.g. "line_length").
     *
     * @return rule identifier
     */
    default String getId() {
        return getDescription().identifier();
    }

    /**
     * Returns true if the rule only runs when listed under {@code opt_in_rules}.
     *
     * @return true for opt-in rules
     */
    default boolean isOptIn() {
        return this instanceof OptInRule;
    }

    /**
     * Validates a whole file.
     *
     * @param context file, syntax tree and syntax map to check
     * @return violations in source order, empty if none
     */
    List<Violation> validate(LintContext context);
}
