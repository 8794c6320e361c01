package com.sourcelint.core.rule;

/**
 * Marker for rules that are disabled unless listed under {@code opt_in_rules}.
 */
public interface OptInRule extends Rule {
}
