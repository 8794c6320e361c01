package com.sourcelint.core.rule;

/**
 * A rule that only needs the raw lines of a file.
 *
 * <p>File rules still run when no syntax tree is available for a file.
 */
public interface FileRule extends Rule {
}
