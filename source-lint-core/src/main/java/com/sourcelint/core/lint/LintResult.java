package com.sourcelint.core.lint;

import com.sourcelint.core.model.Violation;

import java.util.List;
import java.util.Objects;

/**
 * Result of linting one file.
 *
 * @param file path of the linted file
 * @param success whether the file could be read and linted
 * @param violations violations found, grouped by rule and in source order within a rule
 * @param warnings non-fatal issues (e.g. no syntax tree available)
 * @param errors fatal errors that prevented linting the file
 */
public record LintResult(
    String file,
    boolean success,
    List<Violation> violations,
    List<String> warnings,
    List<String> errors
) {
    /**
     * Compact constructor with validation.
     */
    public LintResult {
        Objects.requireNonNull(file, "file must not be null");
        violations = violations == null ? List.of() : List.copyOf(violations);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Creates a successful result.
     *
     * @param file file path
     * @param violations violations found
     * @param warnings non-fatal issues
     * @return successful result
     */
    public static LintResult of(String file, List<Violation> violations, List<String> warnings) {
        return new LintResult(file, true, violations, warnings, List.of());
    }

    /**
     * Creates a failed result.
     *
     * @param file file path
     * @param errors error messages
     * @return failed result
     */
    public static LintResult failed(String file, List<String> errors) {
        return new LintResult(file, false, List.of(), List.of(), errors);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    public long seriousViolationCount() {
        return violations.stream().filter(Violation::isSerious).count();
    }
}
