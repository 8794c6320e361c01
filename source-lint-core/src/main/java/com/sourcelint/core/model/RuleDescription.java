package com.sourcelint.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Static description of a rule, including its conformance examples.
 *
 * <p>Triggering examples mark the expected violation position with {@link #MARKER}.
 *
 * @param identifier rule id used in configuration ({@code line_length})
 * @param name display name ({@code Line Length})
 * @param description one-line description, also the default violation reason
 * @param nonTriggeringExamples sources that must not produce a violation
 * @param triggeringExamples sources that must produce exactly one violation
 */
public record RuleDescription(
    String identifier,
    String name,
    String description,
    List<String> nonTriggeringExamples,
    List<String> triggeringExamples
) {

    /**
     * Marks the expected violation position inside a triggering example.
     */
    public static final String MARKER = "↓";

    public RuleDescription {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(description, "description must not be null");
        nonTriggeringExamples = nonTriggeringExamples == null ? List.of() : List.copyOf(nonTriggeringExamples);
        triggeringExamples = triggeringExamples == null ? List.of() : List.copyOf(triggeringExamples);
    }
}
