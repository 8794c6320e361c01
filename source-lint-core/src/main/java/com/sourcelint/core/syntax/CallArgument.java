package com.sourcelint.core.syntax;

import java.util.Optional;

/**
 * A single argument of a call expression.
 *
 * @param name argument label, {@code null} for unlabelled arguments
 * @param body byte range of the argument value, {@code null} when unresolved
 */
public record CallArgument(String name, ByteRange body) {

    public static CallArgument named(String name, ByteRange body) {
        return new CallArgument(name, body);
    }

    public Optional<String> label() {
        return Optional.ofNullable(name);
    }

    public Optional<ByteRange> valueRange() {
        return Optional.ofNullable(body);
    }
}
