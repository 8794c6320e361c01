package com.sourcelint.core.syntax;

import java.util.Objects;
import java.util.Optional;

/**
 * Control-flow statement ({@code if}, {@code switch}, {@code case}, loops, braces).
 *
 * @param id arena index
 * @param kind statement kind
 * @param range byte range of the statement
 * @param bodyRange byte range inside the braces, may be null
 */
public record StatementNode(
    int id,
    SyntaxKind kind,
    ByteRange range,
    ByteRange bodyRange
) implements SyntaxNode {

    public StatementNode {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(range, "range must not be null");
        if (kind.category() != SyntaxKind.Category.STATEMENT) {
            throw new IllegalArgumentException("Not a statement kind: " + kind);
        }
    }

    @Override
    public Optional<String> name() {
        return Optional.empty();
    }

    @Override
    public Optional<ByteRange> body() {
        return Optional.ofNullable(bodyRange);
    }
}
