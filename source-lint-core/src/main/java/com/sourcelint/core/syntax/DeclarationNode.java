package com.sourcelint.core.syntax;

import java.util.Objects;
import java.util.Optional;

/**
 * Declaration (function, method, type, variable).
 *
 * @param id arena index
 * @param kind declaration kind
 * @param declaredName declared name as reported by the parser, may be null
 * @param range byte range of the whole declaration
 * @param bodyRange byte range inside the braces, may be null
 */
public record DeclarationNode(
    int id,
    SyntaxKind kind,
    String declaredName,
    ByteRange range,
    ByteRange bodyRange
) implements SyntaxNode {

    public DeclarationNode {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(range, "range must not be null");
        if (kind.category() != SyntaxKind.Category.DECLARATION) {
            throw new IllegalArgumentException("Not a declaration kind: " + kind);
        }
    }

    @Override
    public Optional<String> name() {
        return Optional.ofNullable(declaredName);
    }

    @Override
    public Optional<ByteRange> body() {
        return Optional.ofNullable(bodyRange);
    }
}
