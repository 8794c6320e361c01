package com.sourcelint.core.syntax;

import java.util.Objects;
import java.util.Optional;

/**
 * Any node the rules do not inspect directly. Still traversed for its children.
 *
 * @param id arena index
 * @param kind resolved kind (an expression kind other than call, or {@link SyntaxKind#OTHER})
 * @param rawKind identifier reported by the parser
 * @param nodeName name reported by the parser, may be null
 * @param range byte range of the node
 * @param bodyRange body range, may be null
 */
public record OtherNode(
    int id,
    SyntaxKind kind,
    String rawKind,
    String nodeName,
    ByteRange range,
    ByteRange bodyRange
) implements SyntaxNode {

    public OtherNode {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(range, "range must not be null");
        if (rawKind == null) {
            rawKind = kind.identifier();
        }
    }

    @Override
    public Optional<String> name() {
        return Optional.ofNullable(nodeName);
    }

    @Override
    public Optional<ByteRange> body() {
        return Optional.ofNullable(bodyRange);
    }
}
