package com.sourcelint.core.syntax;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Call expression, e.g. {@code UIColor(white: 0.5, alpha: 1)}.
 *
 * @param id arena index
 * @param callee called name ({@code UIColor}, {@code UIColor.init}), may be null
 * @param range byte range of the whole call
 * @param bodyRange byte range between the parentheses, may be null
 * @param arguments arguments in source order
 */
public record CallNode(
    int id,
    String callee,
    ByteRange range,
    ByteRange bodyRange,
    List<CallArgument> arguments
) implements SyntaxNode {

    public CallNode {
        Objects.requireNonNull(range, "range must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CALL;
    }

    @Override
    public Optional<String> name() {
        return Optional.ofNullable(callee);
    }

    @Override
    public Optional<ByteRange> body() {
        return Optional.ofNullable(bodyRange);
    }
}
