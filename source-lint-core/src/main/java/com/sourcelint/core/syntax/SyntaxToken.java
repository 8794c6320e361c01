package com.sourcelint.core.syntax;

import java.util.Objects;

/**
 * One classified token of a syntax map.
 *
 * @param kind token kind
 * @param range byte range of the token
 */
public record SyntaxToken(TokenKind kind, ByteRange range) {

    public SyntaxToken {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(range, "range must not be null");
    }

    public static SyntaxToken of(TokenKind kind, int offset, int length) {
        return new SyntaxToken(kind, ByteRange.of(offset, length));
    }
}
