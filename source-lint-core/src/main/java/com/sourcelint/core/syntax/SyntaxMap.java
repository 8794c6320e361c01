package com.sourcelint.core.syntax;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered list of classified tokens covering a source file.
 */
public final class SyntaxMap {

    private static final SyntaxMap EMPTY = new SyntaxMap(List.of());

    private final List<SyntaxToken> tokens;

    private SyntaxMap(List<SyntaxToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * Creates a syntax map; tokens are sorted by offset.
     *
     * @param tokens tokens in any order
     * @return syntax map
     */
    public static SyntaxMap of(List<SyntaxToken> tokens) {
        List<SyntaxToken> sorted = new ArrayList<>(tokens);
        sorted.sort(Comparator.comparingInt(token -> token.range().offset()));
        return new SyntaxMap(List.copyOf(sorted));
    }

    public static SyntaxMap empty() {
        return EMPTY;
    }

    public List<SyntaxToken> tokens() {
        return tokens;
    }

    /**
     * Returns the tokens overlapping the given range, in source order.
     *
     * @param range byte range
     * @return overlapping tokens
     */
    public List<SyntaxToken> tokensIn(ByteRange range) {
        List<SyntaxToken> matching = new ArrayList<>();
        for (SyntaxToken token : tokens) {
            if (token.range().offset() >= range.end()) {
                break;
            }
            if (token.range().intersects(range)) {
                matching.add(token);
            }
        }
        return matching;
    }

    /**
     * Returns the complete set of token kinds overlapping the given range.
     *
     * <p>Callers compare the result by equality: {@code {STRING}} and
     * {@code {STRING, IDENTIFIER}} are different answers.
     *
     * @param range byte range
     * @return token kinds, empty if no token overlaps
     */
    public Set<TokenKind> kindsIn(ByteRange range) {
        Set<TokenKind> kinds = EnumSet.noneOf(TokenKind.class);
        for (SyntaxToken token : tokensIn(range)) {
            kinds.add(token.kind());
        }
        return kinds;
    }
}
