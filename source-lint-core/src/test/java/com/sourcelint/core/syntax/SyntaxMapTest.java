package com.sourcelint.core.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SyntaxMap}.
 */
class SyntaxMapTest {

    // UIImage(named: "a\(b)")
    private final SyntaxMap interpolated = SyntaxMap.of(List.of(
        SyntaxToken.of(TokenKind.IDENTIFIER, 18, 1),
        SyntaxToken.of(TokenKind.TYPE_IDENTIFIER, 0, 7),
        SyntaxToken.of(TokenKind.IDENTIFIER, 8, 5),
        SyntaxToken.of(TokenKind.STRING, 15, 2),
        SyntaxToken.of(TokenKind.STRING_INTERPOLATION_ANCHOR, 17, 1),
        SyntaxToken.of(TokenKind.STRING_INTERPOLATION_ANCHOR, 19, 1),
        SyntaxToken.of(TokenKind.STRING, 20, 1)
    ));

    @Test
    void of_sortsTokensByOffset() {
        assertThat(interpolated.tokens()).extracting(token -> token.range().offset())
            .containsExactly(0, 8, 15, 17, 18, 19, 20);
    }

    @Test
    void kindsIn_returnsAllOverlappingKinds() {
        assertThat(interpolated.kindsIn(ByteRange.of(15, 6))).containsExactlyInAnyOrder(
            TokenKind.STRING, TokenKind.STRING_INTERPOLATION_ANCHOR, TokenKind.IDENTIFIER);
        assertThat(interpolated.kindsIn(ByteRange.of(15, 2))).containsExactly(TokenKind.STRING);
    }

    @Test
    void tokensIn_excludesAdjacentTokens() {
        assertThat(interpolated.tokensIn(ByteRange.of(13, 2))).isEmpty();
        assertThat(interpolated.tokensIn(ByteRange.of(6, 3))).extracting(SyntaxToken::kind)
            .containsExactly(TokenKind.TYPE_IDENTIFIER, TokenKind.IDENTIFIER);
    }

    @Test
    void kindsIn_emptyMap_returnsEmptySet() {
        assertThat(SyntaxMap.empty().kindsIn(ByteRange.of(0, 100))).isEmpty();
    }
}
