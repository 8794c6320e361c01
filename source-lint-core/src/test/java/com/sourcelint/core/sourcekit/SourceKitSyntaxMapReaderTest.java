package com.sourcelint.core.sourcekit;

import com.sourcelint.core.syntax.SyntaxMap;
import com.sourcelint.core.syntax.SyntaxToken;
import com.sourcelint.core.syntax.TokenKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SourceKitSyntaxMapReader}.
 */
class SourceKitSyntaxMapReaderTest {

    private final SourceKitSyntaxMapReader reader = new SourceKitSyntaxMapReader();

    @Test
    void read_tokens_resolvesKinds() throws SyntaxReadException {
        SyntaxMap map = reader.read("""
            [
              { "offset": 27, "length": 5, "type": "source.lang.swift.syntaxtype.string" },
              { "offset": 0, "length": 3, "type": "source.lang.swift.syntaxtype.keyword" },
              { "offset": 4, "length": 5, "type": "source.lang.swift.syntaxtype.identifier" },
              { "offset": 12, "length": 1, "type": "source.lang.swift.syntaxtype.pound_directive" }
            ]
            """);

        assertThat(map.tokens()).containsExactly(
            SyntaxToken.of(TokenKind.KEYWORD, 0, 3),
            SyntaxToken.of(TokenKind.IDENTIFIER, 4, 5),
            SyntaxToken.of(TokenKind.OTHER, 12, 1),
            SyntaxToken.of(TokenKind.STRING, 27, 5));
    }

    @Test
    void read_malformedEntries_areSkipped() throws SyntaxReadException {
        SyntaxMap map = reader.read("""
            [
              { "length": 5, "type": "source.lang.swift.syntaxtype.string" },
              { "offset": -1, "length": 5, "type": "source.lang.swift.syntaxtype.string" },
              { "offset": "3", "length": 1, "type": "source.lang.swift.syntaxtype.number" },
              { "offset": 8, "length": 1, "type": "source.lang.swift.syntaxtype.number" }
            ]
            """);

        assertThat(map.tokens()).containsExactly(SyntaxToken.of(TokenKind.NUMBER, 8, 1));
    }

    @Test
    void read_nonArrayRoot_throwsException() {
        assertThatThrownBy(() -> reader.read("{}"))
            .isInstanceOf(SyntaxReadException.class)
            .hasMessageContaining("JSON array");
    }
}
