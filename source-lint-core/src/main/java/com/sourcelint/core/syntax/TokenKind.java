package com.sourcelint.core.syntax;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lexical classification of a source span, as reported in a syntax map.
 */
public enum TokenKind {
    ATTRIBUTE_BUILTIN("source.lang.swift.syntaxtype.attribute.builtin"),
    ATTRIBUTE_ID("source.lang.swift.syntaxtype.attribute.id"),
    BUILDCONFIG_ID("source.lang.swift.syntaxtype.buildconfig.id"),
    BUILDCONFIG_KEYWORD("source.lang.swift.syntaxtype.buildconfig.keyword"),
    COMMENT("source.lang.swift.syntaxtype.comment"),
    COMMENT_MARK("source.lang.swift.syntaxtype.comment.mark"),
    COMMENT_URL("source.lang.swift.syntaxtype.comment.url"),
    DOC_COMMENT("source.lang.swift.syntaxtype.doccomment"),
    DOC_COMMENT_FIELD("source.lang.swift.syntaxtype.doccomment.field"),
    IDENTIFIER("source.lang.swift.syntaxtype.identifier"),
    KEYWORD("source.lang.swift.syntaxtype.keyword"),
    NUMBER("source.lang.swift.syntaxtype.number"),
    OBJECT_LITERAL("source.lang.swift.syntaxtype.objectliteral"),
    PLACEHOLDER("source.lang.swift.syntaxtype.placeholder"),
    STRING("source.lang.swift.syntaxtype.string"),
    STRING_INTERPOLATION_ANCHOR("source.lang.swift.syntaxtype.string_interpolation_anchor"),
    TYPE_IDENTIFIER("source.lang.swift.syntaxtype.typeidentifier"),
    OTHER("");

    private static final Map<String, TokenKind> BY_IDENTIFIER = Arrays.stream(values())
        .filter(kind -> kind != OTHER)
        .collect(Collectors.toMap(TokenKind::identifier, Function.identity()));

    private final String identifier;

    TokenKind(String identifier) {
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }

    /**
     * Resolves a syntax-map type identifier.
     *
     * @param identifier identifier, may be null
     * @return matching kind or {@link #OTHER}
     */
    public static TokenKind fromIdentifier(String identifier) {
        if (identifier == null) {
            return OTHER;
        }
        return BY_IDENTIFIER.getOrDefault(identifier, OTHER);
    }
}
