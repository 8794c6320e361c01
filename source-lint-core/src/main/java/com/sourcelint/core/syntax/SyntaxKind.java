package com.sourcelint.core.syntax;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of syntax node kinds consumed by the rules.
 *
 * <p>Each constant carries the SourceKit identifier it is read from so that
 * structure dumps produced by {@code sourcekitten structure} map directly onto
 * the model. Identifiers the rules never look at collapse into {@link #OTHER};
 * the raw identifier is kept on the node itself.
 *
 * @see SyntaxNode
 */
public enum SyntaxKind {

    // Function-like declarations
    FUNCTION_FREE("source.lang.swift.decl.function.free", Category.DECLARATION),
    FUNCTION_METHOD_INSTANCE("source.lang.swift.decl.function.method.instance", Category.DECLARATION),
    FUNCTION_METHOD_CLASS("source.lang.swift.decl.function.method.class", Category.DECLARATION),
    FUNCTION_METHOD_STATIC("source.lang.swift.decl.function.method.static", Category.DECLARATION),
    FUNCTION_CONSTRUCTOR("source.lang.swift.decl.function.constructor", Category.DECLARATION),
    FUNCTION_DESTRUCTOR("source.lang.swift.decl.function.destructor", Category.DECLARATION),
    FUNCTION_SUBSCRIPT("source.lang.swift.decl.function.subscript", Category.DECLARATION),
    FUNCTION_OPERATOR("source.lang.swift.decl.function.operator", Category.DECLARATION),
    FUNCTION_ACCESSOR_GETTER("source.lang.swift.decl.function.accessor.getter", Category.DECLARATION),
    FUNCTION_ACCESSOR_SETTER("source.lang.swift.decl.function.accessor.setter", Category.DECLARATION),
    FUNCTION_ACCESSOR_WILLSET("source.lang.swift.decl.function.accessor.willset", Category.DECLARATION),
    FUNCTION_ACCESSOR_DIDSET("source.lang.swift.decl.function.accessor.didset", Category.DECLARATION),
    FUNCTION_ACCESSOR_ADDRESS("source.lang.swift.decl.function.accessor.address", Category.DECLARATION),
    FUNCTION_ACCESSOR_MUTABLEADDRESS("source.lang.swift.decl.function.accessor.mutableaddress", Category.DECLARATION),

    // Other declarations the engine distinguishes
    CLASS("source.lang.swift.decl.class", Category.DECLARATION),
    STRUCT("source.lang.swift.decl.struct", Category.DECLARATION),
    ENUM("source.lang.swift.decl.enum", Category.DECLARATION),
    PROTOCOL("source.lang.swift.decl.protocol", Category.DECLARATION),
    EXTENSION("source.lang.swift.decl.extension", Category.DECLARATION),
    VAR_INSTANCE("source.lang.swift.decl.var.instance", Category.DECLARATION),
    VAR_LOCAL("source.lang.swift.decl.var.local", Category.DECLARATION),
    VAR_GLOBAL("source.lang.swift.decl.var.global", Category.DECLARATION),

    // Statements
    BRACE("source.lang.swift.stmt.brace", Category.STATEMENT),
    IF("source.lang.swift.stmt.if", Category.STATEMENT),
    GUARD("source.lang.swift.stmt.guard", Category.STATEMENT),
    FOR("source.lang.swift.stmt.for", Category.STATEMENT),
    FOR_EACH("source.lang.swift.stmt.foreach", Category.STATEMENT),
    WHILE("source.lang.swift.stmt.while", Category.STATEMENT),
    REPEAT_WHILE("source.lang.swift.stmt.repeatwhile", Category.STATEMENT),
    SWITCH("source.lang.swift.stmt.switch", Category.STATEMENT),
    CASE("source.lang.swift.stmt.case", Category.STATEMENT),

    // Expressions
    CALL("source.lang.swift.expr.call", Category.EXPRESSION),
    ARGUMENT("source.lang.swift.expr.argument", Category.EXPRESSION),
    ARRAY("source.lang.swift.expr.array", Category.EXPRESSION),
    DICTIONARY("source.lang.swift.expr.dictionary", Category.EXPRESSION),
    OBJECT_LITERAL("source.lang.swift.expr.object_literal", Category.EXPRESSION),
    CLOSURE("source.lang.swift.expr.closure", Category.EXPRESSION),

    OTHER("", Category.OTHER);

    /**
     * Broad grouping of kinds, used to pick the node variant.
     */
    public enum Category {
        DECLARATION,
        STATEMENT,
        EXPRESSION,
        OTHER
    }

    private static final Set<SyntaxKind> FUNCTION_KINDS = Set.of(
        FUNCTION_FREE,
        FUNCTION_METHOD_INSTANCE,
        FUNCTION_METHOD_CLASS,
        FUNCTION_METHOD_STATIC,
        FUNCTION_CONSTRUCTOR,
        FUNCTION_DESTRUCTOR,
        FUNCTION_SUBSCRIPT,
        FUNCTION_OPERATOR,
        FUNCTION_ACCESSOR_GETTER,
        FUNCTION_ACCESSOR_SETTER,
        FUNCTION_ACCESSOR_WILLSET,
        FUNCTION_ACCESSOR_DIDSET,
        FUNCTION_ACCESSOR_ADDRESS,
        FUNCTION_ACCESSOR_MUTABLEADDRESS
    );

    private static final Map<String, SyntaxKind> BY_IDENTIFIER = Arrays.stream(values())
        .filter(kind -> kind != OTHER)
        .collect(Collectors.toMap(SyntaxKind::identifier, Function.identity()));

    private final String identifier;
    private final Category category;

    SyntaxKind(String identifier, Category category) {
        this.identifier = identifier;
        this.category = category;
    }

    /**
     * Returns the SourceKit identifier of this kind ({@code ""} for {@link #OTHER}).
     *
     * @return SourceKit kind identifier
     */
    public String identifier() {
        return identifier;
    }

    public Category category() {
        return category;
    }

    /**
     * Returns true for function and method-like declarations, the only scopes
     * that carry their own complexity.
     *
     * @return true if this kind declares a function-like scope
     */
    public boolean isFunction() {
        return FUNCTION_KINDS.contains(this);
    }

    /**
     * Returns all function-like kinds.
     *
     * @return immutable set of function kinds
     */
    public static Set<SyntaxKind> functionKinds() {
        return FUNCTION_KINDS;
    }

    /**
     * Resolves a SourceKit identifier to a kind.
     *
     * @param identifier SourceKit kind identifier, may be null
     * @return matching kind, or {@link #OTHER} when unknown
     */
    public static SyntaxKind fromIdentifier(String identifier) {
        if (identifier == null) {
            return OTHER;
        }
        return BY_IDENTIFIER.getOrDefault(identifier, OTHER);
    }
}
