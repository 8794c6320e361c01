package com.sourcelint.core.syntax;

import java.util.Optional;

/**
 * A node of a parsed syntax tree.
 *
 * <p>Nodes are immutable and carry no child references; children are resolved
 * through the owning {@link SyntaxTree} by {@link #id()}. The variants are
 * {@link CallNode}, {@link DeclarationNode}, {@link StatementNode} and
 * {@link OtherNode}, each holding only the fields relevant to its kind.
 */
public interface SyntaxNode {

    /**
     * Returns the index of this node in its tree's arena.
     *
     * @return node id
     */
    int id();

    SyntaxKind kind();

    /**
     * Returns the callee or declaration name, if the parser reported one.
     *
     * @return optional name
     */
    Optional<String> name();

    /**
     * Returns the byte range of the whole construct.
     *
     * @return node range
     */
    ByteRange range();

    /**
     * Returns the brace-delimited body range, if the construct has one.
     *
     * @return optional body range
     */
    Optional<ByteRange> body();

    default int offset() {
        return range().offset();
    }
}
