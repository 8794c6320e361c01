package com.sourcelint.core.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Read-only syntax tree of one source file.
 *
 * <p>Nodes live in a flat arena and refer to their children by index, so the tree
 * can be handed to several rules (and threads) without copying. Trees are built
 * once through {@link Builder} and never change afterwards.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * SyntaxTree.Builder builder = SyntaxTree.builder();
 * int function = builder.addDeclaration(SyntaxTree.ROOT, SyntaxKind.FUNCTION_FREE,
 *     "f()", ByteRange.of(0, 40), ByteRange.of(10, 29));
 * builder.addStatement(function, SyntaxKind.IF, ByteRange.of(12, 10), ByteRange.of(20, 1));
 * SyntaxTree tree = builder.build();
 * }</pre>
 */
public final class SyntaxTree {

    /**
     * Parent id used for top-level nodes.
     */
    public static final int ROOT = -1;

    private static final SyntaxTree EMPTY = new SyntaxTree(List.of(), List.of(), List.of());

    private final List<SyntaxNode> nodes;
    private final List<List<Integer>> children;
    private final List<Integer> roots;

    private SyntaxTree(List<SyntaxNode> nodes, List<List<Integer>> children, List<Integer> roots) {
        this.nodes = nodes;
        this.children = children;
        this.roots = roots;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a tree without nodes, used when no structure is available for a file.
     *
     * @return empty tree
     */
    public static SyntaxTree empty() {
        return EMPTY;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Returns the node stored under the given id.
     *
     * @param id node id
     * @return node
     * @throws IndexOutOfBoundsException if the id does not belong to this tree
     */
    public SyntaxNode node(int id) {
        return nodes.get(id);
    }

    /**
     * Returns the top-level nodes in source order.
     *
     * @return root nodes
     */
    public List<SyntaxNode> roots() {
        return resolve(roots);
    }

    /**
     * Returns the direct children of a node in source order.
     *
     * @param node parent node
     * @return child nodes
     */
    public List<SyntaxNode> children(SyntaxNode node) {
        return resolve(children.get(node.id()));
    }

    /**
     * Returns every node in depth-first pre-order (source order).
     *
     * <p>Uses an explicit stack, so arbitrarily deep nesting is safe.
     *
     * @return nodes in visiting order
     */
    public List<SyntaxNode> preorder() {
        List<SyntaxNode> ordered = new ArrayList<>(nodes.size());
        Deque<Integer> stack = new ArrayDeque<>();
        pushReversed(stack, roots);
        while (!stack.isEmpty()) {
            int id = stack.pop();
            ordered.add(nodes.get(id));
            pushReversed(stack, children.get(id));
        }
        return ordered;
    }

    private List<SyntaxNode> resolve(List<Integer> ids) {
        List<SyntaxNode> resolved = new ArrayList<>(ids.size());
        for (int id : ids) {
            resolved.add(nodes.get(id));
        }
        return Collections.unmodifiableList(resolved);
    }

    private static void pushReversed(Deque<Integer> stack, List<Integer> ids) {
        for (int i = ids.size() - 1; i >= 0; i--) {
            stack.push(ids.get(i));
        }
    }

    /**
     * Incremental builder. Parents must be added before their children, which
     * matches the order a parser or structure reader produces them in.
     */
    public static final class Builder {

        private final List<SyntaxNode> nodes = new ArrayList<>();
        private final List<List<Integer>> children = new ArrayList<>();
        private final List<Integer> roots = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a node, choosing the variant from the kind's category.
         *
         * @param parent parent id or {@link #ROOT}
         * @param kind resolved kind
         * @param rawKind identifier reported by the parser (kept for {@link SyntaxKind#OTHER})
         * @param name optional name
         * @param range node range
         * @param body optional body range
         * @param arguments call arguments, ignored for non-call kinds
         * @return id of the new node
         */
        public int add(int parent, SyntaxKind kind, String rawKind, String name,
                       ByteRange range, ByteRange body, List<CallArgument> arguments) {
            if (kind == SyntaxKind.CALL) {
                return addCall(parent, name, range, body, arguments);
            }
            return switch (kind.category()) {
                case DECLARATION -> addDeclaration(parent, kind, name, range, body);
                case STATEMENT -> addStatement(parent, kind, range, body);
                case EXPRESSION, OTHER -> addOther(parent, kind, rawKind, name, range, body);
            };
        }

        public int addCall(int parent, String name, ByteRange range, ByteRange body, List<CallArgument> arguments) {
            return append(parent, new CallNode(nodes.size(), name, range, body, arguments));
        }

        public int addDeclaration(int parent, SyntaxKind kind, String name, ByteRange range, ByteRange body) {
            return append(parent, new DeclarationNode(nodes.size(), kind, name, range, body));
        }

        public int addStatement(int parent, SyntaxKind kind, ByteRange range, ByteRange body) {
            return append(parent, new StatementNode(nodes.size(), kind, range, body));
        }

        public int addOther(int parent, SyntaxKind kind, String rawKind, String name, ByteRange range, ByteRange body) {
            return append(parent, new OtherNode(nodes.size(), kind, rawKind, name, range, body));
        }

        private int append(int parent, SyntaxNode node) {
            Objects.requireNonNull(node, "node must not be null");
            if (parent != ROOT && (parent < 0 || parent >= nodes.size())) {
                throw new IllegalArgumentException("Unknown parent id: " + parent);
            }
            int id = node.id();
            nodes.add(node);
            children.add(new ArrayList<>());
            if (parent == ROOT) {
                roots.add(id);
            } else {
                children.get(parent).add(id);
            }
            return id;
        }

        public SyntaxTree build() {
            List<List<Integer>> frozen = new ArrayList<>(children.size());
            for (List<Integer> ids : children) {
                frozen.add(List.copyOf(ids));
            }
            return new SyntaxTree(List.copyOf(nodes), List.copyOf(frozen), List.copyOf(roots));
        }
    }
}
