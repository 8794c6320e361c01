package com.sourcelint.core.rule;

import com.sourcelint.core.model.Violation;
import com.sourcelint.core.syntax.SyntaxKind;
import com.sourcelint.core.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A rule evaluated at individual syntax tree nodes.
 *
 * <p>The lint engine walks each tree once and calls {@link #validate(LintContext, SyntaxNode)}
 * for every node whose kind is in {@link #getKinds()}. Calling {@link #validate(LintContext)}
 * directly performs the same walk for this rule alone.
 */
public interface AstRule extends Rule {

    /**
     * Returns the node kinds this rule is invoked for.
     *
     * @return node kinds
     */
    Set<SyntaxKind> getKinds();

    /**
     * Validates a single node.
     *
     * @param context file context
     * @param node node of one of {@link #getKinds()}
     * @return violations for this node, empty if none
     */
    List<Violation> validate(LintContext context, SyntaxNode node);

    @Override
    default List<Violation> validate(LintContext context) {
        Set<SyntaxKind> kinds = getKinds();
        List<Violation> violations = new ArrayList<>();
        for (SyntaxNode node : context.tree().preorder()) {
            if (kinds.contains(node.kind())) {
                violations.addAll(validate(context, node));
            }
        }
        return violations;
    }
}
