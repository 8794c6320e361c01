package com.sourcelint.core.rule.impl.metrics;

import com.sourcelint.core.config.RuleConfigurationException;
import com.sourcelint.core.config.SeverityLevelsConfiguration;
import com.sourcelint.core.model.RuleDescription;
import com.sourcelint.core.model.SeverityThreshold;
import com.sourcelint.core.model.Violation;
import com.sourcelint.core.rule.AstRule;
import com.sourcelint.core.rule.ConfigurableRule;
import com.sourcelint.core.rule.LintContext;
import com.sourcelint.core.rule.base.AbstractRule;
import com.sourcelint.core.syntax.SyntaxKind;
import com.sourcelint.core.syntax.SyntaxNode;
import com.sourcelint.core.syntax.SyntaxTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Limits the cyclomatic complexity of function bodies.
 *
 * <p>The score of a function is the number of branch-bearing statements
 * ({@code if}, {@code guard}, {@code for}, {@code for-in}, {@code while},
 * {@code repeat-while}, {@code case}) anywhere in its body. Nested function
 * declarations are skipped entirely; they are scored on their own.
 *
 * <p>When the body contains a {@code switch}, every {@code fallthrough} in the body
 * text lowers the score by one, since a falling-through case does not add an
 * independent path.
 */
public class CyclomaticComplexityRule extends AbstractRule implements AstRule, ConfigurableRule {

    public static final RuleDescription DESCRIPTION = new RuleDescription(
        "cyclomatic_complexity",
        "Cyclomatic Complexity",
        "Complexity of function bodies should be limited.",
        List.of(
            "func f1() {\nif true {\nfor _ in 1..5 { } }\nif false { }\n}",
            "func f(code: Int) -> Int {"
                + "switch code {\n case 0: fallthrough\ncase 0: return 1\ncase 0: return 1\n"
                + "case 0: return 1\ncase 0: return 1\ncase 0: return 1\ncase 0: return 1\n"
                + "case 0: return 1\ncase 0: return 1\ndefault: return 1}}",
            "func f1() {"
                + "if true {}; if true {}; if true {}; if true {}; if true {}; if true {}\n"
                + "func f2() {\n"
                + "if true {}; if true {}; if true {}; if true {}; if true {}\n"
                + "}}"
        ),
        List.of(
            "↓func f1() {\n  if true {\n    if true {\n      if false {}\n    }\n"
                + "  }\n  if false {}\n  let i = 0\n\n  switch i {\n  case 1: break\n"
                + "  case 2: break\n  case 3: break\n  case 4: break\n default: break\n  }\n"
                + "  for _ in 1...5 {\n    guard true else {\n      return\n    }\n  }\n}\n"
        )
    );

    private static final Set<SyntaxKind> COMPLEXITY_KINDS = EnumSet.of(
        SyntaxKind.FOR_EACH,
        SyntaxKind.IF,
        SyntaxKind.CASE,
        SyntaxKind.GUARD,
        SyntaxKind.FOR,
        SyntaxKind.REPEAT_WHILE,
        SyntaxKind.WHILE
    );

    private static final String FALLTHROUGH = "fallthrough";

    private SeverityLevelsConfiguration configuration;

    public CyclomaticComplexityRule() {
        this(SeverityLevelsConfiguration.of(10, 20));
    }

    public CyclomaticComplexityRule(SeverityLevelsConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public RuleDescription getDescription() {
        return DESCRIPTION;
    }

    @Override
    public Set<SyntaxKind> getKinds() {
        return SyntaxKind.functionKinds();
    }

    @Override
    public List<Violation> validate(LintContext context, SyntaxNode node) {
        if (!node.kind().isFunction()) {
            return List.of();
        }

        int complexity = measureComplexity(context, node);
        Optional<SeverityThreshold> exceeded = configuration.firstExceededBy(complexity);
        if (exceeded.isEmpty()) {
            return List.of();
        }

        log.debug("Function {} has complexity {}", node.name().orElse("<anonymous>"), complexity);
        return List.of(violation(
            exceeded.get().severity(),
            context.locationAt(node.offset()),
            "Function should have complexity " + configuration.warning() + " or less: "
                + "currently complexity equals " + complexity));
    }

    /**
     * Computes the complexity of one function scope.
     *
     * @param context file context
     * @param scope function-like declaration
     * @return complexity score
     */
    public int measureComplexity(LintContext context, SyntaxNode scope) {
        SyntaxTree tree = context.tree();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        pushChildren(stack, tree.children(scope));
        int complexity = 0;
        boolean hasSwitchStatements = false;

        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.kind().isFunction()) {
                continue;
            }
            if (COMPLEXITY_KINDS.contains(node.kind())) {
                complexity++;
            }
            if (node.kind() == SyntaxKind.SWITCH) {
                hasSwitchStatements = true;
            }
            pushChildren(stack, tree.children(node));
        }

        if (hasSwitchStatements) {
            complexity -= countFallthroughs(context, scope);
        }
        return complexity;
    }

    private static void pushChildren(Deque<SyntaxNode> stack, List<SyntaxNode> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    // Scoped to the whole function body, not to the individual switch statements
    private int countFallthroughs(LintContext context, SyntaxNode scope) {
        return scope.body()
            .flatMap(body -> context.file().substring(body))
            .map(CyclomaticComplexityRule::countOccurrences)
            .orElse(0);
    }

    private static int countOccurrences(String text) {
        int count = 0;
        int index = text.indexOf(FALLTHROUGH);
        while (index >= 0) {
            count++;
            index = text.indexOf(FALLTHROUGH, index + FALLTHROUGH.length());
        }
        return count;
    }

    @Override
    public void applyConfiguration(Object raw) throws RuleConfigurationException {
        configuration = SeverityLevelsConfiguration.parse(getId(), raw);
    }

    @Override
    public String getConfigurationDescription() {
        return configuration.describe();
    }

    public SeverityLevelsConfiguration getConfiguration() {
        return configuration;
    }
}
