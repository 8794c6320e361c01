package com.sourcelint.core.rule.impl.idiomatic;

import com.sourcelint.core.config.RuleConfigurationException;
import com.sourcelint.core.config.SeverityConfiguration;
import com.sourcelint.core.model.RuleDescription;
import com.sourcelint.core.model.Violation;
import com.sourcelint.core.rule.AstRule;
import com.sourcelint.core.rule.ConfigurableRule;
import com.sourcelint.core.rule.LintContext;
import com.sourcelint.core.rule.OptInRule;
import com.sourcelint.core.rule.base.AbstractRule;
import com.sourcelint.core.syntax.CallArgument;
import com.sourcelint.core.syntax.CallNode;
import com.sourcelint.core.syntax.SyntaxKind;
import com.sourcelint.core.syntax.SyntaxNode;
import com.sourcelint.core.syntax.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Flags image and color initializers that have an object-literal equivalent.
 *
 * <p>Matches two call shapes:
 * <ul>
 *   <li>{@code UIImage(named: "foo")} / {@code NSImage.init(named: "foo")} where the single
 *       {@code named:} argument consists of string-literal tokens only</li>
 *   <li>{@code UIColor(red:green:blue:alpha:)} and {@code UIColor(white:alpha:)} (and the
 *       {@code NSColor} / {@code .init} forms) where every argument consists of number tokens only</li>
 * </ul>
 *
 * <p>Token kinds are compared as complete sets: an interpolated string yields
 * {@code {string, string_interpolation_anchor, identifier}} and does not match.
 */
public class ObjectLiteralRule extends AbstractRule implements AstRule, ConfigurableRule, OptInRule {

    public static final RuleDescription DESCRIPTION = new RuleDescription(
        "object_literal",
        "Object Literal",
        "Prefer object literals over image and color inits.",
        List.of(
            "let image = #imageLiteral(resourceName: \"image.jpg\")",
            "let color = #colorLiteral(red: 0.9607843161, green: 0.7058823705, blue: 0.200000003, alpha: 1)",
            "let image = UIImage(named: aVariable)",
            "let image = UIImage(named: \"interpolated \\(variable)\")",
            "let color = UIColor(red: value, green: value, blue: value, alpha: 1)",
            "let image = NSImage(named: aVariable)",
            "let image = NSImage(named: \"interpolated \\(variable)\")",
            "let color = NSColor(red: value, green: value, blue: value, alpha: 1)"
        ),
        triggeringExamples()
    );

    private static final Set<String> IMAGE_INITS = initsFor("UIImage", "NSImage");
    private static final Set<String> COLOR_INITS = initsFor("UIColor", "NSColor");
    private static final List<String> IMAGE_ARGUMENTS = List.of("named");
    private static final List<String> RGBA_ARGUMENTS = List.of("red", "green", "blue", "alpha");
    private static final List<String> WHITE_ARGUMENTS = List.of("white", "alpha");

    private SeverityConfiguration configuration = SeverityConfiguration.warning();

    @Override
    public RuleDescription getDescription() {
        return DESCRIPTION;
    }

    @Override
    public Set<SyntaxKind> getKinds() {
        return Set.of(SyntaxKind.CALL);
    }

    @Override
    public List<Violation> validate(LintContext context, SyntaxNode node) {
        if (!(node instanceof CallNode call)) {
            return List.of();
        }
        if (!isImageNamedInit(call, context) && !isColorInit(call, context)) {
            return List.of();
        }
        log.debug("Object literal candidate {} at offset {}", call.callee(), call.offset());
        return List.of(violation(configuration.severity(), context.locationAt(call.offset())));
    }

    @Override
    public void applyConfiguration(Object raw) throws RuleConfigurationException {
        configuration = SeverityConfiguration.parse(getId(), raw);
    }

    @Override
    public String getConfigurationDescription() {
        return configuration.describe();
    }

    public SeverityConfiguration getConfiguration() {
        return configuration;
    }

    private boolean isImageNamedInit(CallNode call, LintContext context) {
        if (call.name().filter(IMAGE_INITS::contains).isEmpty()
                || !argumentNames(call).equals(IMAGE_ARGUMENTS)) {
            return false;
        }
        return kindsFor(call.arguments().get(0), context).equals(Set.of(TokenKind.STRING));
    }

    private boolean isColorInit(CallNode call, LintContext context) {
        if (call.name().filter(COLOR_INITS::contains).isEmpty()) {
            return false;
        }
        List<String> names = argumentNames(call);
        if (!names.equals(RGBA_ARGUMENTS) && !names.equals(WHITE_ARGUMENTS)) {
            return false;
        }
        return call.arguments().stream()
            .allMatch(argument -> kindsFor(argument, context).equals(Set.of(TokenKind.NUMBER)));
    }

    /**
     * Returns the argument labels in order; an unlabelled argument yields {@code null}
     * so that it can never equal one of the expected label lists.
     */
    private static List<String> argumentNames(CallNode call) {
        List<String> names = new ArrayList<>(call.arguments().size());
        for (CallArgument argument : call.arguments()) {
            names.add(argument.name());
        }
        return names;
    }

    private static Set<TokenKind> kindsFor(CallArgument argument, LintContext context) {
        return argument.valueRange()
            .map(range -> context.syntaxMap().kindsIn(range))
            .orElse(Set.of());
    }

    private static Set<String> initsFor(String... typeNames) {
        return Stream.of(typeNames)
            .flatMap(name -> Stream.of(name, name + ".init"))
            .collect(Collectors.toUnmodifiableSet());
    }

    private static List<String> triggeringExamples() {
        List<String> examples = new ArrayList<>();
        for (String method : List.of("", ".init")) {
            for (String prefix : List.of("UI", "NS")) {
                examples.add("let image = ↓" + prefix + "Image" + method + "(named: \"foo\")");
                examples.add("let color = ↓" + prefix + "Color" + method
                    + "(red: 0.3, green: 0.3, blue: 0.3, alpha: 1)");
                examples.add("let color = ↓" + prefix + "Color" + method
                    + "(red: 100 / 255.0, green: 50 / 255.0, blue: 0, alpha: 1)");
                examples.add("let color = ↓" + prefix + "Color" + method + "(white: 0.5, alpha: 1)");
            }
        }
        return examples;
    }
}
