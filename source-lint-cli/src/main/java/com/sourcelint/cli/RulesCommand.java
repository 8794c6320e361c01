package com.sourcelint.cli;

import com.sourcelint.core.model.RuleDescription;
import com.sourcelint.core.rule.ConfigurableRule;
import com.sourcelint.core.rule.Rule;
import com.sourcelint.core.rule.RuleRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to list available rules or describe a single rule.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all rules
 * sourcelint rules
 *
 * # Show description and examples of one rule
 * sourcelint rules line_length
 * }</pre>
 */
@Command(
    name = "rules",
    description = "List available rules or describe one rule",
    mixinStandardHelpOptions = true
)
public class RulesCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Rule identifier to describe"
    )
    private String ruleId;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<Rule> rules = RuleRegistry.discoverAll();

        if (ruleId == null) {
            listRules(rules, out);
            return 0;
        }

        Optional<Rule> rule = rules.stream().filter(candidate -> candidate.getId().equals(ruleId)).findFirst();
        if (rule.isEmpty()) {
            spec.commandLine().getErr().println("✗ Unknown rule: " + ruleId);
            return 1;
        }
        describeRule(rule.get(), out);
        return 0;
    }

    private void listRules(List<Rule> rules, PrintWriter out) {
        out.println("Available Rules:");
        out.println();

        if (rules.isEmpty()) {
            out.println("  No rules found.");
            return;
        }

        for (Rule rule : rules) {
            out.printf("  • %s (ID: %s)%n", rule.getDescription().name(), rule.getId());
            out.printf("    Opt-in: %s%n", rule.isOptIn() ? "yes" : "no");
            out.printf("    Configuration: %s%n", configurationOf(rule));
            out.println();
        }
    }

    private void describeRule(Rule rule, PrintWriter out) {
        RuleDescription description = rule.getDescription();
        out.printf("%s (%s): %s%n", description.name(), description.identifier(), description.description());
        out.printf("Opt-in: %s%n", rule.isOptIn() ? "yes" : "no");
        out.printf("Default configuration: %s%n", configurationOf(rule));

        out.println();
        out.println("Non Triggering Examples:");
        description.nonTriggeringExamples().forEach(example -> printExample(example, out));

        out.println();
        out.println("Triggering Examples (violation is marked with '" + RuleDescription.MARKER + "'):");
        description.triggeringExamples().forEach(example -> printExample(example, out));
    }

    private static void printExample(String example, PrintWriter out) {
        out.println("---");
        out.println(example.stripTrailing());
    }

    private static String configurationOf(Rule rule) {
        return rule instanceof ConfigurableRule configurable
            ? configurable.getConfigurationDescription()
            : "-";
    }
}
