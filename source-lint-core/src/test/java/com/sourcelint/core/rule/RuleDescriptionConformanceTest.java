package com.sourcelint.core.rule;

import com.sourcelint.core.model.Location;
import com.sourcelint.core.model.RuleDescription;
import com.sourcelint.core.model.Violation;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs every rule against the examples in its own description.
 *
 * <p>Non-triggering examples must produce no violation. Triggering examples must
 * produce exactly one per marker, at the marked offset, or a single one when the
 * example carries no marker.
 */
class RuleDescriptionConformanceTest {

    static Stream<Arguments> nonTriggeringExamples() {
        return RuleRegistry.discoverAll().stream()
            .flatMap(rule -> rule.getDescription().nonTriggeringExamples().stream()
                .map(example -> Arguments.of(rule.getId(), example)));
    }

    static Stream<Arguments> triggeringExamples() {
        return RuleRegistry.discoverAll().stream()
            .flatMap(rule -> rule.getDescription().triggeringExamples().stream()
                .map(example -> Arguments.of(rule.getId(), example)));
    }

    @ParameterizedTest(name = "{0}: {1}")
    @MethodSource("nonTriggeringExamples")
    void nonTriggeringExample_producesNoViolation(String ruleId, String example) {
        List<Violation> violations = validate(ruleId, SwiftSnippet.parse(example));

        assertThat(violations).isEmpty();
    }

    @ParameterizedTest(name = "{0}: {1}")
    @MethodSource("triggeringExamples")
    void triggeringExample_producesViolationAtMarker(String ruleId, String example) {
        SwiftSnippet snippet = SwiftSnippet.parse(example);

        List<Violation> violations = validate(ruleId, snippet);

        assertThat(violations).isNotEmpty().allMatch(violation -> violation.ruleId().equals(ruleId));
        if (example.contains(RuleDescription.MARKER)) {
            assertThat(violations)
                .extracting(Violation::location)
                .extracting(Location::byteOffset)
                .containsExactlyElementsOf(snippet.markers());
        } else {
            assertThat(violations).hasSize(1);
        }
    }

    private static List<Violation> validate(String ruleId, SwiftSnippet snippet) {
        Rule rule = RuleRegistry.discoverAll().stream()
            .filter(candidate -> candidate.getId().equals(ruleId))
            .findFirst()
            .orElseThrow();
        return rule.validate(snippet.context());
    }
}
