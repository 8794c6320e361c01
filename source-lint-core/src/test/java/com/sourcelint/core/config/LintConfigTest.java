package com.sourcelint.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LintConfig}.
 */
class LintConfigTest {

    @Test
    void isEnabled_defaults_enablesOnlyNonOptInRules() {
        LintConfig config = LintConfig.defaults();

        assertThat(config.isEnabled("line_length", false)).isTrue();
        assertThat(config.isEnabled("object_literal", true)).isFalse();
    }

    @Test
    void isEnabled_disabledAndOptInLists() {
        LintConfig config = new LintConfig(List.of("line_length"), List.of("object_literal"),
            List.of(), List.of(), List.of(), null, Map.of());

        assertThat(config.isEnabled("line_length", false)).isFalse();
        assertThat(config.isEnabled("object_literal", true)).isTrue();
        assertThat(config.isEnabled("cyclomatic_complexity", false)).isTrue();
    }

    @Test
    void isEnabled_onlyRules_overridesOtherLists() {
        LintConfig config = new LintConfig(List.of("object_literal"), List.of(),
            List.of("object_literal"), List.of(), List.of(), null, Map.of());

        assertThat(config.isEnabled("object_literal", true)).isTrue();
        assertThat(config.isEnabled("line_length", false)).isFalse();
    }

    @Test
    void referencedRuleIds_collectsListsAndEntries() {
        LintConfig config = new LintConfig(List.of("b"), List.of("c"), List.of("a"),
            List.of(), List.of(), null, Map.of("d", 1));

        assertThat(config.referencedRuleIds()).containsExactly("a", "b", "c", "d");
    }
}
