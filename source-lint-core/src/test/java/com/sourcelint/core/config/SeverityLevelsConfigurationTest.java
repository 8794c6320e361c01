package com.sourcelint.core.config;

import com.sourcelint.core.model.Severity;
import com.sourcelint.core.model.SeverityThreshold;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SeverityLevelsConfiguration}.
 */
class SeverityLevelsConfigurationTest {

    @ParameterizedTest
    @CsvSource({
        "120, ",
        "121, WARNING",
        "200, WARNING",
        "201, ERROR"
    })
    void firstExceededBy_warningAndError_picksSeverity(int metric, Severity expected) {
        SeverityLevelsConfiguration configuration = SeverityLevelsConfiguration.of(120, 200);

        assertThat(configuration.firstExceededBy(metric).map(SeverityThreshold::severity))
            .isEqualTo(Optional.ofNullable(expected));
    }

    @Test
    void firstExceededBy_metricEqualToThreshold_doesNotViolate() {
        SeverityLevelsConfiguration configuration = SeverityLevelsConfiguration.of(10);

        assertThat(configuration.firstExceededBy(10)).isEmpty();
        assertThat(configuration.firstExceededBy(11)).contains(SeverityThreshold.warning(10));
    }

    @Test
    void firstExceededBy_usesConfiguredOrder() {
        SeverityLevelsConfiguration configuration = new SeverityLevelsConfiguration(List.of(
            SeverityThreshold.warning(10),
            SeverityThreshold.error(20)));

        assertThat(configuration.firstExceededBy(25)).contains(SeverityThreshold.warning(10));
    }

    @Test
    void warning_quotesWarningValueEvenWhenErrorComesFirst() {
        SeverityLevelsConfiguration configuration = SeverityLevelsConfiguration.of(120, 200);

        assertThat(configuration.warning()).isEqualTo(120);
        assertThat(configuration.minimumValue()).isEqualTo(120);
        assertThat(configuration.describe()).isEqualTo("error: 200, warning: 120");
    }

    @Test
    void warning_withoutWarningLevel_fallsBackToFirstThreshold() {
        SeverityLevelsConfiguration configuration = new SeverityLevelsConfiguration(List.of(SeverityThreshold.error(30)));

        assertThat(configuration.warning()).isEqualTo(30);
    }

    @Test
    void constructor_emptyThresholds_throwsException() {
        assertThatThrownBy(() -> new SeverityLevelsConfiguration(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_number_createsWarningOnly() throws RuleConfigurationException {
        assertThat(SeverityLevelsConfiguration.parse("line_length", 150))
            .isEqualTo(SeverityLevelsConfiguration.of(150));
    }

    @Test
    void parse_list_createsWarningAndError() throws RuleConfigurationException {
        assertThat(SeverityLevelsConfiguration.parse("line_length", List.of(150)))
            .isEqualTo(SeverityLevelsConfiguration.of(150));
        assertThat(SeverityLevelsConfiguration.parse("line_length", List.of(150, 180)))
            .isEqualTo(SeverityLevelsConfiguration.of(150, 180));
    }

    @Test
    void parse_map_createsWarningAndError() throws RuleConfigurationException {
        assertThat(SeverityLevelsConfiguration.parse("cyclomatic_complexity", Map.of("warning", 12, "error", 30)))
            .isEqualTo(SeverityLevelsConfiguration.of(12, 30));
        assertThat(SeverityLevelsConfiguration.parse("cyclomatic_complexity", Map.of("warning", 12)))
            .isEqualTo(SeverityLevelsConfiguration.of(12));
    }

    @Test
    void parse_thresholdList_keepsWrittenOrder() throws RuleConfigurationException {
        SeverityLevelsConfiguration configuration = SeverityLevelsConfiguration.parse("line_length", Map.of(
            "thresholds", List.of(
                Map.of("value", 100, "severity", "warning"),
                Map.of("value", 150, "severity", "error"))));

        assertThat(configuration.thresholds()).containsExactly(
            SeverityThreshold.warning(100),
            SeverityThreshold.error(150));
    }

    @Test
    void parse_invalidValues_throwRuleConfigurationException() {
        assertThatThrownBy(() -> SeverityLevelsConfiguration.parse("line_length", "long"))
            .isInstanceOf(RuleConfigurationException.class)
            .hasMessageContaining("Unsupported threshold configuration");
        assertThatThrownBy(() -> SeverityLevelsConfiguration.parse("line_length", List.of(1, 2, 3)))
            .isInstanceOf(RuleConfigurationException.class);
        assertThatThrownBy(() -> SeverityLevelsConfiguration.parse("line_length", Map.of("error", 10)))
            .isInstanceOf(RuleConfigurationException.class)
            .hasMessageContaining("warning");
        assertThatThrownBy(() -> SeverityLevelsConfiguration.parse("line_length",
                Map.of("thresholds", List.of(Map.of("value", 1, "severity", "fatal")))))
            .isInstanceOf(RuleConfigurationException.class)
            .satisfies(e -> assertThat(((RuleConfigurationException) e).getRuleId()).isEqualTo("line_length"));
    }
}
