package com.sourcelint.core.rule.impl.metrics;

import com.sourcelint.core.config.RuleConfigurationException;
import com.sourcelint.core.config.SeverityLevelsConfiguration;
import com.sourcelint.core.model.RuleDescription;
import com.sourcelint.core.model.SeverityThreshold;
import com.sourcelint.core.model.Violation;
import com.sourcelint.core.rule.ConfigurableRule;
import com.sourcelint.core.rule.FileRule;
import com.sourcelint.core.rule.LintContext;
import com.sourcelint.core.rule.base.AbstractRule;
import com.sourcelint.core.syntax.Line;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Limits the number of characters per line.
 *
 * <p>Color and image literals ({@code #colorLiteral(...)}, {@code #imageLiteral(...)})
 * render as a single swatch in editors, so each one counts as one character.
 */
public class LineLengthRule extends AbstractRule implements FileRule, ConfigurableRule {

    public static final RuleDescription DESCRIPTION = new RuleDescription(
        "line_length",
        "Line Length",
        "Lines should not span too many characters.",
        List.of(
            "/".repeat(120) + "\n",
            ("#colorLiteral(red: 0.9607843161, green: 0.7058823705, blue: 0.200000003, alpha: 1)").repeat(120)
                + "\n",
            "#imageLiteral(resourceName: \"image.jpg\")".repeat(120) + "\n"
        ),
        List.of(
            "/".repeat(121) + "\n",
            ("#colorLiteral(red: 0.9607843161, green: 0.7058823705, blue: 0.200000003, alpha: 1)").repeat(121)
                + "\n",
            "#imageLiteral(resourceName: \"image.jpg\")".repeat(121) + "\n"
        )
    );

    private static final List<String> LITERAL_DELIMITERS = List.of("#colorLiteral", "#imageLiteral");
    private static final String PLACEHOLDER = "#";
    private static final Pattern GRAPHEME_CLUSTER = Pattern.compile("\\X");

    private SeverityLevelsConfiguration configuration;

    public LineLengthRule() {
        this(SeverityLevelsConfiguration.of(120, 200));
    }

    public LineLengthRule(SeverityLevelsConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public RuleDescription getDescription() {
        return DESCRIPTION;
    }

    @Override
    public List<Violation> validate(LintContext context) {
        int minimum = configuration.minimumValue();
        List<Violation> violations = new ArrayList<>();

        for (Line line : context.file().lines()) {
            // Byte length bounds the character count, so short lines need no masking
            if (line.byteLength() < minimum) {
                continue;
            }

            String stripped = line.content();
            for (String delimiter : LITERAL_DELIMITERS) {
                stripped = stripLiterals(stripped, delimiter);
            }
            int length = characterCount(stripped);

            Optional<SeverityThreshold> exceeded = configuration.firstExceededBy(length);
            if (exceeded.isPresent()) {
                violations.add(violation(
                    exceeded.get().severity(),
                    context.locationAtLine(line.index()),
                    "Line should be " + configuration.warning() + " characters or less: "
                        + "currently " + length + " characters"));
            }
        }
        return violations;
    }

    /**
     * Counts user-perceived characters (extended grapheme clusters), so a base letter
     * followed by combining marks counts once.
     *
     * @param text line text
     * @return number of characters
     */
    static int characterCount(String text) {
        Matcher matcher = GRAPHEME_CLUSTER.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Replaces every {@code delimiter(...)} span with a single placeholder character.
     *
     * <p>The span ends at the first {@code )} after the opening delimiter. An opening
     * delimiter without a closing parenthesis stops the masking for that delimiter.
     *
     * @param source line text
     * @param delimiter literal prefix, e.g. {@code #colorLiteral}
     * @return masked text
     */
    static String stripLiterals(String source, String delimiter) {
        String opening = delimiter + "(";
        String modified = source;
        int start = modified.indexOf(opening);
        while (start >= 0) {
            int end = modified.indexOf(')', start);
            if (end < 0) {
                break;
            }
            modified = modified.substring(0, start) + PLACEHOLDER + modified.substring(end + 1);
            start = modified.indexOf(opening);
        }
        return modified;
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
