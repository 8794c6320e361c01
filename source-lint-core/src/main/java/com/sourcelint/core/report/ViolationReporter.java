package com.sourcelint.core.report;

import com.sourcelint.core.model.Violation;

import java.util.List;

/**
 * Formats violations for output.
 *
 * <p>Reporters are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sourcelint.core.report.ViolationReporter}
 */
public interface ViolationReporter {

    /**
     * Returns the identifier used to select this reporter (e.g. "xcode", "json").
     *
     * @return reporter identifier
     */
    String getId();

    String getDescription();

    /**
     * Renders the violations of a run.
     *
     * @param violations all violations, in reporting order
     * @return report text
     */
    String generateReport(List<Violation> violations);
}
