package com.sourcelint.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up {@link ViolationReporter}s registered via {@link ServiceLoader}.
 */
public final class ReporterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReporterRegistry.class);

    /**
     * Reporter used when none is configured.
     */
    public static final String DEFAULT_REPORTER = "xcode";

    private ReporterRegistry() {
        // Utility class
    }

    public static List<ViolationReporter> discoverAll() {
        return ServiceLoader.load(ViolationReporter.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(ViolationReporter::getId))
            .toList();
    }

    /**
     * Finds a reporter by id; a null id selects {@link #DEFAULT_REPORTER}.
     *
     * @param id reporter id, may be null
     * @return reporter, or empty if no reporter has that id
     */
    public static Optional<ViolationReporter> find(String id) {
        String wanted = id == null ? DEFAULT_REPORTER : id;
        Optional<ViolationReporter> reporter = discoverAll().stream()
            .filter(candidate -> candidate.getId().equals(wanted))
            .findFirst();
        if (reporter.isEmpty()) {
            log.warn("Unknown reporter: {}", wanted);
        }
        return reporter;
    }
}
