package com.sourcelint.core.report.impl;

import com.sourcelint.core.model.Violation;
import com.sourcelint.core.report.ViolationReporter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reports violations in the compiler-diagnostic format IDEs pick up:
 * {@code path:line:character: warning: Rule Name Violation: reason (rule_id)}.
 */
public class XcodeReporter implements ViolationReporter {

    @Override
    public String getId() {
        return "xcode";
    }

    @Override
    public String getDescription() {
        return "Reports violations in the format Xcode uses to display in the IDE (default)";
    }

    @Override
    public String generateReport(List<Violation> violations) {
        return violations.stream()
            .map(XcodeReporter::format)
            .collect(Collectors.joining("\n"));
    }

    static String format(Violation violation) {
        return violation.location().describe() + ": "
            + violation.severity().identifier() + ": "
            + violation.ruleName() + " Violation: "
            + violation.reason()
            + " (" + violation.ruleId() + ")";
    }
}
