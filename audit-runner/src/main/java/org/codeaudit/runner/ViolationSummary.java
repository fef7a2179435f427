package org.codeaudit.runner;

import org.codeaudit.lint.Violation;

import java.util.List;

/**
 * Counts of violations by severity.
 */
public record ViolationSummary(int errors, int warnings, int total) {

    public static ViolationSummary violationSummary(List<Violation> violations) {
        var errors = (int) violations.stream()
                                     .filter(Violation::isError)
                                     .count();
        return new ViolationSummary(errors, violations.size() - errors, violations.size());
    }
}
