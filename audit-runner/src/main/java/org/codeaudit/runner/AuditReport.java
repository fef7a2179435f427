package org.codeaudit.runner;

import org.codeaudit.lint.Violation;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Result of auditing a set of files.
 *
 * @param filesAnalyzed number of files read and checked
 * @param violations    violations in file order, then rule order
 * @param unreadable    files that could not be read, with the reason
 */
public record AuditReport(int filesAnalyzed, List<Violation> violations, Map<Path, String> unreadable) {

    public AuditReport {
        violations = List.copyOf(violations);
        unreadable = Map.copyOf(unreadable);
    }

    /**
     * Whether any violation is an error; a strict run fails on this.
     */
    public boolean hasErrors() {
        return violations.stream()
                         .anyMatch(Violation::isError);
    }

    public ViolationSummary summary() {
        return ViolationSummary.violationSummary(violations);
    }

    public List<Violation> violationsOf(String ruleId) {
        return violations.stream()
                         .filter(violation -> violation.rule()
                                                       .equals(ruleId))
                         .toList();
    }
}
