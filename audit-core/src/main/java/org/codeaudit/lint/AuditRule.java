package org.codeaudit.lint;

import org.codeaudit.shared.SourceText;

import java.util.List;

/**
 * Interface for audit rules.
 *
 * Each rule checks one file at a time and never performs I/O, so a runner may call it
 * for many files concurrently.
 */
public interface AuditRule {

    /**
     * Get the rule ID (e.g., "live_view_sections").
     */
    String ruleId();

    /**
     * Get a short description of what this rule checks.
     */
    String description();

    /**
     * Check a file and return any violations found.
     *
     * @param filePath path of the file, used for applicability and reporting
     * @param content  the file content
     * @param config   configuration of this rule
     * @return violations, empty when the file is fine or not applicable
     */
    List<Violation> check(String filePath, SourceText content, RuleConfig config);
}
