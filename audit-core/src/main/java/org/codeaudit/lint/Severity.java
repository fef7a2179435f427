package org.codeaudit.lint;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a violation.
 */
public enum Severity {
    WARNING,
    ERROR;

    /**
     * Parse a configured level such as {@code "warning"} or {@code ":error"}.
     */
    public static Optional<Severity> parse(String value) {
        var normalized = value.trim()
                              .replaceFirst("^:", "")
                              .toUpperCase(Locale.ROOT);
        for (var severity : values()) {
            if (severity.name()
                        .equals(normalized)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
