package org.codeaudit.lint;

import java.util.OptionalInt;

/**
 * A problem found by a rule in one file. Immutable once created.
 *
 * @param message  short title, optionally followed by an indented details block
 * @param file     path of the offending file
 * @param line     1-based line, when the problem has a position
 * @param severity warning or error
 * @param rule     id of the rule that produced it
 */
public record Violation(String message, String file, OptionalInt line, Severity severity, String rule) {

    public static Violation violation(String message, String file, Severity severity, String rule) {
        return new Violation(message, file, OptionalInt.empty(), severity, rule);
    }

    public static Violation violation(String message, String file, int line, Severity severity, String rule) {
        return new Violation(message, file, OptionalInt.of(line), severity, rule);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * First line of the message.
     */
    public String title() {
        var newline = message.indexOf('\n');
        return newline < 0
               ? message
               : message.substring(0, newline);
    }
}
