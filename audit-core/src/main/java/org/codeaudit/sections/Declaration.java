package org.codeaudit.sections;

/**
 * A {@code def}/{@code defp} line with its category.
 *
 * @param lineIndex   0-based line index
 * @param name        declared function name
 * @param category    category assigned by the ordered detection rules
 * @param indentation exact leading whitespace of the line
 * @param lineEnding  {@code "\r"} for a CRLF line, otherwise empty
 */
public record Declaration(int lineIndex, String name, FunctionCategory category, String indentation, String lineEnding) {
}
