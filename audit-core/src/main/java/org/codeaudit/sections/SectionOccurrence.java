package org.codeaudit.sections;

/**
 * An existing section label line.
 *
 * @param lineIndex     0-based line index
 * @param rawLabelText  the line as written
 * @param canonicalName the label phrase without indentation, comment marker or decoration
 */
public record SectionOccurrence(int lineIndex, String rawLabelText, SectionName canonicalName) {
}
