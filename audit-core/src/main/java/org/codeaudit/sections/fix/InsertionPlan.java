package org.codeaudit.sections.fix;

import org.codeaudit.sections.SectionName;

/**
 * One label to insert immediately before line {@code lineIndex} of the original text.
 *
 * @param lineIndex         0-based index of the first declaration of the section's category
 * @param sectionName       section being labeled
 * @param indentation       leading whitespace copied from the declaration line
 * @param renderedLabelLine full label line, indentation included
 */
public record InsertionPlan(int lineIndex, SectionName sectionName, String indentation, String renderedLabelLine) {
}
