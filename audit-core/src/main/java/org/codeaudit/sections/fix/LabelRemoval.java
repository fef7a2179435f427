package org.codeaudit.sections.fix;

import org.codeaudit.sections.SectionOccurrence;

/**
 * An existing label that force mode replaces with a freshly rendered one.
 */
public record LabelRemoval(SectionOccurrence occurrence) {

    public int lineIndex() {
        return occurrence.lineIndex();
    }
}
