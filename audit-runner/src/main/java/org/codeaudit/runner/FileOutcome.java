package org.codeaudit.runner;

import org.codeaudit.sections.SectionName;

import java.nio.file.Path;
import java.util.List;

/**
 * What the fix run did to one file.
 */
public sealed interface FileOutcome {

    Path file();

    /**
     * Labels were inserted and the file was rewritten.
     */
    record Written(Path file, List<SectionName> sections) implements FileOutcome {
        public Written {
            sections = List.copyOf(sections);
        }
    }

    /**
     * Preview of the changes; the file was not touched.
     */
    record Previewed(Path file, String preview) implements FileOutcome {}

    /**
     * Nothing to do for the file.
     */
    record Unchanged(Path file, String reason) implements FileOutcome {}

    /**
     * The file could not be read or written.
     */
    record IoFailure(Path file, String message) implements FileOutcome {}
}
