package org.codeaudit.sections.fix;

import org.codeaudit.sections.SectionName;

import java.util.List;

/**
 * Recoverable reasons a fix produced no new text. None of them is an I/O failure.
 */
public sealed interface FixError {

    String message();

    /**
     * Every applicable section already carries a label and force was not requested.
     */
    record SectionsAlreadyPresent() implements FixError {
        @Override
        public String message() {
            return "All required sections already exist. Use --force to recreate them.";
        }
    }

    /**
     * None of the requested sections has a declaration of its category in the file.
     */
    record NoMatchingDeclarations(List<SectionName> requested) implements FixError {
        public NoMatchingDeclarations {
            requested = List.copyOf(requested);
        }

        @Override
        public String message() {
            return "Nothing to add - the file declares no functions for sections " + requested + ".";
        }
    }
}
