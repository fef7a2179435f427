package org.codeaudit.sections;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Result of classifying one file: declarations and section labels, both in line order.
 */
public record Classification(List<Declaration> declarations, List<SectionOccurrence> occurrences) {

    private static final Classification EMPTY = new Classification(List.of(), List.of());

    public Classification {
        declarations = List.copyOf(declarations);
        occurrences = List.copyOf(occurrences);
    }

    public static Classification empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return declarations.isEmpty() && occurrences.isEmpty();
    }

    /**
     * Categories with at least one declaration.
     */
    public Set<FunctionCategory> observedCategories() {
        var observed = EnumSet.noneOf(FunctionCategory.class);
        declarations.forEach(declaration -> observed.add(declaration.category()));
        return observed;
    }

    /**
     * Names of the section labels present, in order of first appearance.
     */
    public Set<SectionName> presentSections() {
        var present = new LinkedHashSet<SectionName>();
        occurrences.forEach(occurrence -> present.add(occurrence.canonicalName()));
        return present;
    }

    /**
     * First declaration of the category, by line.
     */
    public Optional<Declaration> firstDeclarationOf(FunctionCategory category) {
        return declarations.stream()
                           .filter(declaration -> declaration.category() == category)
                           .findFirst();
    }

    public List<SectionOccurrence> occurrencesOf(SectionName name) {
        return occurrences.stream()
                          .filter(occurrence -> occurrence.canonicalName()
                                                          .equals(name))
                          .toList();
    }
}
