package org.codeaudit.sections;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which section labels a file needs, from what it actually declares.
 *
 * All methods are pure: the same inputs always give the same ordered output.
 */
public final class RequirementResolver {

    private RequirementResolver() {}

    /**
     * Required sections whose category has at least one declaration. Order follows
     * {@code required}, duplicates are dropped, unknown names never qualify.
     */
    public static List<SectionName> applicable(Set<FunctionCategory> observed, Collection<SectionName> required) {
        return new LinkedHashSet<>(required).stream()
                                            .filter(name -> name.category()
                                                                .isSectioned())
                                            .filter(name -> observed.contains(name.category()))
                                            .toList();
    }

    /**
     * Applicable sections without a label in the file.
     */
    public static List<SectionName> missing(List<SectionName> applicable, Set<SectionName> present) {
        return applicable.stream()
                         .filter(name -> !present.contains(name))
                         .toList();
    }

    /**
     * Sections a fix should (re)create: all applicable ones under force, otherwise only the missing ones.
     */
    public static List<SectionName> toInsert(Classification classification,
                                             Collection<SectionName> requested,
                                             boolean force) {
        var applicable = applicable(classification.observedCategories(), requested);
        return force
               ? applicable
               : missing(applicable, classification.presentSections());
    }
}
