package org.codeaudit.sections.fix;

import org.codeaudit.sections.Classification;
import org.codeaudit.sections.LabelTemplate;
import org.codeaudit.sections.SectionName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes where missing section labels go.
 *
 * A label is placed immediately before the first declaration of its category and copies
 * that line's indentation and line ending. A section whose category has no declaration is dropped: the
 * planner never invents a location.
 */
public final class InsertionPlanner {

    private static final Logger log = LoggerFactory.getLogger(InsertionPlanner.class);

    private final LabelTemplate template;

    private InsertionPlanner(LabelTemplate template) {
        this.template = template;
    }

    public static InsertionPlanner insertionPlanner() {
        return new InsertionPlanner(LabelTemplate.defaultTemplate());
    }

    public static InsertionPlanner insertionPlanner(LabelTemplate template) {
        return new InsertionPlanner(template);
    }

    /**
     * Insertions for the given sections, sorted ascending by line.
     */
    public List<InsertionPlan> planInsertions(Classification classification, Collection<SectionName> sections) {
        var plans = new ArrayList<InsertionPlan>();

        for (var section : new LinkedHashSet<>(sections)) {
            var category = section.category();
            if (!category.isSectioned()) {
                log.debug("Section {} has no category, not planning it", section);
                continue;
            }
            classification.firstDeclarationOf(category)
                          .ifPresentOrElse(declaration -> plans.add(new InsertionPlan(declaration.lineIndex(),
                                                                                      section,
                                                                                      declaration.indentation(),
                                                                                      template.render(declaration.indentation(),
                                                                                                      section)
                                                                                      + declaration.lineEnding())),
                                           () -> log.debug("No {} declaration for section {}, dropping it",
                                                           category,
                                                           section));
        }
        return PatchPlan.insertionsOnly(plans)
                        .insertions();
    }

    /**
     * Full plan. With {@code recreate}, every existing label of a planned section is removed so
     * that exactly one freshly rendered label per section remains.
     */
    public PatchPlan plan(Classification classification, Collection<SectionName> sections, boolean recreate) {
        var insertions = planInsertions(classification, sections);

        if (!recreate) {
            return PatchPlan.insertionsOnly(insertions);
        }
        var removals = insertions.stream()
                                 .flatMap(insertion -> classification.occurrencesOf(insertion.sectionName())
                                                                     .stream())
                                 .map(LabelRemoval::new)
                                 .toList();
        return new PatchPlan(insertions, removals);
    }

    public LabelTemplate template() {
        return template;
    }
}
