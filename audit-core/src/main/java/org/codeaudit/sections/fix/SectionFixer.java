package org.codeaudit.sections.fix;

import org.codeaudit.sections.Classification;
import org.codeaudit.sections.RequirementResolver;
import org.codeaudit.sections.SectionClassifier;
import org.codeaudit.sections.SectionName;
import org.codeaudit.shared.SourceText;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inserts missing section labels into a LiveView-style module, or previews the insertion.
 *
 * Pipeline: classify, resolve the sections to (re)create, plan, then apply or render the
 * same plan. The fixer performs no I/O; callers read and write files.
 *
 * Under {@code force} labels are recreated in place: every applicable section ends up with
 * exactly one freshly rendered label directly above its first declaration, and older labels
 * of those sections are removed.
 */
public final class SectionFixer {

    private static final Logger log = LoggerFactory.getLogger(SectionFixer.class);

    private final SectionClassifier classifier;

    private SectionFixer(SectionClassifier classifier) {
        this.classifier = classifier;
    }

    public static SectionFixer sectionFixer() {
        return new SectionFixer(SectionClassifier.sectionClassifier());
    }

    public FixResult fixSections(String content, List<SectionName> sections) {
        return fixSections(content, sections, FixOptions.defaultOptions());
    }

    public FixResult fixSections(String content, List<SectionName> sections, FixOptions options) {
        var text = SourceText.sourceText(content);
        var classification = classifier.classify(text);
        var toInsert = RequirementResolver.toInsert(classification, sections, options.force());
        var plan = InsertionPlanner.insertionPlanner(options.labelTemplate())
                                   .plan(classification, toInsert, options.force());

        log.debug("Sections requested {}, to insert {}, planned {} insertion(s) and {} removal(s)",
                  sections,
                  toInsert,
                  plan.insertions()
                      .size(),
                  plan.removals()
                      .size());

        if (options.preview()) {
            return FixResult.previewed(PreviewRenderer.render(text, plan, options.filePath()));
        }
        if (plan.isEmpty()) {
            return FixResult.failed(nothingToAdd(classification, sections));
        }
        return FixResult.fixed(PatchApplier.apply(text, plan), plan);
    }

    private static FixError nothingToAdd(Classification classification, List<SectionName> sections) {
        var applicable = RequirementResolver.applicable(classification.observedCategories(), sections);
        return applicable.isEmpty()
               ? new FixError.NoMatchingDeclarations(sections)
               : new FixError.SectionsAlreadyPresent();
    }
}
