package org.codeaudit.lint.rules;

import org.codeaudit.lint.AuditRule;
import org.codeaudit.lint.RuleConfig;
import org.codeaudit.lint.Violation;
import org.codeaudit.sections.MissingSectionsMessage;
import org.codeaudit.sections.PatternRegistry;
import org.codeaudit.sections.RequirementResolver;
import org.codeaudit.sections.SectionClassifier;
import org.codeaudit.shared.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * live_view_sections: LiveView modules group their callbacks under section labels.
 *
 * A section is only demanded when the module declares at least one function of its
 * category, so a module without {@code handle_event/3} is never asked for
 * {@code EVENT HANDLERS}. All missing sections of a file are reported as one violation.
 *
 * Also reports rendering through external templates and LiveComponent structure issues.
 */
public class LiveViewSectionsRule implements AuditRule {

    public static final String RULE_ID = "live_view_sections";

    private static final String DETAILS_INDENT = "\n   ";

    private final SectionClassifier classifier = SectionClassifier.sectionClassifier();

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public String description() {
        return "Checks that LiveView modules have proper section labels and follow component structure conventions";
    }

    @Override
    public List<Violation> check(String filePath, SourceText content, RuleConfig config) {
        var raw = content.content();
        if (!PatternRegistry.isCandidate(filePath, raw)) {
            return List.of();
        }
        var violations = new ArrayList<Violation>();

        if (!config.required()
                   .isEmpty()) {
            violations.addAll(checkSectionLabels(filePath, content, config));
        }
        if (config.checkExternalTemplates()) {
            ExternalTemplateCheck.firstUsage(raw)
                                 .ifPresent(line -> violations.add(Violation.violation(ExternalTemplateCheck.TITLE
                                                                                       + DETAILS_INDENT
                                                                                       + ExternalTemplateCheck.DETAILS,
                                                                                       filePath,
                                                                                       line,
                                                                                       config.violationLevel(),
                                                                                       RULE_ID)));
        }
        if (config.checkComponentStructure()) {
            ComponentStructureCheck.problems(raw)
                                   .forEach(problem -> violations.add(Violation.violation(ComponentStructureCheck.TITLE
                                                                                          + DETAILS_INDENT
                                                                                          + problem,
                                                                                          filePath,
                                                                                          config.violationLevel(),
                                                                                          RULE_ID)));
        }
        return violations;
    }

    private List<Violation> checkSectionLabels(String filePath, SourceText content, RuleConfig config) {
        var classification = classifier.classify(content);
        var applicable = RequirementResolver.applicable(classification.observedCategories(), config.required());
        var missing = RequirementResolver.missing(applicable, classification.presentSections());

        if (missing.isEmpty()) {
            return List.of();
        }
        return List.of(Violation.violation(MissingSectionsMessage.format(missing),
                                           filePath,
                                           config.violationLevel(),
                                           RULE_ID));
    }
}
