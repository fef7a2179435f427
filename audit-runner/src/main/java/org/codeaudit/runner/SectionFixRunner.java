package org.codeaudit.runner;

import org.codeaudit.lint.RuleConfig;
import org.codeaudit.lint.Violation;
import org.codeaudit.lint.rules.LiveViewSectionsRule;
import org.codeaudit.sections.MissingSectionsMessage;
import org.codeaudit.sections.PatternRegistry;
import org.codeaudit.sections.SectionName;
import org.codeaudit.sections.fix.FixOptions;
import org.codeaudit.sections.fix.FixResult;
import org.codeaudit.sections.fix.InsertionPlan;
import org.codeaudit.sections.fix.SectionFixer;
import org.codeaudit.shared.SourceText;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixes (or previews fixes for) missing section labels across files.
 *
 * Without force, the sections to add are the ones the rule reports as missing, taken from
 * its violation message. With force, the configured required sections are recreated.
 * Only apply mode writes files, and nothing is touched while the rule is disabled or
 * filtered out of the run.
 */
public final class SectionFixRunner {

    private static final Logger log = LoggerFactory.getLogger(SectionFixRunner.class);

    private final AuditContext context;
    private final LiveViewSectionsRule rule = new LiveViewSectionsRule();
    private final SectionFixer fixer = SectionFixer.sectionFixer();

    private SectionFixRunner(AuditContext context) {
        this.context = context;
    }

    public static SectionFixRunner sectionFixRunner(AuditContext context) {
        return new SectionFixRunner(context);
    }

    /**
     * Collect source files under the given paths and fix them.
     */
    public List<FileOutcome> fix(List<Path> paths, boolean force, boolean preview) {
        return fixFiles(FileCollector.collectSourceFiles(paths, context, log::warn), force, preview);
    }

    public List<FileOutcome> fixFiles(List<Path> files, boolean force, boolean preview) {
        return files.parallelStream()
                    .map(file -> fixFile(file, force, preview))
                    .toList();
    }

    FileOutcome fixFile(Path file, boolean force, boolean preview) {
        if (!context.isRuleEnabled(rule.ruleId())) {
            return new FileOutcome.Unchanged(file, "Rule " + rule.ruleId() + " is disabled");
        }
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            return new FileOutcome.IoFailure(file, "Failed to read file: " + e.getMessage());
        }

        var relativePath = context.relativePath(file);
        if (!PatternRegistry.isCandidate(relativePath, content)) {
            return new FileOutcome.Unchanged(file, "Not a LiveView module");
        }
        var config = context.configFor(rule.ruleId());
        var sections = force
                       ? config.required()
                       : missingSections(relativePath, content, config);
        if (sections.isEmpty()) {
            return new FileOutcome.Unchanged(file, "No missing sections");
        }

        var options = FixOptions.defaultOptions()
                                .withForce(force)
                                .withPreview(preview)
                                .withFilePath(relativePath)
                                .withLabelTemplate(config.labelTemplate());
        return toOutcome(file, fixer.fixSections(content, sections, options));
    }

    private List<SectionName> missingSections(String relativePath, String content, RuleConfig config) {
        return rule.check(relativePath, SourceText.sourceText(content), config)
                   .stream()
                   .map(Violation::message)
                   .filter(message -> message.startsWith(MissingSectionsMessage.TITLE))
                   .findFirst()
                   .map(MissingSectionsMessage::parse)
                   .orElse(List.of());
    }

    private FileOutcome toOutcome(Path file, FixResult result) {
        if (result instanceof FixResult.Fixed fixed) {
            return write(file, fixed);
        }
        if (result instanceof FixResult.Previewed previewed) {
            return new FileOutcome.Previewed(file, previewed.preview());
        }
        var message = result.failure()
                            .map(error -> error.message())
                            .orElse("Nothing to fix");
        return new FileOutcome.Unchanged(file, message);
    }

    private FileOutcome write(Path file, FixResult.Fixed fixed) {
        var sections = fixed.plan()
                            .insertions()
                            .stream()
                            .map(InsertionPlan::sectionName)
                            .toList();
        try {
            Files.writeString(file, fixed.content());
        } catch (IOException e) {
            log.warn("Failed to write {}: {}", file, e.getMessage());
            return new FileOutcome.IoFailure(file, "Failed to write file: " + e.getMessage());
        }
        log.info("Fixed {}: added {}", file, sections);
        return new FileOutcome.Written(file, sections);
    }
}
