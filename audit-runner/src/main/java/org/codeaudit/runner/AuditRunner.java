package org.codeaudit.runner;

import org.codeaudit.lint.AuditRule;
import org.codeaudit.lint.Violation;
import org.codeaudit.shared.SourceText;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the enabled rules over a set of files.
 *
 * Each file is read once and checked independently; files are processed in parallel and
 * results are collected in file order.
 */
public final class AuditRunner {

    private static final Logger log = LoggerFactory.getLogger(AuditRunner.class);

    private final AuditContext context;

    private AuditRunner(AuditContext context) {
        this.context = context;
    }

    public static AuditRunner auditRunner(AuditContext context) {
        return new AuditRunner(context);
    }

    /**
     * Collect source files under the given paths and audit them.
     */
    public AuditReport audit(List<Path> paths) {
        return auditFiles(FileCollector.collectSourceFiles(paths, context, log::warn));
    }

    /**
     * Audit exactly the given files.
     */
    public AuditReport auditFiles(List<Path> files) {
        var rules = Rules.enabled(context);
        var audits = files.parallelStream()
                          .map(file -> auditFile(file, rules))
                          .toList();

        var violations = audits.stream()
                               .flatMap(audit -> audit.violations()
                                                      .stream())
                               .toList();
        var unreadable = new LinkedHashMap<Path, String>();
        audits.stream()
              .filter(audit -> audit.error() != null)
              .forEach(audit -> unreadable.put(audit.file(), audit.error()));

        var report = new AuditReport(audits.size() - unreadable.size(), violations, unreadable);
        var summary = report.summary();
        log.info("Audited {} file(s): {} error(s), {} warning(s)",
                 report.filesAnalyzed(),
                 summary.errors(),
                 summary.warnings());
        return report;
    }

    private FileAudit auditFile(Path file, List<AuditRule> rules) {
        try {
            var content = SourceText.sourceText(Files.readString(file));
            var relativePath = context.relativePath(file);
            var violations = rules.stream()
                                  .flatMap(rule -> rule.check(relativePath, content, context.configFor(rule.ruleId()))
                                                       .stream())
                                  .toList();
            return new FileAudit(file, violations, null);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            return new FileAudit(file, List.of(), "Failed to read file: " + e.getMessage());
        }
    }

    private record FileAudit(Path file, List<Violation> violations, String error) {}
}
