package org.codeaudit.runner;

import org.codeaudit.lint.RuleConfig;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Context of a project run: where the project lives, which paths are skipped,
 * which rules run and with what configuration.
 */
public record AuditContext(Path projectRoot,
                           List<Pattern> excludedPathPatterns,
                           Map<String, RuleConfig> ruleConfigs,
                           Set<String> onlyRules) {

    /**
     * Paths never scanned unless configured otherwise.
     */
    public static final List<String> DEFAULT_EXCLUDED_PATHS = List.of("deps/**",
                                                                      "_build/**",
                                                                      "priv/static/**",
                                                                      ".git/**",
                                                                      ".*/**",
                                                                      "test/**",
                                                                      "docs/**",
                                                                      "rel/**",
                                                                      "assets/node_modules/**");

    public AuditContext {
        excludedPathPatterns = List.copyOf(excludedPathPatterns);
        ruleConfigs = Map.copyOf(ruleConfigs);
        onlyRules = Set.copyOf(onlyRules);
    }

    /**
     * Factory method with default exclusions and default rule configuration.
     */
    public static AuditContext auditContext(Path projectRoot) {
        return new AuditContext(projectRoot, compile(DEFAULT_EXCLUDED_PATHS), Map.of(), Set.of());
    }

    /**
     * Check if a file should be scanned (not matched by any exclusion glob).
     * Globs are matched against the path relative to the project root, with {@code /} separators.
     */
    public boolean shouldScan(Path file) {
        var relative = relativePath(file);
        return excludedPathPatterns.stream()
                                   .noneMatch(pattern -> pattern.matcher(relative)
                                                                .matches());
    }

    /**
     * Check if a rule runs: enabled in its configuration and selected by the {@code only} filter.
     */
    public boolean isRuleEnabled(String ruleId) {
        return configFor(ruleId).enabled() && (onlyRules.isEmpty() || onlyRules.contains(ruleId));
    }

    /**
     * Get the configuration of a rule, the default one when none was given.
     */
    public RuleConfig configFor(String ruleId) {
        return ruleConfigs.getOrDefault(ruleId, RuleConfig.defaultConfig());
    }

    public String relativePath(Path file) {
        var absoluteRoot = projectRoot.toAbsolutePath()
                                      .normalize();
        var absoluteFile = file.toAbsolutePath()
                               .normalize();
        var relative = absoluteFile.startsWith(absoluteRoot)
                       ? absoluteRoot.relativize(absoluteFile)
                       : absoluteFile;
        return relative.toString()
                       .replace('\\', '/');
    }

    /**
     * Builder-style method to set excluded path globs.
     */
    public AuditContext withExcludedPaths(List<String> globs) {
        return new AuditContext(projectRoot, compile(globs), ruleConfigs, onlyRules);
    }

    /**
     * Builder-style method to set the configuration of one rule.
     */
    public AuditContext withRuleConfig(String ruleId, RuleConfig config) {
        var configs = new HashMap<>(ruleConfigs);
        configs.put(ruleId, config);
        return new AuditContext(projectRoot, excludedPathPatterns, configs, onlyRules);
    }

    /**
     * Builder-style method to restrict the run to the given rule ids.
     */
    public AuditContext withOnlyRules(Set<String> ruleIds) {
        return new AuditContext(projectRoot, excludedPathPatterns, ruleConfigs, ruleIds);
    }

    private static List<Pattern> compile(List<String> globs) {
        return globs.stream()
                    .map(AuditContext::globToRegex)
                    .map(Pattern::compile)
                    .toList();
    }

    static String globToRegex(String glob) {
        // Use placeholder to avoid ** being affected by * replacement
        return glob.replace(".", "\\.")
                   .replace("**", "\0DOTSTAR\0")
                   .replace("*", "[^/]*")
                   .replace("\0DOTSTAR\0", ".*");
    }
}
