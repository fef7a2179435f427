package org.codeaudit.lint;

import org.codeaudit.sections.LabelTemplate;
import org.codeaudit.sections.SectionName;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of the LiveView section rule and its fixer.
 *
 * Configuration files are loaded elsewhere; this record is built from the resulting map.
 * Unknown or malformed values are logged and replaced by defaults, they never fail a run.
 */
public record RuleConfig(boolean enabled,
                         List<SectionName> required,
                         Severity violationLevel,
                         boolean checkExternalTemplates,
                         boolean checkComponentStructure,
                         LabelTemplate labelTemplate) {

    private static final Logger log = LoggerFactory.getLogger(RuleConfig.class);

    public static final String ENABLED = "enabled";
    public static final String REQUIRED = "required";
    public static final String VIOLATION_LEVEL = "violation_level";
    public static final String CHECK_EXTERNAL_TEMPLATES = "check_external_templates";
    public static final String CHECK_COMPONENT_STRUCTURE = "check_component_structure";

    /**
     * Default configuration.
     */
    public static final RuleConfig DEFAULT = new RuleConfig(true,
                                                            SectionName.DEFAULT_REQUIRED,
                                                            Severity.WARNING,
                                                            true,
                                                            true,
                                                            LabelTemplate.DEFAULT);

    public RuleConfig {
        required = List.copyOf(required);
    }

    /**
     * Factory method for default config.
     */
    public static RuleConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Build from an externally loaded option map, falling back to defaults key by key.
     */
    public static RuleConfig ruleConfig(Map<String, ?> options) {
        return new RuleConfig(flag(options, ENABLED, DEFAULT.enabled()),
                              required(options.get(REQUIRED)),
                              severity(options.get(VIOLATION_LEVEL)),
                              flag(options, CHECK_EXTERNAL_TEMPLATES, DEFAULT.checkExternalTemplates()),
                              flag(options, CHECK_COMPONENT_STRUCTURE, DEFAULT.checkComponentStructure()),
                              DEFAULT.labelTemplate());
    }

    /**
     * Builder-style method to set the required sections.
     */
    public RuleConfig withRequired(List<SectionName> required) {
        return new RuleConfig(enabled, required, violationLevel, checkExternalTemplates, checkComponentStructure, labelTemplate);
    }

    /**
     * Builder-style method to set the required sections by name.
     */
    public RuleConfig withRequiredNames(String... names) {
        return withRequired(Arrays.stream(names)
                                  .map(SectionName::sectionName)
                                  .toList());
    }

    /**
     * Builder-style method to set the severity of reported violations.
     */
    public RuleConfig withViolationLevel(Severity violationLevel) {
        return new RuleConfig(enabled, required, violationLevel, checkExternalTemplates, checkComponentStructure, labelTemplate);
    }

    /**
     * Builder-style method to toggle the external template check.
     */
    public RuleConfig withCheckExternalTemplates(boolean checkExternalTemplates) {
        return new RuleConfig(enabled, required, violationLevel, checkExternalTemplates, checkComponentStructure, labelTemplate);
    }

    /**
     * Builder-style method to toggle the component structure check.
     */
    public RuleConfig withCheckComponentStructure(boolean checkComponentStructure) {
        return new RuleConfig(enabled, required, violationLevel, checkExternalTemplates, checkComponentStructure, labelTemplate);
    }

    /**
     * Builder-style method to enable or disable the rule.
     */
    public RuleConfig withEnabled(boolean enabled) {
        return new RuleConfig(enabled, required, violationLevel, checkExternalTemplates, checkComponentStructure, labelTemplate);
    }

    /**
     * Builder-style method to set the decoration of inserted labels.
     */
    public RuleConfig withLabelTemplate(LabelTemplate labelTemplate) {
        return new RuleConfig(enabled, required, violationLevel, checkExternalTemplates, checkComponentStructure, labelTemplate);
    }

    private static boolean flag(Map<String, ?> options, String key, boolean defaultValue) {
        var value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        var text = value.toString()
                        .trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(text);
        }
        log.warn("Ignoring non-boolean value '{}' for '{}', using {}", value, key, defaultValue);
        return defaultValue;
    }

    private static List<SectionName> required(Object value) {
        if (value == null) {
            return DEFAULT.required();
        }
        if (value instanceof Collection<?> names) {
            return names.stream()
                        .map(Object::toString)
                        .filter(name -> !name.isBlank())
                        .map(SectionName::sectionName)
                        .toList();
        }
        return Arrays.stream(value.toString()
                                  .split(","))
                     .filter(name -> !name.isBlank())
                     .map(SectionName::sectionName)
                     .toList();
    }

    private static Severity severity(Object value) {
        if (value == null) {
            return DEFAULT.violationLevel();
        }
        if (value instanceof Severity severity) {
            return severity;
        }
        var parsed = Severity.parse(value.toString());
        if (parsed.isEmpty()) {
            log.warn("Unknown violation level '{}', using {}", value, DEFAULT.violationLevel());
        }
        return parsed.orElse(DEFAULT.violationLevel());
    }
}
