package org.codeaudit.sections;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.codeaudit.sections.DetectionRule.names;
import static org.codeaudit.sections.DetectionRule.signature;

/**
 * Static patterns used to classify LiveView-style modules.
 *
 * Category priority is the order of {@link #CATEGORY_RULES}; it is a list on purpose,
 * never derived from the iteration order of a set or map.
 */
public final class PatternRegistry {

    private PatternRegistry() {}

    /**
     * Detection rules of one category, in the order they are tried.
     */
    public record CategoryRules(FunctionCategory category, List<DetectionRule> rules) {
        public CategoryRules {
            rules = List.copyOf(rules);
        }
    }

    public static final List<CategoryRules> CATEGORY_RULES = List.of(
            new CategoryRules(FunctionCategory.LIFECYCLE,
                              List.of(names("mount", "update", "init", "terminate", "on_mount",
                                            "handle_params", "handle_continue"))),
            new CategoryRules(FunctionCategory.EVENT_HANDLER,
                              List.of(names("handle_event"))),
            new CategoryRules(FunctionCategory.INFO_HANDLER,
                              List.of(names("handle_info", "handle_call", "handle_cast"))),
            new CategoryRules(FunctionCategory.RENDERING,
                              List.of(names("render", "page_title"),
                                      signature("function component", "\\(\\s*_?assigns\\s*\\)")))
    );

    /**
     * {@code def name...} or {@code defp name...}: indentation, keyword, name, rest of line and
     * the carriage return of a CRLF line, if any.
     */
    public static final Pattern DECLARATION =
            Pattern.compile("^([ \\t]*)(def|defp)\\s+([A-Za-z0-9_?!]+)([^\\r\\n]*?)(\\r?)$");

    /**
     * A comment line holding nothing but an upper-case phrase and optional decorative filler.
     */
    public static final Pattern SECTION_LABEL = Pattern.compile(
            "^[ \\t]*#[ \\t]*(?:[-=*~+#]+[ \\t]*)?([A-Z][A-Z \\t]*[A-Z])(?:[ \\t]*[-=*~+#]+)?[ \\t\\r]*$");

    /**
     * Characters allowed as label decoration.
     */
    public static final String FILLER_CHARACTERS = "-=*~+#";

    public static final List<String> MULTILINE_QUOTES = List.of("\"\"\"", "'''");

    public static final List<String> SOURCE_EXTENSIONS = List.of(".ex", ".exs");

    private static final List<Pattern> LIVE_MODULE_PATTERNS = List.of(
            Pattern.compile("use\\s+Phoenix\\.LiveView"),
            Pattern.compile("use\\s+.*\\.LiveView"),
            Pattern.compile("use\\s+.*\\.LiveComponent"),
            Pattern.compile("use\\s+[\\w.]+,\\s*:live_(view|component)"),
            Pattern.compile("def\\s+mount\\("),
            Pattern.compile("def\\s+render\\("),
            Pattern.compile("def\\s+handle_event\\(")
    );

    private static final Pattern SPECIAL_WEB_FILE = Pattern.compile("(^|.*/)[a-z_]+_web\\.ex$");

    /**
     * Category of a declaration. Name look-ups of every category are tried before any
     * signature rule, so a conventional name always decides over a signature match.
     */
    public static FunctionCategory categorize(String name, String signature) {
        return firstMatch(DetectionRule.NameRule.class, name, signature)
                .or(() -> firstMatch(DetectionRule.SignatureRule.class, name, signature))
                .orElse(FunctionCategory.OTHER);
    }

    private static Optional<FunctionCategory> firstMatch(Class<? extends DetectionRule> kind,
                                                         String name,
                                                         String signature) {
        return CATEGORY_RULES.stream()
                             .filter(entry -> entry.rules()
                                                   .stream()
                                                   .filter(kind::isInstance)
                                                   .anyMatch(rule -> rule.matches(name, signature)))
                             .map(CategoryRules::category)
                             .findFirst();
    }

    /**
     * Match a line against the declaration grammar.
     */
    public static Optional<Matcher> declaration(String line) {
        var matcher = DECLARATION.matcher(line);
        return matcher.matches()
               ? Optional.of(matcher)
               : Optional.empty();
    }

    /**
     * Canonical section name encoded in a label line, if the line is a label.
     */
    public static Optional<String> sectionLabel(String line) {
        var matcher = SECTION_LABEL.matcher(line);
        return matcher.matches()
               ? Optional.of(matcher.group(1).trim())
               : Optional.empty();
    }

    /**
     * Whether a file looks like a LiveView or LiveComponent module worth classifying.
     */
    public static boolean isCandidate(String fileName, String content) {
        return isSourceFile(fileName)
               && !isSpecialWebFile(fileName)
               && LIVE_MODULE_PATTERNS.stream()
                                      .anyMatch(pattern -> pattern.matcher(content)
                                                                  .find());
    }

    public static boolean isSourceFile(String fileName) {
        return SOURCE_EXTENSIONS.stream()
                                .anyMatch(fileName::endsWith);
    }

    /**
     * Application web entry modules ({@code lib/my_app_web.ex}) are not LiveViews even though they define
     * the {@code :live_view} macros.
     */
    public static boolean isSpecialWebFile(String fileName) {
        return SPECIAL_WEB_FILE.matcher(fileName.replace('\\', '/'))
                               .matches();
    }
}
