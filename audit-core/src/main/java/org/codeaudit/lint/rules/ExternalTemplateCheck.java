package org.codeaudit.lint.rules;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Detects LiveViews rendering through external template files instead of embedded HEEx.
 */
final class ExternalTemplateCheck {

    static final String TITLE = "LiveView uses external templates";
    static final String DETAILS = "LiveView components should use embedded HEEx templates instead of external template files";

    private static final List<Pattern> EXTERNAL_TEMPLATE_PATTERNS = List.of(
            Pattern.compile("Phoenix\\.View\\.render"),
            Pattern.compile("Phoenix\\.Template\\.render"),
            Pattern.compile("render_template\\("),
            // render(assigns, "template.html")
            Pattern.compile("render\\s*\\([^,]*,\\s*[\"'][^\"']+\\.html[\"']"),
            // render(assigns, :template)
            Pattern.compile("render\\s*\\([^,]*,\\s*:[a-z_]+\\)")
    );

    private ExternalTemplateCheck() {}

    /**
     * 1-based line of the earliest external template call, if any.
     */
    static OptionalInt firstUsage(String content) {
        var earliest = EXTERNAL_TEMPLATE_PATTERNS.stream()
                                                 .map(pattern -> pattern.matcher(content))
                                                 .filter(matcher -> matcher.find())
                                                 .mapToInt(matcher -> matcher.start())
                                                 .min();
        if (earliest.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(lineOf(content, earliest.getAsInt()));
    }

    private static int lineOf(String content, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
