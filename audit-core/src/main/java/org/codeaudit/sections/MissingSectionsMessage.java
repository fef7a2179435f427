package org.codeaudit.sections;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The stable text shape of a missing-sections violation.
 *
 * Downstream tools extract the list with {@code Missing sections: \[(.*?)\]}, so the
 * format below must not change.
 */
public final class MissingSectionsMessage {

    public static final String TITLE = "LiveView missing labeled sections";

    private static final String DETAILS_INDENT = "\n   ";
    private static final Pattern MISSING_LIST = Pattern.compile("Missing sections: \\[(.*?)\\]");

    private MissingSectionsMessage() {}

    /**
     * Title plus {@code Missing sections: ["A", "B"]}.
     */
    public static String format(List<SectionName> missing) {
        var list = missing.stream()
                          .map(name -> "\"" + name.canonical() + "\"")
                          .collect(Collectors.joining(", "));
        return TITLE + DETAILS_INDENT + "Missing sections: [" + list + "]";
    }

    /**
     * Section names listed in a violation message; empty when the message has no list.
     */
    public static List<SectionName> parse(String message) {
        var matcher = MISSING_LIST.matcher(message);
        if (!matcher.find()) {
            return List.of();
        }
        return Arrays.stream(matcher.group(1)
                                    .split(","))
                     .map(part -> part.trim()
                                      .replace("\"", ""))
                     .filter(part -> !part.isEmpty())
                     .map(SectionName::sectionName)
                     .toList();
    }
}
