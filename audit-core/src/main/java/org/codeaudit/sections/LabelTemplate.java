package org.codeaudit.sections;

/**
 * Decoration of an inserted section label: {@code # <prefix>NAME<suffix>}.
 *
 * Prefix and suffix may only contain label filler characters and spaces, so every
 * rendered label is recognized again as a section label.
 */
public record LabelTemplate(String prefix, String suffix) {

    public static final String COMMENT_MARKER = "# ";

    public static final LabelTemplate DEFAULT = new LabelTemplate("---------- ", " ----------");

    public static final LabelTemplate PLAIN = new LabelTemplate("", "");

    public LabelTemplate {
        requireDecoration("prefix", prefix);
        requireDecoration("suffix", suffix);
    }

    public static LabelTemplate defaultTemplate() {
        return DEFAULT;
    }

    /**
     * Symmetric template of {@code width} repetitions of a filler character.
     */
    public static LabelTemplate symmetric(char filler, int width) {
        var decoration = String.valueOf(filler)
                               .repeat(width);
        return new LabelTemplate(decoration + " ", " " + decoration);
    }

    /**
     * Full label line for a section, aligned with {@code indentation}.
     */
    public String render(String indentation, SectionName name) {
        return indentation + COMMENT_MARKER + prefix + name.canonical() + suffix;
    }

    private static void requireDecoration(String part, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Label template " + part + " must not be null");
        }
        for (var c : value.toCharArray()) {
            if (c != ' ' && PatternRegistry.FILLER_CHARACTERS.indexOf(c) < 0) {
                throw new IllegalArgumentException("Label template " + part + " '" + value
                                                   + "' may only contain spaces and '"
                                                   + PatternRegistry.FILLER_CHARACTERS + "'");
            }
        }
    }
}
