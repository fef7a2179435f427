package org.codeaudit.shared;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, line-oriented view of a source file.
 *
 * Lines are 0-indexed internally; every user-facing position is {@code index + 1}.
 * Splitting and joining on {@code '\n'} round-trips the original content exactly,
 * including a trailing newline (kept as a final empty line).
 */
public record SourceText(List<String> lines) {

    private static final String LINE_SEPARATOR = "\n";

    public SourceText {
        lines = List.copyOf(lines);
    }

    /**
     * Factory method splitting raw file content into lines.
     */
    public static SourceText sourceText(String content) {
        return new SourceText(List.of(content.split(LINE_SEPARATOR, -1)));
    }

    /**
     * Factory method from an already split line list.
     */
    public static SourceText sourceText(List<String> lines) {
        return new SourceText(lines);
    }

    public int lineCount() {
        return lines.size();
    }

    public String line(int index) {
        return lines.get(index);
    }

    /**
     * Mutable copy of the lines, for building a new text.
     */
    public List<String> mutableLines() {
        return new ArrayList<>(lines);
    }

    public String content() {
        return String.join(LINE_SEPARATOR, lines);
    }

    @Override
    public String toString() {
        return content();
    }
}
