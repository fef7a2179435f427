package org.codeaudit.sections;

import org.codeaudit.shared.SourceText;

import java.util.ArrayList;

/**
 * Single-pass, line-oriented classifier of declarations and section labels.
 *
 * Lines inside triple-quoted blocks (heredocs, {@code ~H"""} templates, {@code @moduledoc})
 * are skipped entirely, so label-like text in documentation or markup never counts.
 * A line is either a declaration, a label, or neither.
 */
public final class SectionClassifier {

    private static final SectionClassifier INSTANCE = new SectionClassifier();

    private SectionClassifier() {}

    public static SectionClassifier sectionClassifier() {
        return INSTANCE;
    }

    /**
     * Classify a file only if it looks like a LiveView-style module; otherwise the result is empty.
     */
    public Classification classify(String fileName, SourceText text) {
        if (!PatternRegistry.isCandidate(fileName, text.content())) {
            return Classification.empty();
        }
        return classify(text);
    }

    /**
     * Classify unconditionally.
     */
    public Classification classify(SourceText text) {
        var declarations = new ArrayList<Declaration>();
        var occurrences = new ArrayList<SectionOccurrence>();
        String openQuote = null;

        for (int index = 0; index < text.lineCount(); index++) {
            var line = text.line(index);

            if (openQuote == null) {
                var lineIndex = index;
                var declaration = PatternRegistry.declaration(line);

                if (declaration.isPresent()) {
                    var matcher = declaration.get();
                    var name = matcher.group(3);
                    declarations.add(new Declaration(lineIndex,
                                                     name,
                                                     PatternRegistry.categorize(name, matcher.group(4)),
                                                     matcher.group(1),
                                                     matcher.group(5)));
                } else {
                    PatternRegistry.sectionLabel(line)
                                   .map(SectionName::new)
                                   .ifPresent(name -> occurrences.add(new SectionOccurrence(lineIndex, line, name)));
                }
            }
            openQuote = quoteStateAfter(line, openQuote);
        }
        return new Classification(declarations, occurrences);
    }

    // Walks the delimiters on the line; returns the delimiter still open at its end, or null.
    // Outside a block, delimiters after a comment marker do not count.
    static String quoteStateAfter(String line, String openQuote) {
        var open = openQuote;
        int position = 0;

        while (position < line.length()) {
            if (open != null) {
                var close = line.indexOf(open, position);
                if (close < 0) {
                    return open;
                }
                position = close + open.length();
                open = null;
                continue;
            }
            var next = nextDelimiter(line, position);
            if (next < 0) {
                return null;
            }
            var comment = commentStart(line, position);
            if (comment >= 0 && comment < next) {
                return null;
            }
            open = line.substring(next, next + 3);
            position = next + 3;
        }
        return open;
    }

    // First '#' outside a single-line string literal, or -1.
    private static int commentStart(String line, int from) {
        char quote = 0;

        for (int i = from; i < line.length(); i++) {
            var c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                return i;
            }
        }
        return -1;
    }

    private static int nextDelimiter(String line, int from) {
        int first = -1;
        for (var quote : PatternRegistry.MULTILINE_QUOTES) {
            var found = line.indexOf(quote, from);
            if (found >= 0 && (first < 0 || found < first)) {
                first = found;
            }
        }
        return first;
    }
}
