package org.codeaudit.sections.fix;

import org.codeaudit.shared.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders a {@link PatchPlan} as a line-numbered, context-bounded diff.
 *
 * Context lines come from the original text with their original numbers. Inserted labels
 * carry the number they will have once the plan is applied.
 */
public final class PreviewRenderer {

    public static final String PREAMBLE = "Preview changes:";
    public static final String NO_CHANGES = "No changes needed - all required sections already exist.";

    static final int CONTEXT_LINES = 3;

    private PreviewRenderer() {}

    public static String render(SourceText original, PatchPlan plan, Optional<String> filePath) {
        if (plan.isEmpty()) {
            return NO_CHANGES;
        }
        var blocks = new ArrayList<String>();
        blocks.add(PREAMBLE);

        var nextInsertion = 0;
        var nextRemoval = 0;
        var insertions = plan.insertions();
        var removals = plan.removals();

        while (nextInsertion < insertions.size() || nextRemoval < removals.size()) {
            var removalFirst = nextInsertion >= insertions.size()
                               || (nextRemoval < removals.size()
                                   && removals.get(nextRemoval).lineIndex() <= insertions.get(nextInsertion).lineIndex());
            if (removalFirst) {
                blocks.add(removalBlock(original, removals.get(nextRemoval++)));
            } else {
                blocks.add(insertionBlock(original, plan, insertions.get(nextInsertion++), filePath));
            }
        }
        return String.join("\n", blocks);
    }

    private static String insertionBlock(SourceText original,
                                         PatchPlan plan,
                                         InsertionPlan insertion,
                                         Optional<String> filePath) {
        var index = insertion.lineIndex();
        var resultingLine = plan.resultingLineIndex(insertion) + 1;
        var lines = new ArrayList<String>();

        lines.add("\n## Insert " + insertion.sectionName() + " at line " + resultingLine + ":");
        lines.addAll(context(original, Math.max(0, index - CONTEXT_LINES), index));
        lines.add("+ " + resultingLine + ": " + insertion.renderedLabelLine());
        filePath.ifPresent(path -> lines.add("  " + path + ":" + resultingLine));
        lines.addAll(context(original, index, Math.min(original.lineCount(), index + CONTEXT_LINES)));
        return String.join("\n", lines);
    }

    private static String removalBlock(SourceText original, LabelRemoval removal) {
        var index = removal.lineIndex();
        var lines = new ArrayList<String>();

        lines.add("\n## Remove existing " + removal.occurrence()
                                                   .canonicalName() + " label at line " + (index + 1) + ":");
        lines.addAll(context(original, Math.max(0, index - CONTEXT_LINES), index));
        lines.add("- " + (index + 1) + ": " + removal.occurrence()
                                                     .rawLabelText());
        lines.addAll(context(original, index + 1, Math.min(original.lineCount(), index + 1 + CONTEXT_LINES)));
        return String.join("\n", lines);
    }

    // Lines [from, to) of the original text, numbered 1-based.
    private static List<String> context(SourceText original, int from, int to) {
        var lines = new ArrayList<String>();
        for (int index = from; index < to; index++) {
            lines.add("  " + (index + 1) + ": " + original.line(index));
        }
        return lines;
    }
}
