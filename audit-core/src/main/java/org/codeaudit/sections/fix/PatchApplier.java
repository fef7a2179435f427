package org.codeaudit.sections.fix;

import org.codeaudit.shared.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link PatchPlan} to a text without index drift.
 *
 * Edits are applied from the highest line index to the lowest. An edit only shifts lines at
 * or below its own index, so every edit still pending (all at lower indices) keeps pointing
 * at the line it was planned for, in the original coordinates.
 */
public final class PatchApplier {

    private PatchApplier() {}

    /**
     * New text with every edit of the plan applied; the input is left untouched.
     */
    public static SourceText apply(SourceText text, PatchPlan plan) {
        return SourceText.sourceText(applyDescending(text.lines(), plan.insertions(), plan.removals()));
    }

    /**
     * Insert each planned label immediately before its original line.
     *
     * @param lines      original lines, not modified
     * @param insertions plans sorted ascending by line index
     * @return new list of lines
     */
    public static List<String> applyInsertionsDescending(List<String> lines, List<InsertionPlan> insertions) {
        return applyDescending(lines, insertions, List.of());
    }

    /**
     * Insertions and label removals in one descending sweep. At equal indices the removal is
     * applied first, so an insertion never gets removed by an edit meant for the original line.
     */
    public static List<String> applyDescending(List<String> lines,
                                               List<InsertionPlan> insertions,
                                               List<LabelRemoval> removals) {
        requireAscending(insertions);
        insertions.forEach(insertion -> requireInBounds(insertion.lineIndex(), lines.size(), insertion.sectionName()
                                                                                                        .canonical()));
        removals.forEach(removal -> requireInBounds(removal.lineIndex(), lines.size(), removal.occurrence()
                                                                                                  .rawLabelText()));
        var result = new ArrayList<>(lines);
        var nextInsertion = insertions.size() - 1;
        var nextRemoval = removals.size() - 1;

        while (nextInsertion >= 0 || nextRemoval >= 0) {
            var removalFirst = nextInsertion < 0
                               || (nextRemoval >= 0
                                   && removals.get(nextRemoval).lineIndex() >= insertions.get(nextInsertion).lineIndex());
            if (removalFirst) {
                result.remove(removals.get(nextRemoval--).lineIndex());
            } else {
                var insertion = insertions.get(nextInsertion--);
                result.add(insertion.lineIndex(), insertion.renderedLabelLine());
            }
        }
        return result;
    }

    private static void requireAscending(List<InsertionPlan> insertions) {
        for (int i = 1; i < insertions.size(); i++) {
            if (insertions.get(i).lineIndex() < insertions.get(i - 1).lineIndex()) {
                throw new IllegalStateException("Insertion plans must be sorted ascending by line index, got "
                                                + insertions.get(i - 1).lineIndex() + " before "
                                                + insertions.get(i).lineIndex());
            }
        }
    }

    private static void requireInBounds(int lineIndex, int lineCount, String subject) {
        if (lineIndex < 0 || lineIndex >= lineCount) {
            throw new IllegalStateException("Plan for '" + subject + "' targets line index " + lineIndex
                                            + " outside a text of " + lineCount + " lines");
        }
    }
}
