package org.codeaudit.sections.fix;

import java.util.Comparator;
import java.util.List;

/**
 * Every edit of a fix, in original line coordinates. Both apply and preview consume this plan.
 *
 * Insertions are sorted ascending by line (stable, so equal lines keep request order);
 * removals are sorted ascending by line.
 */
public record PatchPlan(List<InsertionPlan> insertions, List<LabelRemoval> removals) {

    public PatchPlan {
        insertions = insertions.stream()
                               .sorted(Comparator.comparingInt(InsertionPlan::lineIndex))
                               .toList();
        removals = removals.stream()
                           .sorted(Comparator.comparingInt(LabelRemoval::lineIndex))
                           .toList();
    }

    public static PatchPlan insertionsOnly(List<InsertionPlan> insertions) {
        return new PatchPlan(insertions, List.of());
    }

    public boolean isEmpty() {
        return insertions.isEmpty();
    }

    /**
     * 0-based index the inserted label occupies once the whole plan is applied.
     */
    public int resultingLineIndex(InsertionPlan insertion) {
        var position = insertions.indexOf(insertion);
        if (position < 0) {
            throw new IllegalArgumentException("Insertion " + insertion + " is not part of this plan");
        }
        var removedAbove = removals.stream()
                                   .filter(removal -> removal.lineIndex() < insertion.lineIndex())
                                   .count();
        return insertion.lineIndex() + position - (int) removedAbove;
    }
}
