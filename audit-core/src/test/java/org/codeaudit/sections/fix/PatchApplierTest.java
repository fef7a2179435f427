package org.codeaudit.sections.fix;

import org.codeaudit.sections.SectionName;
import org.codeaudit.sections.SectionOccurrence;
import org.codeaudit.shared.SourceText;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatchApplierTest {

    private static final List<String> LINES = List.of("a", "b", "c", "d", "e");

    private static InsertionPlan insertion(int index, String label) {
        return new InsertionPlan(index, SectionName.sectionName(label), "", "# " + label);
    }

    private static LabelRemoval removal(int index, String label) {
        return new LabelRemoval(new SectionOccurrence(index, "# " + label, SectionName.sectionName(label)));
    }

    @Test
    void applyInsertionsDescending_insertsBeforeOriginalLines() {
        var result = PatchApplier.applyInsertionsDescending(LINES,
                                                            List.of(insertion(0, "ONE"),
                                                                    insertion(2, "TWO"),
                                                                    insertion(4, "THREE")));

        assertThat(result).containsExactly("# ONE", "a", "b", "# TWO", "c", "d", "# THREE", "e");
        assertThat(LINES).hasSize(5);
    }

    @Test
    void applyDescending_appliesRemovalFirst_atSameIndex() {
        var lines = List.of("a", "# OLD", "def x", "b");

        var result = PatchApplier.applyDescending(lines, List.of(insertion(1, "NEW")), List.of(removal(1, "OLD")));

        assertThat(result).containsExactly("a", "# NEW", "def x", "b");
    }

    @Test
    void applyDescending_mixesEditsAboveAndBelow() {
        var lines = List.of("# LABEL", "a", "def x", "b", "# OTHER", "def y");

        var result = PatchApplier.applyDescending(lines,
                                                  List.of(insertion(2, "LABEL"), insertion(5, "OTHER")),
                                                  List.of(removal(0, "LABEL"), removal(4, "OTHER")));

        assertThat(result).containsExactly("a", "# LABEL", "def x", "b", "# OTHER", "def y");
    }

    @Test
    void applyDescending_rejectsUnsortedInsertions() {
        assertThatThrownBy(() -> PatchApplier.applyInsertionsDescending(LINES,
                                                                        List.of(insertion(3, "ONE"),
                                                                                insertion(1, "TWO"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ascending");
    }

    @Test
    void applyDescending_rejectsOutOfBoundsIndex() {
        assertThatThrownBy(() -> PatchApplier.applyInsertionsDescending(LINES, List.of(insertion(5, "LATE"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("LATE")
                .hasMessageContaining("5");
        assertThatThrownBy(() -> PatchApplier.applyDescending(LINES, List.of(), List.of(removal(-1, "GONE"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void apply_leavesInputTextUntouched() {
        var text = SourceText.sourceText("a\nb\n");

        var result = PatchApplier.apply(text, PatchPlan.insertionsOnly(List.of(insertion(1, "MID"))));

        assertThat(result.content()).isEqualTo("a\n# MID\nb\n");
        assertThat(text.content()).isEqualTo("a\nb\n");
    }

    @Test
    void resultingLineIndex_accountsForEarlierEdits() {
        var first = insertion(2, "ONE");
        var second = insertion(5, "TWO");
        var plan = new PatchPlan(List.of(second, first), List.of(removal(0, "ONE")));

        assertThat(plan.insertions()).containsExactly(first, second);
        assertThat(plan.resultingLineIndex(first)).isEqualTo(1);
        assertThat(plan.resultingLineIndex(second)).isEqualTo(5);
    }
}
