package org.codeaudit.shared;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceTextTest {

    @Test
    void sourceText_keepsTrailingNewline_asFinalEmptyLine() {
        var text = SourceText.sourceText("a\nb\n");

        assertThat(text.lines()).containsExactly("a", "b", "");
        assertThat(text.content()).isEqualTo("a\nb\n");
    }

    @Test
    void sourceText_keepsBlankLines() {
        var content = "\n\nfoo\n\n";

        assertThat(SourceText.sourceText(content)
                             .content()).isEqualTo(content);
        assertThat(SourceText.sourceText(content)
                             .lineCount()).isEqualTo(5);
    }

    @Test
    void mutableLines_doesNotChangeSource() {
        var text = SourceText.sourceText("one\ntwo");
        var copy = text.mutableLines();

        copy.add(0, "zero");

        assertThat(text.lines()).containsExactly("one", "two");
        assertThat(SourceText.sourceText(copy)
                             .content()).isEqualTo("zero\none\ntwo");
    }
}
