package org.codeaudit.lint;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTest {

    @Test
    void parse_acceptsAtomAndPlainSpellings() {
        assertThat(Severity.parse("warning")).contains(Severity.WARNING);
        assertThat(Severity.parse(":error")).contains(Severity.ERROR);
        assertThat(Severity.parse(" ERROR ")).contains(Severity.ERROR);
    }

    @Test
    void parse_rejectsUnknownLevels() {
        assertThat(Severity.parse("fatal")).isEmpty();
        assertThat(Severity.parse("")).isEmpty();
    }

    @Test
    void violation_exposesTitleAndSeverity() {
        var violation = Violation.violation("Title\n   details", "lib/a.ex", 3, Severity.ERROR, "rule");

        assertThat(violation.title()).isEqualTo("Title");
        assertThat(violation.isError()).isTrue();
        assertThat(violation.line()).hasValue(3);
        assertThat(Violation.violation("Only title", "lib/a.ex", Severity.WARNING, "rule")
                            .line()).isEmpty();
    }
}
