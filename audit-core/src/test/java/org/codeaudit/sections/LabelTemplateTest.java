package org.codeaudit.sections;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelTemplateTest {

    @Test
    void render_usesIndentationAndDecoration() {
        assertThat(LabelTemplate.DEFAULT.render("    ", SectionName.EVENT_HANDLERS))
                .isEqualTo("    # ---------- EVENT HANDLERS ----------");
        assertThat(LabelTemplate.PLAIN.render("\t", SectionName.RENDERING))
                .isEqualTo("\t# RENDERING");
        assertThat(LabelTemplate.symmetric('=', 3)
                                .render("", SectionName.LIFECYCLE_CALLBACKS))
                .isEqualTo("# === LIFECYCLE CALLBACKS ===");
    }

    @Test
    void renderedLabels_areRecognizedAsLabels() {
        for (var template : new LabelTemplate[]{LabelTemplate.DEFAULT, LabelTemplate.PLAIN, LabelTemplate.symmetric('*', 5)}) {
            var line = template.render("  ", SectionName.INFO_HANDLERS);

            assertThat(PatternRegistry.sectionLabel(line)).contains("INFO HANDLERS");
        }
    }

    @Test
    void labelTemplate_rejectsCharactersOutsideFiller() {
        assertThatThrownBy(() -> new LabelTemplate("abc ", ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prefix");
        assertThatThrownBy(() -> new LabelTemplate("", " END"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("suffix");
    }
}
