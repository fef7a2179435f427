package org.codeaudit.sections.fix;

import org.codeaudit.sections.SectionClassifier;
import org.codeaudit.sections.SectionName;
import org.codeaudit.shared.SourceText;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PreviewRendererTest {

    private static final SourceText SOURCE = SourceText.sourceText(String.join("\n",
                                                                               "defmodule A.PageLive do",
                                                                               "  use Phoenix.LiveView",
                                                                               "",
                                                                               "  def mount(_p, _s, socket) do",
                                                                               "    {:ok, socket}",
                                                                               "  end",
                                                                               "",
                                                                               "  def render(assigns) do",
                                                                               "    ~H\"<p/>\"",
                                                                               "  end",
                                                                               "end"));

    private static PatchPlan plan(SourceText text, boolean recreate, SectionName... sections) {
        var classification = SectionClassifier.sectionClassifier()
                                              .classify(text);
        return InsertionPlanner.insertionPlanner()
                               .plan(classification, List.of(sections), recreate);
    }

    @Test
    void render_showsNumberedContext_andPostInsertionLineNumbers() {
        var preview = PreviewRenderer.render(SOURCE,
                                             plan(SOURCE, false, SectionName.LIFECYCLE_CALLBACKS, SectionName.RENDERING),
                                             Optional.empty());

        assertThat(preview).isEqualTo(String.join("\n",
                                                  "Preview changes:",
                                                  "",
                                                  "## Insert LIFECYCLE CALLBACKS at line 4:",
                                                  "  1: defmodule A.PageLive do",
                                                  "  2:   use Phoenix.LiveView",
                                                  "  3: ",
                                                  "+ 4:   # ---------- LIFECYCLE CALLBACKS ----------",
                                                  "  4:   def mount(_p, _s, socket) do",
                                                  "  5:     {:ok, socket}",
                                                  "  6:   end",
                                                  "",
                                                  "## Insert RENDERING at line 9:",
                                                  "  5:     {:ok, socket}",
                                                  "  6:   end",
                                                  "  7: ",
                                                  "+ 9:   # ---------- RENDERING ----------",
                                                  "  8:   def render(assigns) do",
                                                  "  9:     ~H\"<p/>\"",
                                                  "  10:   end"));
    }

    @Test
    void render_annotatesFilePath_withResultingLine() {
        var preview = PreviewRenderer.render(SOURCE,
                                             plan(SOURCE, false, SectionName.RENDERING),
                                             Optional.of("lib/a_web/live/page_live.ex"));

        assertThat(preview).contains("+ 8:   # ---------- RENDERING ----------\n  lib/a_web/live/page_live.ex:8\n  8:   def render");
    }

    @Test
    void render_clipsContextAtFileStart() {
        var text = SourceText.sourceText("def mount(a, b, c), do: {:ok, c}");

        var preview = PreviewRenderer.render(text, plan(text, false, SectionName.LIFECYCLE_CALLBACKS), Optional.empty());

        assertThat(preview).isEqualTo("Preview changes:\n\n## Insert LIFECYCLE CALLBACKS at line 1:\n"
                                      + "+ 1: # ---------- LIFECYCLE CALLBACKS ----------\n"
                                      + "  1: def mount(a, b, c), do: {:ok, c}");
    }

    @Test
    void render_listsRemovalsBeforeInsertions() {
        var text = SourceText.sourceText(String.join("\n",
                                                     "  # RENDERING",
                                                     "  def mount(a, b, c) do",
                                                     "  end",
                                                     "  def render(assigns) do",
                                                     "  end"));

        var preview = PreviewRenderer.render(text, plan(text, true, SectionName.RENDERING), Optional.empty());

        assertThat(preview).contains("## Remove existing RENDERING label at line 1:\n- 1:   # RENDERING\n  2:   def mount")
                           .contains("## Insert RENDERING at line 3:")
                           .contains("+ 3:   # ---------- RENDERING ----------");
        assertThat(preview.indexOf("## Remove")).isLessThan(preview.indexOf("## Insert"));
    }

    @Test
    void render_reportsNoChanges_forEmptyPlan() {
        assertThat(PreviewRenderer.render(SOURCE, PatchPlan.insertionsOnly(List.of()), Optional.empty()))
                .isEqualTo(PreviewRenderer.NO_CHANGES);
    }
}
