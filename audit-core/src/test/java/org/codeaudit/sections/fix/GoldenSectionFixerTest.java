package org.codeaudit.sections.fix;

import org.codeaudit.sections.SectionName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Golden tests for the section fixer.
 *
 * Each {@code name.ex} fixture under fixtures/ is fixed with the default required sections
 * and compared against {@code name.fixed.ex}.
 */
class GoldenSectionFixerTest {

    private static final Path FIXTURES_DIR = Path.of("src/test/resources/fixtures");

    private SectionFixer fixer;

    @BeforeEach
    void setUp() {
        fixer = SectionFixer.sectionFixer();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "counter_live",
            "partial_live",
            "nested_indent_live",
            "forgot_password_live"
    })
    void fixSections_matchesGoldenOutput(String name) throws IOException {
        var input = Files.readString(FIXTURES_DIR.resolve(name + ".ex"));
        var expected = Files.readString(FIXTURES_DIR.resolve(name + ".fixed.ex"));

        fixer.fixSections(input, SectionName.DEFAULT_REQUIRED)
             .onFailure(error -> fail("Fix failed for " + name + ": " + error.message()))
             .onSuccess(fixed -> {
                 if (!fixed.equals(expected)) {
                     System.err.println("=== Expected (" + name + ") ===");
                     System.err.println(expected);
                     System.err.println("=== Actual ===");
                     System.err.println(fixed);
                     System.err.println("=== End ===");
                 }
                 assertThat(fixed).isEqualTo(expected);
             });
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "counter_live",
            "partial_live",
            "nested_indent_live",
            "forgot_password_live"
    })
    void fixSections_hasNothingToAdd_onGoldenOutput(String name) throws IOException {
        var fixed = Files.readString(FIXTURES_DIR.resolve(name + ".fixed.ex"));

        assertThat(fixer.fixSections(fixed, SectionName.DEFAULT_REQUIRED)
                        .failure()).contains(new FixError.SectionsAlreadyPresent());
    }

    @Test
    void fixSections_reportsAlreadyPresent_forLabeledModule() throws IOException {
        var input = Files.readString(FIXTURES_DIR.resolve("labeled_live.ex"));

        assertThat(fixer.fixSections(input, SectionName.DEFAULT_REQUIRED)
                        .failure()).contains(new FixError.SectionsAlreadyPresent());
    }

    @Test
    void fixSections_underForce_movesLabelsAboveDeclarations() throws IOException {
        var input = Files.readString(FIXTURES_DIR.resolve("labeled_live.ex"));
        var expected = Files.readString(FIXTURES_DIR.resolve("labeled_live.forced.ex"));
        var force = FixOptions.defaultOptions()
                              .withForce(true);

        assertThat(fixer.fixSections(input, SectionName.DEFAULT_REQUIRED, force)
                        .output()).contains(expected);
        assertThat(fixer.fixSections(expected, SectionName.DEFAULT_REQUIRED, force)
                        .output()).contains(expected);
    }
}
