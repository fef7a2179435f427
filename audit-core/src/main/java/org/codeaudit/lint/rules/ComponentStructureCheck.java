package org.codeaudit.lint.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural conventions of LiveComponent modules: embedded HEEx, an {@code update}
 * callback for stateful components, documented props.
 */
final class ComponentStructureCheck {

    static final String TITLE = "LiveView component structure issue";
    static final String NO_HEEX = "Component doesn't use embedded HEEx templates";
    static final String NO_UPDATE = "Stateful component missing @impl true def update callback";
    static final String UNDOCUMENTED_PROPS = "Component props are not documented with @moduledoc or @doc";

    private static final List<Pattern> COMPONENT_PATTERNS = List.of(
            Pattern.compile("use\\s+Phoenix\\.LiveComponent"),
            Pattern.compile("use\\s+.*\\.LiveComponent"),
            Pattern.compile("use\\s+[\\w.]+,\\s*:live_component"),
            Pattern.compile("defmodule.*Component"),
            Pattern.compile("@impl\\s+true\\s+def\\s+update\\(")
    );

    private static final Pattern FUNCTIONAL_RENDER =
            Pattern.compile("def\\s+render\\s*\\(\\s*assigns\\s*\\)\\s*do\\s*~[HLF]", Pattern.CASE_INSENSITIVE);
    private static final Pattern UPDATE_CALLBACK = Pattern.compile("@impl\\s+true\\s+def\\s+update\\(");
    private static final Pattern EMBEDDED_HEEX = Pattern.compile("~[HLF]\"{3}|~[HLF]\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern MODULEDOC = Pattern.compile("@moduledoc\\s*\"\"\"\\n(.*?)\"\"\"", Pattern.DOTALL);
    private static final Pattern PROPS_HEADING = Pattern.compile("^\\s*## Props", Pattern.MULTILINE);
    private static final Pattern PROP_ATTRIBUTE = Pattern.compile("@(moduledoc|doc).*\\{:prop, ");

    private ComponentStructureCheck() {}

    static boolean isComponent(String content) {
        return COMPONENT_PATTERNS.stream()
                                 .anyMatch(pattern -> pattern.matcher(content)
                                                             .find());
    }

    /**
     * Details of every broken convention; empty for non-components.
     */
    static List<String> problems(String content) {
        if (!isComponent(content)) {
            return List.of();
        }
        var problems = new ArrayList<String>();

        if (!EMBEDDED_HEEX.matcher(content)
                          .find()) {
            problems.add(NO_HEEX);
        }
        var functional = FUNCTIONAL_RENDER.matcher(content)
                                          .find();
        if (!functional && !UPDATE_CALLBACK.matcher(content)
                                           .find()) {
            problems.add(NO_UPDATE);
        }
        if (!hasDocumentedProps(content)) {
            problems.add(UNDOCUMENTED_PROPS);
        }
        return problems;
    }

    private static boolean hasDocumentedProps(String content) {
        if (PROP_ATTRIBUTE.matcher(content)
                          .find()) {
            return true;
        }
        var moduledoc = MODULEDOC.matcher(content);
        return moduledoc.find() && PROPS_HEADING.matcher(moduledoc.group(1))
                                                .find();
    }
}
