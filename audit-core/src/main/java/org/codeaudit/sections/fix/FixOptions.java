package org.codeaudit.sections.fix;

import org.codeaudit.sections.LabelTemplate;

import java.util.Optional;

/**
 * Options of a section fix.
 *
 * @param force         recreate labels of every applicable section, even existing ones
 * @param preview       render a diff preview instead of the fixed text
 * @param filePath      path shown in preview annotations only
 * @param labelTemplate decoration of inserted labels
 */
public record FixOptions(boolean force, boolean preview, Optional<String> filePath, LabelTemplate labelTemplate) {

    public static final FixOptions DEFAULT = new FixOptions(false, false, Optional.empty(), LabelTemplate.DEFAULT);

    public static FixOptions defaultOptions() {
        return DEFAULT;
    }

    public FixOptions withForce(boolean force) {
        return new FixOptions(force, preview, filePath, labelTemplate);
    }

    public FixOptions withPreview(boolean preview) {
        return new FixOptions(force, preview, filePath, labelTemplate);
    }

    public FixOptions withFilePath(String filePath) {
        return new FixOptions(force, preview, Optional.ofNullable(filePath), labelTemplate);
    }

    public FixOptions withLabelTemplate(LabelTemplate labelTemplate) {
        return new FixOptions(force, preview, filePath, labelTemplate);
    }
}
