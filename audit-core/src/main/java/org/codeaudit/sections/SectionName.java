package org.codeaudit.sections;

import java.util.List;
import java.util.Locale;

/**
 * Canonical section label, e.g. {@code LIFECYCLE CALLBACKS}.
 *
 * The label-to-category table is static. Names outside of it map to
 * {@link FunctionCategory#OTHER} and are never required or inserted.
 */
public record SectionName(String canonical) {

    public static final SectionName LIFECYCLE_CALLBACKS = new SectionName("LIFECYCLE CALLBACKS");
    public static final SectionName EVENT_HANDLERS = new SectionName("EVENT HANDLERS");
    public static final SectionName INFO_HANDLERS = new SectionName("INFO HANDLERS");
    public static final SectionName RENDERING = new SectionName("RENDERING");

    /**
     * Default required sections, in the order they are reported.
     */
    public static final List<SectionName> DEFAULT_REQUIRED = List.of(LIFECYCLE_CALLBACKS, EVENT_HANDLERS, RENDERING);

    public SectionName {
        if (canonical == null || canonical.isBlank()) {
            throw new IllegalArgumentException("Section name must not be blank");
        }
    }

    /**
     * Factory method normalizing a configured or parsed name (trimmed, upper case).
     */
    public static SectionName sectionName(String raw) {
        return new SectionName(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Section name for a category; {@code OTHER} has no section.
     */
    public static SectionName forCategory(FunctionCategory category) {
        return switch (category) {
            case LIFECYCLE -> LIFECYCLE_CALLBACKS;
            case EVENT_HANDLER -> EVENT_HANDLERS;
            case INFO_HANDLER -> INFO_HANDLERS;
            case RENDERING -> RENDERING;
            case OTHER -> throw new IllegalArgumentException("Category OTHER has no section");
        };
    }

    public FunctionCategory category() {
        return switch (canonical) {
            case "LIFECYCLE CALLBACKS" -> FunctionCategory.LIFECYCLE;
            case "EVENT HANDLERS" -> FunctionCategory.EVENT_HANDLER;
            case "INFO HANDLERS" -> FunctionCategory.INFO_HANDLER;
            case "RENDERING" -> FunctionCategory.RENDERING;
            default -> FunctionCategory.OTHER;
        };
    }

    @Override
    public String toString() {
        return canonical;
    }
}
