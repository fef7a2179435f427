package org.codeaudit.sections;

/**
 * Functional role of a declared routine in a LiveView-style module.
 *
 * Declaration order is the classification priority: the first category
 * whose detection rules match a declaration wins.
 */
public enum FunctionCategory {
    LIFECYCLE,
    EVENT_HANDLER,
    INFO_HANDLER,
    RENDERING,
    OTHER;

    /**
     * Whether a section for this category may ever be demanded or inserted.
     */
    public boolean isSectioned() {
        return this != OTHER;
    }
}
