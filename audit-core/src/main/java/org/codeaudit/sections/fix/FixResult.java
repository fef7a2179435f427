package org.codeaudit.sections.fix;

import org.codeaudit.shared.SourceText;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Outcome of {@link SectionFixer#fixSections}: fixed text, a preview, or a recoverable failure.
 */
public sealed interface FixResult {

    /**
     * Labels were inserted.
     */
    record Fixed(SourceText text, PatchPlan plan) implements FixResult {
        public String content() {
            return text.content();
        }
    }

    /**
     * Preview of the planned changes, or the no-op message.
     */
    record Previewed(String preview) implements FixResult {}

    record Failed(FixError error) implements FixResult {}

    static FixResult fixed(SourceText text, PatchPlan plan) {
        return new Fixed(text, plan);
    }

    static FixResult previewed(String preview) {
        return new Previewed(preview);
    }

    static FixResult failed(FixError error) {
        return new Failed(error);
    }

    default boolean isSuccess() {
        return !(this instanceof Failed);
    }

    /**
     * Fixed content or preview text; empty for a failure.
     */
    default Optional<String> output() {
        if (this instanceof Fixed fixed) {
            return Optional.of(fixed.content());
        }
        if (this instanceof Previewed previewed) {
            return Optional.of(previewed.preview());
        }
        return Optional.empty();
    }

    /**
     * Failure cause; empty for fixed or previewed results.
     */
    default Optional<FixError> failure() {
        return this instanceof Failed failed
               ? Optional.of(failed.error())
               : Optional.empty();
    }

    default FixResult onSuccess(Consumer<String> action) {
        output().ifPresent(action);
        return this;
    }

    default FixResult onFailure(Consumer<FixError> action) {
        failure().ifPresent(action);
        return this;
    }
}
