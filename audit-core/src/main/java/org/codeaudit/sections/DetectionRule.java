package org.codeaudit.sections;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * A single way of recognizing a declaration of some category.
 */
public sealed interface DetectionRule {

    /**
     * Test a declaration by its name and the text following the name.
     */
    boolean matches(String name, String signature);

    /**
     * Exact look-up of the declared name.
     */
    record NameRule(Set<String> names) implements DetectionRule {
        public NameRule {
            names = Set.copyOf(names);
        }

        @Override
        public boolean matches(String name, String signature) {
            return names.contains(name);
        }
    }

    /**
     * Match on the argument list, for declarations without a conventional name.
     */
    record SignatureRule(String description, Pattern signature) implements DetectionRule {
        @Override
        public boolean matches(String name, String signature) {
            return this.signature.matcher(signature)
                                 .lookingAt();
        }
    }

    static DetectionRule names(String... names) {
        return new NameRule(Set.of(names));
    }

    static DetectionRule signature(String description, String regex) {
        return new SignatureRule(description, Pattern.compile(regex));
    }
}
