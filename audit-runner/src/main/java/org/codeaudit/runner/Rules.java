package org.codeaudit.runner;

import org.codeaudit.lint.AuditRule;
import org.codeaudit.lint.rules.LiveViewSectionsRule;

import java.util.List;
import java.util.Optional;

/**
 * Registry of the available audit rules.
 */
public final class Rules {

    private static final List<AuditRule> ALL = List.of(new LiveViewSectionsRule());

    private Rules() {}

    public static List<AuditRule> all() {
        return ALL;
    }

    /**
     * Rules enabled in the context, in registration order.
     */
    public static List<AuditRule> enabled(AuditContext context) {
        return ALL.stream()
                  .filter(rule -> context.isRuleEnabled(rule.ruleId()))
                  .toList();
    }

    public static Optional<AuditRule> findById(String ruleId) {
        return ALL.stream()
                  .filter(rule -> rule.ruleId()
                                      .equals(ruleId))
                  .findFirst();
    }
}
