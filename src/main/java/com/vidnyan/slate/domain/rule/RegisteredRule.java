package com.vidnyan.slate.domain.rule;

/**
 * An active rule with its configuration resolved.
 *
 * @param rule       the rule implementation
 * @param severity   effective severity (override or default)
 * @param parameters rule-scoped parameters
 */
public record RegisteredRule(
    Rule rule,
    Severity severity,
    RuleParameters parameters
) {

    public String id() {
        return rule.id();
    }

    public boolean fixable() {
        return rule.fixable();
    }
}
