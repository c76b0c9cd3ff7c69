package com.vidnyan.slate.domain.rule;

/**
 * Two rules were registered under the same id.
 */
public class DuplicateRuleException extends LintConfigurationException {

    private final String ruleId;

    public DuplicateRuleException(String ruleId) {
        super("Duplicate rule id: " + ruleId);
        this.ruleId = ruleId;
    }

    public String ruleId() {
        return ruleId;
    }
}
