package com.vidnyan.slate.domain.rule;

import java.util.HashMap;
import java.util.Map;

/**
 * Run configuration: rule id to settings.
 * Immutable for the duration of one run. Rules not listed use {@link RuleSettings#defaults()}.
 */
public record LintConfiguration(Map<String, RuleSettings> rules) {

    private static final LintConfiguration EMPTY = new LintConfiguration(Map.of());

    public LintConfiguration {
        rules = rules == null ? Map.of() : Map.copyOf(rules);
    }

    /**
     * Configuration with every rule at its defaults.
     */
    public static LintConfiguration defaults() {
        return EMPTY;
    }

    /**
     * Settings for a rule, falling back to defaults.
     */
    public RuleSettings settingsFor(String ruleId) {
        return rules.getOrDefault(ruleId, RuleSettings.defaults());
    }

    /**
     * Builder-style method to replace a rule's settings.
     */
    public LintConfiguration with(String ruleId, RuleSettings settings) {
        var updated = new HashMap<>(rules);
        updated.put(ruleId, settings);
        return new LintConfiguration(updated);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public LintConfiguration withDisabled(String ruleId) {
        return with(ruleId, RuleSettings.disabled());
    }

    /**
     * Builder-style method to override a rule's severity.
     */
    public LintConfiguration withSeverity(String ruleId, Severity severity) {
        RuleSettings current = settingsFor(ruleId);
        return with(ruleId, new RuleSettings(current.enabled(), severity, current.parameters()));
    }
}
