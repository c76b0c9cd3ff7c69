package com.vidnyan.slate.domain.rule;

import java.util.Map;
import java.util.Optional;

/**
 * Per-rule configuration: enabled flag, optional severity override and rule parameters.
 */
public record RuleSettings(
    boolean enabled,
    Severity severityOverride,
    RuleParameters parameters
) {

    private static final RuleSettings DEFAULTS = new RuleSettings(true, null, RuleParameters.empty());

    public RuleSettings {
        parameters = parameters == null ? RuleParameters.empty() : parameters;
    }

    /**
     * Settings used for rules not mentioned in the configuration.
     */
    public static RuleSettings defaults() {
        return DEFAULTS;
    }

    public static RuleSettings disabled() {
        return new RuleSettings(false, null, RuleParameters.empty());
    }

    public static RuleSettings withSeverity(Severity severity) {
        return new RuleSettings(true, severity, RuleParameters.empty());
    }

    public static RuleSettings withParameters(Map<String, Object> parameters) {
        return new RuleSettings(true, null, new RuleParameters(parameters));
    }

    public Optional<Severity> severity() {
        return Optional.ofNullable(severityOverride);
    }
}
