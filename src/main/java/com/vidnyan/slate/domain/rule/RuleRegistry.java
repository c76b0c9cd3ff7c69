package com.vidnyan.slate.domain.rule;

import com.vidnyan.slate.domain.model.NodeKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The configured set of active rules, indexed by node kind for O(1) dispatch.
 * Built once before any file is processed and never mutated afterwards, so it is safe for
 * concurrent reads.
 */
@Slf4j
public final class RuleRegistry {

    private final List<RegisteredRule> activeRules;
    private final Map<String, RegisteredRule> activeById;
    private final Set<String> disabledIds;
    private final Map<NodeKind, List<RegisteredRule>> byKind;
    private final List<String> warnings;

    private RuleRegistry(
            List<RegisteredRule> activeRules,
            Set<String> disabledIds,
            Map<NodeKind, List<RegisteredRule>> byKind,
            List<String> warnings
    ) {
        this.activeRules = List.copyOf(activeRules);
        Map<String, RegisteredRule> ids = new LinkedHashMap<>();
        activeRules.forEach(r -> ids.put(r.id(), r));
        this.activeById = Collections.unmodifiableMap(ids);
        this.disabledIds = Set.copyOf(disabledIds);
        Map<NodeKind, List<RegisteredRule>> index = new HashMap<>();
        byKind.forEach((kind, rules) -> index.put(kind, List.copyOf(rules)));
        this.byKind = Collections.unmodifiableMap(index);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Resolve the active rule set from a catalog and a configuration.
     *
     * @throws DuplicateRuleException        when two catalog rules share an id
     * @throws InvalidConfigurationException when a rule is malformed or rejects its parameters
     */
    public static RuleRegistry build(List<? extends Rule> catalog, LintConfiguration configuration) {
        Set<String> seen = new HashSet<>();
        Set<String> disabled = new HashSet<>();
        List<RegisteredRule> active = new ArrayList<>();
        Map<NodeKind, List<RegisteredRule>> index = new HashMap<>();

        for (Rule rule : catalog) {
            String id = rule.id();
            if (id == null || id.isBlank()) {
                throw new InvalidConfigurationException(
                        "Rule " + rule.getClass().getName() + " has no id");
            }
            if (!seen.add(id)) {
                throw new DuplicateRuleException(id);
            }
            if (rule.interestedKinds() == null || rule.interestedKinds().isEmpty()) {
                throw new InvalidConfigurationException("Rule " + id + " declares no node kinds");
            }

            RuleSettings settings = configuration.settingsFor(id);
            if (!settings.enabled()) {
                disabled.add(id);
                log.debug("Rule {} is disabled", id);
                continue;
            }

            validate(rule, settings.parameters());
            Severity severity = settings.severity().orElse(rule.defaultSeverity());
            RegisteredRule registered = new RegisteredRule(rule, severity, settings.parameters());
            active.add(registered);
            for (NodeKind kind : rule.interestedKinds()) {
                index.computeIfAbsent(kind, k -> new ArrayList<>()).add(registered);
            }
        }

        List<String> warnings = new ArrayList<>();
        configuration.rules().keySet().stream()
                .filter(id -> !seen.contains(id))
                .sorted()
                .forEach(id -> warnings.add("Unknown rule in configuration: " + id));
        warnings.forEach(log::warn);

        log.info("Registered {} active rules ({} disabled)", active.size(), disabled.size());
        return new RuleRegistry(active, disabled, index, warnings);
    }

    private static void validate(Rule rule, RuleParameters parameters) {
        try {
            rule.validate(parameters);
        } catch (InvalidConfigurationException e) {
            throw new InvalidConfigurationException("Rule " + rule.id() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new InvalidConfigurationException(
                    "Rule " + rule.id() + " failed to validate its parameters: " + e.getMessage(), e);
        }
    }

    /**
     * Active rules interested in a kind, in registration order.
     */
    public List<RegisteredRule> rulesFor(NodeKind kind) {
        return byKind.getOrDefault(kind, List.of());
    }

    /**
     * Active rules in registration order.
     */
    public List<RegisteredRule> activeRules() {
        return activeRules;
    }

    public Optional<RegisteredRule> find(String ruleId) {
        return Optional.ofNullable(activeById.get(ruleId));
    }

    public boolean isActive(String ruleId) {
        return activeById.containsKey(ruleId);
    }

    public boolean isDisabled(String ruleId) {
        return disabledIds.contains(ruleId);
    }

    /**
     * Non-fatal configuration warnings, e.g. unknown rule ids.
     */
    public List<String> warnings() {
        return warnings;
    }
}
