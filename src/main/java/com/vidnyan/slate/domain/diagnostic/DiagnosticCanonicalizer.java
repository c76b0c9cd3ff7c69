package com.vidnyan.slate.domain.diagnostic;

import com.vidnyan.slate.domain.rule.Edit;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.RegisteredRule;
import com.vidnyan.slate.domain.rule.RuleRegistry;
import com.vidnyan.slate.domain.rule.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw findings into the ordered, deduplicated diagnostic sequence.
 *
 * <ol>
 *   <li>apply the configured severity override, else the rule's default;</li>
 *   <li>drop findings of disabled or unregistered rules;</li>
 *   <li>collapse findings with identical (rule, span, message);</li>
 *   <li>sort by start position, then rule id.</li>
 * </ol>
 * Proposed edits survive only for rules marked fixable.
 * The result is independent of rule registration order.
 */
@Slf4j
public final class DiagnosticCanonicalizer {

    private final RuleRegistry registry;

    public DiagnosticCanonicalizer(RuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * Canonicalize the findings of one file.
     */
    public List<Diagnostic> canonicalize(String filePath, Collection<Finding> findings) {
        Map<Diagnostic.DedupKey, Diagnostic> unique = new LinkedHashMap<>();
        int dropped = 0;

        for (Finding finding : findings) {
            Optional<Diagnostic> diagnostic = toDiagnostic(filePath, finding);
            if (diagnostic.isEmpty()) {
                dropped++;
                continue;
            }
            unique.putIfAbsent(diagnostic.get().dedupKey(), diagnostic.get());
        }

        List<Diagnostic> ordered = new ArrayList<>(unique.values());
        ordered.sort(Diagnostic.ORDER);
        log.debug("Canonicalized {} findings into {} diagnostics ({} dropped)",
                findings.size(), ordered.size(), dropped);
        return List.copyOf(ordered);
    }

    private Optional<Diagnostic> toDiagnostic(String filePath, Finding finding) {
        String ruleId = finding.ruleId();
        if (Diagnostic.isReservedId(ruleId)) {
            return Optional.of(new Diagnostic(
                    filePath, ruleId, finding.severity(), finding.span(), finding.message(), null, null));
        }
        if (registry.isDisabled(ruleId)) {
            return Optional.empty();
        }

        Optional<RegisteredRule> registered = registry.find(ruleId);
        if (registered.isEmpty()) {
            log.debug("Dropping finding from unregistered rule {}", ruleId);
            return Optional.empty();
        }

        RegisteredRule rule = registered.get();
        Severity severity = rule.severity();
        Edit fix = rule.fixable() ? finding.fix() : null;
        return Optional.of(new Diagnostic(filePath, ruleId, severity, finding.span(), finding.message(), fix, null));
    }

    /**
     * Run status for a set of canonical diagnostics of a parsed file.
     */
    public static LintStatus statusOf(List<Diagnostic> diagnostics) {
        boolean failing = diagnostics.stream()
                .anyMatch(d -> d.severity().isAtLeast(Severity.ERROR));
        return failing ? LintStatus.VIOLATIONS : LintStatus.CLEAN;
    }
}
