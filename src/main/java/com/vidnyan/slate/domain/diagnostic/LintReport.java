package com.vidnyan.slate.domain.diagnostic;

import com.vidnyan.slate.domain.rule.Severity;

import java.util.List;

/**
 * Result of linting one file.
 */
public record LintReport(
    String filePath,
    List<Diagnostic> diagnostics,
    LintStatus status
) {

    public LintReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return status == LintStatus.CLEAN;
    }

    public int count(Severity severity) {
        return (int) diagnostics.stream()
                .filter(d -> d.severity() == severity)
                .count();
    }

    /**
     * Diagnostics whose proposed fix is still pending.
     */
    public List<Diagnostic> fixable() {
        return diagnostics.stream()
                .filter(d -> d.fix() != null)
                .toList();
    }
}
