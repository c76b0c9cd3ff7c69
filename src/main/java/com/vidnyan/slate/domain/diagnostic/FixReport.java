package com.vidnyan.slate.domain.diagnostic;

import com.vidnyan.slate.domain.engine.FixConflict;

import java.util.List;

/**
 * Result of the bounded fix loop for one file.
 *
 * @param filePath             caller-supplied file path
 * @param correctedText        text after all applied passes
 * @param remainingDiagnostics diagnostics of the corrected text, annotated where a fix was withheld
 * @param iterationsUsed       number of passes that applied at least one edit
 * @param conflicts            conflicts detected across all passes
 * @param status               lint status of the corrected text
 */
public record FixReport(
    String filePath,
    String correctedText,
    List<Diagnostic> remainingDiagnostics,
    int iterationsUsed,
    List<FixConflict> conflicts,
    LintStatus status
) {

    public FixReport {
        remainingDiagnostics = List.copyOf(remainingDiagnostics);
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
