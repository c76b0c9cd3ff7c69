package com.vidnyan.slate.domain.diagnostic;

import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.rule.Edit;
import com.vidnyan.slate.domain.rule.Severity;

import java.util.Comparator;

/**
 * A canonical, reportable violation.
 * Immutable value object. Ordering is by file, start offset, then rule id.
 *
 * @param filePath caller-supplied file path, may be null for anonymous text
 * @param ruleId   id of the rule (or reserved id) that produced it
 * @param severity effective severity after configuration overrides
 * @param span     location in the source text
 * @param message  human-readable message
 * @param fix      proposed edit, null when the rule proposed none
 * @param note     annotation added by the fix phase, null when absent
 */
public record Diagnostic(
    String filePath,
    String ruleId,
    Severity severity,
    Span span,
    String message,
    Edit fix,
    String note
) {

    /** Reserved id for contained rule failures. */
    public static final String INTERNAL_ERROR_RULE_ID = "internal-error";

    /** Reserved id for parse failures. */
    public static final String SYNTAX_ERROR_RULE_ID = "syntax-error";

    /** Reserved id for files that could not be read. */
    public static final String IO_ERROR_RULE_ID = "io-error";

    /**
     * Externally observable ordering: file, start position, rule id.
     * End offset and message break remaining ties so the order is total.
     */
    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::filePath, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparingInt(d -> d.span().startOffset())
            .thenComparing(Diagnostic::ruleId)
            .thenComparingInt(d -> d.span().endOffset())
            .thenComparing(Diagnostic::message);

    public Diagnostic {
        if (ruleId == null || severity == null || span == null || message == null) {
            throw new IllegalArgumentException("Diagnostic requires rule id, severity, span and message");
        }
    }

    /**
     * Key under which identical findings collapse.
     */
    public record DedupKey(String ruleId, int startOffset, int endOffset, String message) {}

    public DedupKey dedupKey() {
        return new DedupKey(ruleId, span.startOffset(), span.endOffset(), message);
    }

    /**
     * True for diagnostics produced by the engine itself rather than a rule.
     */
    public boolean isReserved() {
        return isReservedId(ruleId);
    }

    public static boolean isReservedId(String ruleId) {
        return INTERNAL_ERROR_RULE_ID.equals(ruleId)
                || SYNTAX_ERROR_RULE_ID.equals(ruleId)
                || IO_ERROR_RULE_ID.equals(ruleId);
    }

    /**
     * Copy with a fix-phase annotation.
     */
    public Diagnostic withNote(String annotation) {
        return new Diagnostic(filePath, ruleId, severity, span, message, fix, annotation);
    }

    /**
     * Format for single-line display.
     */
    public String format() {
        String location = (filePath == null ? "<input>" : filePath) + ":" + span.start().format();
        String text = location + " " + severity + " [" + ruleId + "] " + message;
        return note == null ? text : text + " (" + note + ")";
    }
}
