package com.vidnyan.slate.domain.rule;

import com.vidnyan.slate.domain.model.Span;

/**
 * Raw rule output before canonicalization.
 * Severity is the rule's default; configuration overrides are applied later.
 */
public record Finding(
    String ruleId,
    Severity severity,
    Span span,
    String message,
    Edit fix
) {

    public Finding {
        if (ruleId == null || severity == null || span == null || message == null) {
            throw new IllegalArgumentException("Finding requires rule id, severity, span and message");
        }
    }

    /**
     * Create a finding without a proposed fix.
     */
    public static Finding of(String ruleId, Severity severity, Span span, String message) {
        return new Finding(ruleId, severity, span, message, null);
    }}
