package com.vidnyan.slate.domain.rule;

import com.vidnyan.slate.domain.model.Span;

/**
 * A proposed text replacement over a span, tagged with the rule that proposed it.
 * Pure data: edits are only consumed by the fix applier, never re-entered into the tree.
 */
public record Edit(
    String ruleId,
    Span span,
    String replacement
) {

    public Edit {
        if (ruleId == null || span == null || replacement == null) {
            throw new IllegalArgumentException("Edit requires rule id, span and replacement");
        }
    }

    public int startOffset() {
        return span.startOffset();
    }

    public int endOffset() {
        return span.endOffset();
    }

    /**
     * True when the same rule proposed both edits over the same span with the same text.
     */
    public boolean sameChangeAs(Edit other) {
        return ruleId.equals(other.ruleId)
                && span.startOffset() == other.span.startOffset()
                && span.endOffset() == other.span.endOffset()
                && replacement.equals(other.replacement);
    }
}
