package com.vidnyan.slate.domain.engine;

import com.vidnyan.slate.domain.rule.Edit;

/**
 * Two proposed edits that cannot both be applied.
 * {@code first} starts at or before {@code second}.
 */
public record FixConflict(
    Edit first,
    Edit second
) {

    /**
     * Start of the contested region.
     */
    public int sharedStart() {
        return second.startOffset();
    }

    /**
     * End of the contested region. Equals {@link #sharedStart()} when both edits meet at one point.
     */
    public int sharedEnd() {
        return Math.max(sharedStart(), Math.min(first.endOffset(), second.endOffset()));
    }

    /**
     * True when the edit, or an identical change from another rule, takes part in this conflict.
     */
    public boolean involves(Edit edit) {
        return first.sameChangeAs(edit) || second.sameChangeAs(edit);
    }

    /**
     * The rule on the other side of the conflict from the given edit.
     */
    public String opponentOf(Edit edit) {
        return first.sameChangeAs(edit) ? second.ruleId() : first.ruleId();
    }

    public String describe() {
        return "rules '" + first.ruleId() + "' and '" + second.ruleId()
                + "' both edit [" + sharedStart() + "," + sharedEnd() + ")";
    }
}
