package com.vidnyan.slate.domain.engine;

import com.vidnyan.slate.domain.rule.Edit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies non-overlapping text edits to a source text.
 *
 * Edits are sorted by start offset and scanned once. Two edits conflict when their spans overlap or
 * when two different edits start at the same offset (zero-width insertions included): no implicit
 * ordering between them is assumed safe, even when both make the same change. Repeated identical
 * edits from one rule are collapsed.
 * Text outside edited spans is preserved verbatim.
 *
 * Sequential and stateless; safe to share.
 */
@Slf4j
public final class FixApplier {

    private static final Comparator<Edit> EDIT_ORDER = Comparator
            .comparingInt(Edit::startOffset)
            .thenComparingInt(Edit::endOffset)
            .thenComparing(Edit::replacement)
            .thenComparing(Edit::ruleId);

    private final FixConflictPolicy policy;

    public FixApplier(FixConflictPolicy policy) {
        this.policy = policy;
    }

    /**
     * Outcome of one fix pass.
     *
     * @param text      corrected text (the input text when nothing was applied)
     * @param applied   edits applied, in text order
     * @param rejected  edits withheld because of conflicts
     * @param conflicts detected conflicting pairs
     */
    public record FixOutcome(
        String text,
        List<Edit> applied,
        List<Edit> rejected,
        List<FixConflict> conflicts
    ) {
        public boolean hasConflicts() {
            return !conflicts.isEmpty();
        }

        public boolean changed(String original) {
            return !applied.isEmpty() && !text.equals(original);
        }
    }

    /**
     * Apply a batch of edits.
     *
     * @throws IllegalArgumentException when an edit lies outside the text
     */
    public FixOutcome apply(String text, Collection<Edit> edits) {
        List<Edit> sorted = new ArrayList<>(edits);
        sorted.sort(EDIT_ORDER);
        for (Edit edit : sorted) {
            if (edit.endOffset() > text.length()) {
                throw new IllegalArgumentException("Edit from rule " + edit.ruleId()
                        + " ends at " + edit.endOffset() + " past text length " + text.length());
            }
        }

        List<Edit> unique = collapseDuplicates(sorted);
        List<FixConflict> conflicts = findConflicts(unique);

        Map<Edit, Boolean> conflicted = new IdentityHashMap<>();
        for (FixConflict conflict : conflicts) {
            conflicted.put(conflict.first(), Boolean.TRUE);
            conflicted.put(conflict.second(), Boolean.TRUE);
        }

        List<Edit> applicable = new ArrayList<>();
        List<Edit> rejected = new ArrayList<>();
        for (Edit edit : unique) {
            boolean withhold = policy == FixConflictPolicy.SKIP_ALL
                    ? !conflicts.isEmpty()
                    : conflicted.containsKey(edit);
            if (withhold) {
                rejected.add(edit);
            } else {
                applicable.add(edit);
            }
        }

        if (!conflicts.isEmpty()) {
            conflicts.forEach(c -> log.info("Fix conflict: {}", c.describe()));
        }
        String corrected = splice(text, applicable);
        log.debug("Applied {} edits, withheld {}", applicable.size(), rejected.size());
        return new FixOutcome(corrected, List.copyOf(applicable), List.copyOf(rejected), List.copyOf(conflicts));
    }

    private static List<Edit> collapseDuplicates(List<Edit> sorted) {
        List<Edit> unique = new ArrayList<>(sorted.size());
        for (Edit edit : sorted) {
            if (unique.isEmpty() || !unique.get(unique.size() - 1).sameChangeAs(edit)) {
                unique.add(edit);
            }
        }
        return unique;
    }

    private static List<FixConflict> findConflicts(List<Edit> sorted) {
        List<FixConflict> conflicts = new ArrayList<>();
        Edit previous = null;
        Edit furthest = null;
        for (Edit edit : sorted) {
            if (previous != null && previous.startOffset() == edit.startOffset()) {
                conflicts.add(new FixConflict(previous, edit));
            } else if (furthest != null && edit.startOffset() < furthest.endOffset()) {
                conflicts.add(new FixConflict(furthest, edit));
            }
            if (furthest == null || edit.endOffset() > furthest.endOffset()) {
                furthest = edit;
            }
            previous = edit;
        }
        return conflicts;
    }

    private static String splice(String text, List<Edit> edits) {
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        for (Edit edit : edits) {
            if (edit.startOffset() < cursor) {
                throw new IllegalStateException("Overlapping edit from rule " + edit.ruleId() + " reached splice");
            }
            out.append(text, cursor, edit.startOffset());
            out.append(edit.replacement());
            cursor = edit.endOffset();
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }
}
