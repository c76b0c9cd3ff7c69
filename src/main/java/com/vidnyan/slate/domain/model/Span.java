package com.vidnyan.slate.domain.model;

/**
 * Contiguous half-open range of source text: [start.offset, end.offset).
 * Immutable value object.
 */
public record Span(
    Position start,
    Position end
) {

    public Span {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Span bounds must not be null");
        }
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException(
                    "Span end " + end.offset() + " precedes start " + start.offset());
        }
    }

    /**
     * Zero-width span at a single position.
     */
    public static Span at(Position position) {
        return new Span(position, position);
    }

    public int startOffset() {
        return start.offset();
    }

    public int endOffset() {
        return end.offset();
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /**
     * True when the other span lies entirely within this one.
     */
    public boolean contains(Span other) {
        return other.startOffset() >= startOffset() && other.endOffset() <= endOffset();
    }

    /**
     * True when the two spans share at least one character.
     * Zero-width spans never overlap anything.
     */
    public boolean overlaps(Span other) {
        return !isEmpty() && !other.isEmpty()
                && other.startOffset() < endOffset() && startOffset() < other.endOffset();
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return start.format() + "-" + end.format();
    }
}
