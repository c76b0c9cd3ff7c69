package com.vidnyan.slate.domain.model;

/**
 * A point in source text.
 * Line and column are 1-based, offset is a 0-based index into the source string.
 */
public record Position(
    int line,
    int column,
    int offset
) implements Comparable<Position> {

    public Position {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException(
                    "Invalid position line=" + line + " column=" + column + " offset=" + offset);
        }
    }

    /**
     * Start of any text.
     */
    public static Position origin() {
        return new Position(1, 1, 0);
    }

    @Override
    public int compareTo(Position other) {
        return Integer.compare(offset, other.offset);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return line + ":" + column;
    }
}
