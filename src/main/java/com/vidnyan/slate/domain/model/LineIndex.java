package com.vidnyan.slate.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Precomputed line table for one source text.
 * Maps offsets to positions and back. Recognises \n, \r\n and \r as line terminators.
 * Immutable and thread-safe.
 */
public final class LineIndex {

    private final String text;
    private final int[] lineStarts;
    private final int[] contentEnds;

    private LineIndex(String text, int[] lineStarts, int[] contentEnds) {
        this.text = text;
        this.lineStarts = lineStarts;
        this.contentEnds = contentEnds;
    }

    /**
     * Build the index for a text.
     */
    public static LineIndex of(String text) {
        List<Integer> starts = new ArrayList<>();
        List<Integer> ends = new ArrayList<>();
        starts.add(0);

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                ends.add(i);
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
            i++;
        }
        ends.add(text.length());

        return new LineIndex(
                text,
                starts.stream().mapToInt(Integer::intValue).toArray(),
                ends.stream().mapToInt(Integer::intValue).toArray());
    }

    public String text() {
        return text;
    }

    /**
     * Number of lines. A trailing terminator opens a final empty line.
     */
    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Offset of the first character of a 1-based line.
     */
    public int lineStart(int line) {
        checkLine(line);
        return lineStarts[line - 1];
    }

    /**
     * Offset just past the last content character of a line, before its terminator.
     */
    public int contentEnd(int line) {
        checkLine(line);
        return contentEnds[line - 1];
    }

    /**
     * Line content without the terminator.
     */
    public String lineText(int line) {
        return text.substring(lineStart(line), contentEnd(line));
    }

    /**
     * Resolve an offset (0..text.length() inclusive) into a position.
     */
    public Position position(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + text.length() + "]");
        }
        int found = Arrays.binarySearch(lineStarts, offset);
        int lineIdx = found >= 0 ? found : -found - 2;
        return new Position(lineIdx + 1, offset - lineStarts[lineIdx] + 1, offset);
    }

    /**
     * Resolve a 1-based line and column into an offset.
     * Columns past the end of the line are clamped to the line's content end.
     */
    public int offset(int line, int column) {
        checkLine(line);
        int candidate = lineStarts[line - 1] + Math.max(column, 1) - 1;
        return Math.min(candidate, contentEnds[line - 1]);
    }

    /**
     * Span covering [startOffset, endOffset).
     */
    public Span span(int startOffset, int endOffset) {
        return new Span(position(startOffset), position(endOffset));
    }

    /**
     * Span covering the whole text.
     */
    public Span fullSpan() {
        return span(0, text.length());
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IndexOutOfBoundsException("Line " + line + " outside [1, " + lineStarts.length + "]");
        }
    }
}
