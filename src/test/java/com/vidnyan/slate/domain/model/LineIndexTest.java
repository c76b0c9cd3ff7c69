package com.vidnyan.slate.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineIndexTest {

    @Test
    void position_ShouldResolveLinesForAllTerminators() {
        LineIndex lines = LineIndex.of("ab\ncd\r\nef\rgh");

        assertEquals(4, lines.lineCount());
        assertEquals(new Position(1, 1, 0), lines.position(0));
        assertEquals(new Position(1, 3, 2), lines.position(2));
        assertEquals(new Position(2, 1, 3), lines.position(3));
        assertEquals(new Position(3, 1, 7), lines.position(7));
        assertEquals(new Position(4, 2, 11), lines.position(11));
        assertEquals(new Position(4, 3, 12), lines.position(12));
    }

    @Test
    void lineText_ShouldExcludeTerminator() {
        LineIndex lines = LineIndex.of("first\r\nsecond\n");

        assertEquals("first", lines.lineText(1));
        assertEquals("second", lines.lineText(2));
        assertEquals("", lines.lineText(3));
        assertEquals(5, lines.contentEnd(1));
        assertEquals(7, lines.lineStart(2));
    }

    @Test
    void offset_ShouldClampColumnToLineContent() {
        LineIndex lines = LineIndex.of("abc\ndefgh");

        assertEquals(5, lines.offset(2, 2));
        assertEquals(3, lines.offset(1, 40));
    }

    @Test
    void emptyText_ShouldHaveOneEmptyLine() {
        LineIndex lines = LineIndex.of("");

        assertEquals(1, lines.lineCount());
        assertTrue(lines.fullSpan().isEmpty());
        assertEquals(Position.origin(), lines.position(0));
    }

    @Test
    void position_ShouldRejectOffsetsOutsideText() {
        LineIndex lines = LineIndex.of("abc");

        assertThrows(IndexOutOfBoundsException.class, () -> lines.position(4));
        assertThrows(IndexOutOfBoundsException.class, () -> lines.position(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> lines.lineStart(2));
    }
}
