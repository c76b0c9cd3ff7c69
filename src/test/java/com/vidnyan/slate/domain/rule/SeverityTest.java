package com.vidnyan.slate.domain.rule;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeverityTest {

    @Test
    void parse_ShouldAcceptAnyCaseAndWarningAlias() {
        assertEquals(Severity.WARN, Severity.parse("warning"));
        assertEquals(Severity.ERROR, Severity.parse(" Error "));
        assertThrows(IllegalArgumentException.class, () -> Severity.parse("fatal"));
    }

    @Test
    void isAtLeast_ShouldRankBlockerHighest() {
        assertTrue(Severity.BLOCKER.isAtLeast(Severity.ERROR));
        assertTrue(Severity.ERROR.isAtLeast(Severity.ERROR));
        assertFalse(Severity.WARN.isAtLeast(Severity.ERROR));
    }
}
