package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.domain.diagnostic.LintReport;
import com.vidnyan.slate.domain.rule.Severity;
import com.vidnyan.slate.support.RuleHarness;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FinalNewlineRuleTest {

    private final RuleHarness harness = RuleHarness.of(new FinalNewlineRule());

    @Test
    void shouldFlagMissingTerminatorAtEndOfFile() {
        LintReport report = harness.lint("Main.java", "class Main {}");

        assertEquals(1, report.diagnostics().size());
        assertEquals(Severity.INFO, report.diagnostics().get(0).severity());
        assertEquals(13, report.diagnostics().get(0).span().startOffset());
    }

    @Test
    void shouldAcceptAnyTerminatorAndEmptyFiles() {
        assertTrue(harness.lint("a.txt", "x\n").diagnostics().isEmpty());
        assertTrue(harness.lint("a.txt", "x\r\n").diagnostics().isEmpty());
        assertTrue(harness.lint("a.txt", "x\r").diagnostics().isEmpty());
        assertTrue(harness.lint("a.txt", "").diagnostics().isEmpty());
    }

    @Test
    void shouldAppendNewline() {
        assertEquals("last line\n", harness.fix("a.txt", "last line").correctedText());
    }
}
