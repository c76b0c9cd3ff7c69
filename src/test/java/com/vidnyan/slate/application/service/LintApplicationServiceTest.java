package com.vidnyan.slate.application.service;

import com.vidnyan.slate.adapter.out.parser.PlainTextParser;
import com.vidnyan.slate.adapter.out.parser.TextNodeKind;
import com.vidnyan.slate.adapter.out.rule.BuiltInRuleCatalog;
import com.vidnyan.slate.adapter.out.rule.FinalNewlineRule;
import com.vidnyan.slate.adapter.out.rule.TrailingWhitespaceRule;
import com.vidnyan.slate.application.port.in.LintUseCase.FixRequest;
import com.vidnyan.slate.application.port.in.LintUseCase.LintRequest;
import com.vidnyan.slate.application.port.out.SourceParser;
import com.vidnyan.slate.domain.diagnostic.Diagnostic;
import com.vidnyan.slate.domain.diagnostic.FixReport;
import com.vidnyan.slate.domain.diagnostic.LintReport;
import com.vidnyan.slate.domain.diagnostic.LintStatus;
import com.vidnyan.slate.domain.engine.FixApplier;
import com.vidnyan.slate.domain.engine.FixConflictPolicy;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.SyntaxTree;
import com.vidnyan.slate.domain.rule.LintConfiguration;
import com.vidnyan.slate.domain.rule.Rule;
import com.vidnyan.slate.domain.rule.RuleRegistry;
import com.vidnyan.slate.support.TestKind;
import com.vidnyan.slate.support.TestRule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.vidnyan.slate.support.Trees.branch;
import static com.vidnyan.slate.support.Trees.leaf;
import static org.junit.jupiter.api.Assertions.*;

class LintApplicationServiceTest {

    private static LintApplicationService service(List<? extends Rule> rules) {
        return service(List.of(new PlainTextParser()), rules);
    }

    private static LintApplicationService service(List<SourceParser> parsers, List<? extends Rule> rules) {
        RuleRegistry registry = RuleRegistry.build(rules, LintConfiguration.defaults());
        return new LintApplicationService(parsers, registry, new FixApplier(FixConflictPolicy.SKIP_ALL));
    }

    // Flags every WORD "a"; the fix doubles it, introducing exactly one new violation per pass
    private static TestRule doublingRule() {
        return TestRule.on("no-a", TextNodeKind.WORD).markFixable()
                .evaluating((node, ctx) -> "a".equals(node.text().orElse(""))
                        ? List.of(ctx.finding(node.span(), "word 'a'", ctx.edit(node.span(), "a a")))
                        : List.of());
    }

    @Test
    void lint_ShouldBeIdempotent() {
        LintApplicationService service = service(BuiltInRuleCatalog.defaultRules());
        String text = "\tindented  \nline without newline";

        LintReport first = service.lint(LintRequest.of("notes.txt", text));
        LintReport second = service.lint(LintRequest.of("notes.txt", text));

        assertEquals(first, second);
        assertEquals(List.of("no-tab-indent", "trailing-whitespace", "final-newline"),
                first.diagnostics().stream().map(Diagnostic::ruleId).toList());
    }

    @Test
    void lint_ShouldNotDependOnRuleRegistrationOrder() {
        List<Rule> rules = new ArrayList<>(BuiltInRuleCatalog.defaultRules());
        rules.add(doublingRule());
        List<Rule> reversed = new ArrayList<>(rules);
        Collections.reverse(reversed);
        String text = "a b\t \n\ta\n" + "x".repeat(130);

        LintReport forward = service(rules).lint(LintRequest.of("notes.txt", text));
        LintReport backward = service(reversed).lint(LintRequest.of("notes.txt", text));

        assertEquals(forward.diagnostics(), backward.diagnostics());
        assertFalse(forward.diagnostics().isEmpty());
    }

    @Test
    void lint_ShouldReportParseFailureWithoutRuleDiagnostics() {
        LintApplicationService service = service(BuiltInRuleCatalog.defaultRules());

        LintReport report = service.lint(LintRequest.of("blob.bin", "data\u0000  \n"));

        assertEquals(LintStatus.PARSE_FAILED, report.status());
        assertEquals(1, report.diagnostics().size());
        assertEquals(Diagnostic.SYNTAX_ERROR_RULE_ID, report.diagnostics().get(0).ruleId());
        assertEquals(4, report.diagnostics().get(0).span().startOffset());
    }

    @Test
    void lint_ShouldTreatMalformedTreeAsParseFailure() {
        SourceParser broken = new SourceParser() {
            @Override
            public boolean supports(String fileName) {
                return true;
            }

            @Override
            public SyntaxTree parse(String text) {
                Node root = branch(text, TestKind.ROOT, 0, 4,
                        leaf(text, TestKind.TOKEN, 0, 3),
                        leaf(text, TestKind.TOKEN, 2, 4));
                return SyntaxTree.of(text, root);
            }
        };

        LintReport report = service(List.of(broken), List.of(TestRule.on("any", TestKind.TOKEN)))
                .lint(LintRequest.of("x", "abcd"));

        assertEquals(LintStatus.PARSE_FAILED, report.status());
        assertTrue(report.diagnostics().get(0).message().startsWith("Malformed syntax tree"));
    }

    @Test
    void lint_ShouldReportMissingParser() {
        LintReport report = service(List.of(), BuiltInRuleCatalog.defaultRules())
                .lint(LintRequest.of("Main.java", "class Main {}"));

        assertEquals(LintStatus.PARSE_FAILED, report.status());
    }

    @Test
    void fix_ShouldApplyFixesUntilClean() {
        // Arrange
        LintApplicationService service = service(BuiltInRuleCatalog.defaultRules());

        // Act
        FixReport report = service.fix(FixRequest.of("notes.txt", "\tfirst  \nsecond\t", 5));

        // Assert
        assertEquals("    first\nsecond\n", report.correctedText());
        assertEquals(1, report.iterationsUsed());
        assertTrue(report.remainingDiagnostics().isEmpty());
        assertEquals(LintStatus.CLEAN, report.status());
    }

    @Test
    void fix_ShouldStopAtIterationLimit() {
        LintApplicationService service = service(List.of(doublingRule()));

        FixReport report = service.fix(FixRequest.of("notes.txt", "a", 1));

        assertEquals(1, report.iterationsUsed());
        assertEquals("a a", report.correctedText());
        assertEquals(2, report.remainingDiagnostics().size());
        assertTrue(report.remainingDiagnostics().stream()
                .allMatch(d -> LintApplicationService.NOTE_ITERATION_LIMIT.equals(d.note())));
    }

    @Test
    void fix_ShouldReportConflictsAndLeaveTextUntouched() {
        // Arrange
        TestRule upper = TestRule.on("upper", TextNodeKind.DOCUMENT).markFixable()
                .evaluating((node, ctx) -> List.of(ctx.finding(ctx.lines().span(0, 4), "upper",
                        ctx.edit(ctx.lines().span(0, 4), "ABCD"))));
        TestRule reverse = TestRule.on("reverse", TextNodeKind.DOCUMENT).markFixable()
                .evaluating((node, ctx) -> List.of(ctx.finding(ctx.lines().span(2, 6), "reverse",
                        ctx.edit(ctx.lines().span(2, 6), "fedc"))));
        LintApplicationService service = service(List.of(upper, reverse));

        // Act
        FixReport report = service.fix(FixRequest.of("notes.txt", "abcdefgh", 3));

        // Assert
        assertEquals("abcdefgh", report.correctedText());
        assertEquals(0, report.iterationsUsed());
        assertEquals(1, report.conflicts().size());
        assertEquals(LintApplicationService.NOTE_CONFLICT + "reverse", report.remainingDiagnostics().get(0).note());
        assertEquals(LintApplicationService.NOTE_CONFLICT + "upper", report.remainingDiagnostics().get(1).note());
    }

    @Test
    void fix_ShouldKeepPreviousTextWhenFixBreaksParsing() {
        TestRule poison = TestRule.on("poison", TextNodeKind.DOCUMENT).markFixable()
                .evaluating((node, ctx) -> List.of(ctx.finding(ctx.lines().span(0, 1), "poison",
                        ctx.edit(ctx.lines().span(0, 1), "\u0000"))));
        LintApplicationService service = service(List.of(poison));

        FixReport report = service.fix(FixRequest.of("notes.txt", "text", 3));

        assertEquals("text", report.correctedText());
        assertEquals(0, report.iterationsUsed());
        assertEquals(LintApplicationService.NOTE_UNPARSEABLE, report.remainingDiagnostics().get(0).note());
    }

    @Test
    void fix_ShouldIgnoreEditsFromRulesThatAreNotFixable() {
        TestRule advisory = TestRule.on("advisory", TextNodeKind.DOCUMENT)
                .evaluating((node, ctx) -> List.of(ctx.finding(ctx.lines().span(0, 1), "advice",
                        ctx.edit(ctx.lines().span(0, 1), "T"))));

        FixReport report = service(List.of(advisory)).fix(FixRequest.of("notes.txt", "text", 3));

        assertEquals("text", report.correctedText());
        assertEquals(1, report.remainingDiagnostics().size());
        assertNull(report.remainingDiagnostics().get(0).fix());
    }

    @Test
    void fixRequest_ShouldRequireAtLeastOneIteration() {
        assertThrows(IllegalArgumentException.class, () -> FixRequest.of("x", "y", 0));
    }

    @Test
    void lint_ShouldReportFinalNewlineAsZeroWidthSpanAtEnd() {
        LintReport report = service(List.of(new FinalNewlineRule(), new TrailingWhitespaceRule()))
                .lint(LintRequest.of("notes.txt", "end "));

        assertEquals(2, report.diagnostics().size());
        Diagnostic last = report.diagnostics().get(1);
        assertEquals("final-newline", last.ruleId());
        assertEquals(4, last.span().startOffset());
        assertTrue(last.span().isEmpty());
    }

    @Test
    void fix_ShouldCleanWhitespaceOnlyLinesWithTabsUsingDefaultRules() {
        LintApplicationService service = service(BuiltInRuleCatalog.defaultRules());

        FixReport report = service.fix(FixRequest.of("notes.txt", "x  \n\t \ny\n", 5));

        assertEquals("x\n\ny\n", report.correctedText());
        assertTrue(report.conflicts().isEmpty());
        assertTrue(report.remainingDiagnostics().isEmpty());
        assertEquals(1, report.iterationsUsed());
    }
}
