package com.vidnyan.slate.application.service;

import com.vidnyan.slate.application.port.in.LintUseCase;
import com.vidnyan.slate.application.port.out.SourceParser;
import com.vidnyan.slate.application.port.out.SourceSyntaxException;
import com.vidnyan.slate.domain.diagnostic.Diagnostic;
import com.vidnyan.slate.domain.diagnostic.DiagnosticCanonicalizer;
import com.vidnyan.slate.domain.diagnostic.FixReport;
import com.vidnyan.slate.domain.diagnostic.LintReport;
import com.vidnyan.slate.domain.diagnostic.LintStatus;
import com.vidnyan.slate.domain.engine.FixApplier;
import com.vidnyan.slate.domain.engine.FixApplier.FixOutcome;
import com.vidnyan.slate.domain.engine.FixConflict;
import com.vidnyan.slate.domain.engine.TraversalEngine;
import com.vidnyan.slate.domain.engine.TraversalEngine.TraversalResult;
import com.vidnyan.slate.domain.model.Position;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.model.SyntaxTree;
import com.vidnyan.slate.domain.rule.Edit;
import com.vidnyan.slate.domain.rule.RuleRegistry;
import com.vidnyan.slate.domain.rule.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-file pipeline: parse, evaluate, canonicalize and, on request, fix.
 *
 * Holds only read-only collaborators (parsers, registry, engines), so one instance can serve
 * many files concurrently. Every failure scoped to one file is turned into diagnostics of that file.
 */
@Slf4j
@Service
public class LintApplicationService implements LintUseCase {

    static final String NOTE_CONFLICT = "fix not applied: conflicts with rule ";
    static final String NOTE_PASS_SKIPPED = "fix not applied: pass skipped because of conflicting fixes";
    static final String NOTE_ITERATION_LIMIT = "fix not applied: iteration limit reached";
    static final String NOTE_NO_EFFECT = "fix not applied: edit leaves the text unchanged";
    static final String NOTE_UNPARSEABLE = "fix not applied: corrected text does not parse";

    private final List<SourceParser> parsers;
    private final FixApplier fixApplier;
    private final TraversalEngine traversalEngine;
    private final DiagnosticCanonicalizer canonicalizer;

    public LintApplicationService(List<SourceParser> parsers, RuleRegistry registry, FixApplier fixApplier) {
        this.parsers = List.copyOf(parsers);
        this.fixApplier = fixApplier;
        this.traversalEngine = new TraversalEngine(registry);
        this.canonicalizer = new DiagnosticCanonicalizer(registry);
    }

    @Override
    public LintReport lint(LintRequest request) {
        return lint(request.filePath(), request.text());
    }

    @Override
    public FixReport fix(FixRequest request) {
        String filePath = request.filePath();
        String text = request.text();
        int iterations = 0;
        Set<FixConflict> conflicts = new LinkedHashSet<>();

        LintReport report = lint(filePath, text);
        while (report.status() != LintStatus.PARSE_FAILED) {
            List<Edit> edits = report.fixable().stream()
                    .map(Diagnostic::fix)
                    .toList();
            if (edits.isEmpty()) {
                break;
            }
            if (iterations >= request.maxIterations()) {
                log.info("Fix iteration limit {} reached for {} with {} pending fixes",
                        request.maxIterations(), displayName(filePath), edits.size());
                report = annotatePending(report, NOTE_ITERATION_LIMIT);
                break;
            }

            FixOutcome outcome = fixApplier.apply(text, edits);
            conflicts.addAll(outcome.conflicts());
            if (outcome.applied().isEmpty()) {
                report = annotateRejected(report, outcome);
                break;
            }
            if (!outcome.changed(text)) {
                report = annotatePending(report, NOTE_NO_EFFECT);
                break;
            }

            LintReport next = lint(filePath, outcome.text());
            if (next.status() == LintStatus.PARSE_FAILED) {
                log.warn("Fixes for {} produced text that does not parse; keeping the previous text",
                        displayName(filePath));
                report = annotatePending(report, NOTE_UNPARSEABLE);
                break;
            }

            iterations++;
            text = outcome.text();
            report = next;
            log.debug("Fix pass {} for {} applied {} edits", iterations, displayName(filePath),
                    outcome.applied().size());
        }

        return new FixReport(filePath, text, report.diagnostics(), iterations,
                new ArrayList<>(conflicts), report.status());
    }

    /**
     * Lint one text: parse, verify the tree, traverse, canonicalize.
     */
    LintReport lint(String filePath, String text) {
        Optional<SourceParser> parser = findParser(filePath);
        if (parser.isEmpty()) {
            return parseFailed(filePath, text, null, "No parser available for " + displayName(filePath));
        }

        SyntaxTree tree;
        try {
            tree = parser.get().parse(text);
        } catch (SourceSyntaxException e) {
            log.debug("Syntax error in {}: {}", displayName(filePath), e.getMessage());
            return parseFailed(filePath, text, e.span(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Parser {} failed on {}", parser.get().getName(), displayName(filePath), e);
            return parseFailed(filePath, text, null, "Parser failed: " + e.getMessage());
        }

        if (!tree.text().equals(text)) {
            return parseFailed(filePath, text, null, "Parser returned a tree for different text");
        }
        Optional<String> problem = tree.wellFormednessProblem();
        if (problem.isPresent()) {
            log.warn("Parser {} produced a malformed tree for {}: {}",
                    parser.get().getName(), displayName(filePath), problem.get());
            return parseFailed(filePath, text, null, "Malformed syntax tree: " + problem.get());
        }

        TraversalResult traversal = traversalEngine.traverse(tree);
        List<Diagnostic> diagnostics = canonicalizer.canonicalize(filePath, traversal.findings());
        LintStatus status = DiagnosticCanonicalizer.statusOf(diagnostics);
        log.debug("Linted {}: {} nodes, {} diagnostics, status {}",
                displayName(filePath), traversal.nodesVisited(), diagnostics.size(), status);
        return new LintReport(filePath, diagnostics, status);
    }

    private Optional<SourceParser> findParser(String filePath) {
        String fileName = filePath == null ? "" : filePath;
        return parsers.stream()
                .filter(p -> p.supports(fileName))
                .findFirst();
    }

    private static LintReport parseFailed(String filePath, String text, Span span, String message) {
        Span location = span != null && span.endOffset() <= text.length()
                ? span
                : Span.at(Position.origin());
        Diagnostic diagnostic = new Diagnostic(
                filePath, Diagnostic.SYNTAX_ERROR_RULE_ID, Severity.ERROR, location, message, null, null);
        return new LintReport(filePath, List.of(diagnostic), LintStatus.PARSE_FAILED);
    }

    private static LintReport annotatePending(LintReport report, String note) {
        List<Diagnostic> annotated = report.diagnostics().stream()
                .map(d -> d.fix() != null ? d.withNote(note) : d)
                .toList();
        return new LintReport(report.filePath(), annotated, report.status());
    }

    private static LintReport annotateRejected(LintReport report, FixOutcome outcome) {
        List<Diagnostic> annotated = report.diagnostics().stream()
                .map(d -> annotateRejected(d, outcome))
                .toList();
        return new LintReport(report.filePath(), annotated, report.status());
    }

    private static Diagnostic annotateRejected(Diagnostic diagnostic, FixOutcome outcome) {
        Edit fix = diagnostic.fix();
        if (fix == null || outcome.rejected().stream().noneMatch(fix::sameChangeAs)) {
            return diagnostic;
        }
        return outcome.conflicts().stream()
                .filter(c -> c.involves(fix))
                .findFirst()
                .map(c -> diagnostic.withNote(NOTE_CONFLICT + c.opponentOf(fix)))
                .orElseGet(() -> diagnostic.withNote(NOTE_PASS_SKIPPED));
    }

    private static String displayName(String filePath) {
        return filePath == null ? "<input>" : filePath;
    }
}
