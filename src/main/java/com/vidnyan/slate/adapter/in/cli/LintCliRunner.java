package com.vidnyan.slate.adapter.in.cli;

import com.vidnyan.slate.LintProperties;
import com.vidnyan.slate.application.port.out.DiagnosticReporter;
import com.vidnyan.slate.application.service.BatchLintService;
import com.vidnyan.slate.application.service.BatchLintService.FileResult;
import com.vidnyan.slate.domain.diagnostic.LintReport;
import com.vidnyan.slate.domain.diagnostic.LintStatus;
import com.vidnyan.slate.scanner.SourceFileScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for linting files from the command line.
 * Runs when the slate.paths property is set. Exit code: 0 clean, 1 violations, 2 parse failures.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LintCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_CLEAN = 0;
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_PARSE_FAILED = 2;

    private final LintProperties properties;
    private final SourceFileScanner scanner;
    private final BatchLintService batchLintService;
    private final List<DiagnosticReporter> reporters;

    private int exitCode = EXIT_CLEAN;

    @Override
    public void run(String... args) throws Exception {
        if (properties.getPaths().isEmpty()) {
            log.info("No paths specified. Set the slate.paths property.");
            return;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║           SLATE - Structural Lint And Transform Engine       ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Paths: {}", properties.getPaths());
        log.info("║ Mode:  {}", properties.isFix() ? "fix" : "lint");
        log.info("╚══════════════════════════════════════════════════════════════╝");

        List<Path> roots = properties.getPaths().stream().map(Path::of).toList();
        List<Path> files = scanner.scan(roots);

        List<FileResult> results = properties.isFix()
                ? batchLintService.fixFiles(files, properties.getMaxFixIterations(), true)
                : batchLintService.lintFiles(files);
        if (properties.isFix()) {
            logFixSummary(results);
        }

        List<LintReport> reports = results.stream().map(FileResult::report).toList();
        reporters.forEach(r -> r.report(reports));

        exitCode = exitCodeOf(reports);
        log.info("");
        log.info("Lint complete (exit code {})", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeOf(List<LintReport> reports) {
        if (reports.stream().anyMatch(r -> r.status() == LintStatus.PARSE_FAILED)) {
            return EXIT_PARSE_FAILED;
        }
        if (reports.stream().anyMatch(r -> r.status() == LintStatus.VIOLATIONS)) {
            return EXIT_VIOLATIONS;
        }
        return EXIT_CLEAN;
    }

    private void logFixSummary(List<FileResult> results) {
        long changed = results.stream().filter(FileResult::changed).count();
        log.info("Fixed {} of {} files", changed, results.size());
        results.stream()
                .filter(r -> r.fix() != null && r.fix().hasConflicts())
                .forEach(r -> r.fix().conflicts().forEach(c ->
                        log.warn("  {}: conflicting fixes, {}", r.path(), c.describe())));
    }
}
