package com.vidnyan.slate.application.service;

import com.vidnyan.slate.application.port.in.LintUseCase;
import com.vidnyan.slate.application.port.in.LintUseCase.FixRequest;
import com.vidnyan.slate.application.port.in.LintUseCase.LintRequest;
import com.vidnyan.slate.domain.diagnostic.Diagnostic;
import com.vidnyan.slate.domain.diagnostic.FixReport;
import com.vidnyan.slate.domain.diagnostic.LintReport;
import com.vidnyan.slate.domain.diagnostic.LintStatus;
import com.vidnyan.slate.domain.model.Position;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.rule.Severity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs the per-file pipeline over many files concurrently.
 *
 * Files share nothing but the read-only use case (and through it the registry and configuration).
 * A failure in one file, including an unreadable file, is reported for that file only.
 * Cancellation happens between files: once interrupted, no further files are scheduled.
 */
@Slf4j
public class BatchLintService {

    private final LintUseCase lintUseCase;
    private final int parallelism;

    public BatchLintService(LintUseCase lintUseCase, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1 but was " + parallelism);
        }
        this.lintUseCase = lintUseCase;
        this.parallelism = parallelism;
    }

    /**
     * Outcome for one file of a batch.
     *
     * @param path   the file
     * @param report lint report (of the corrected text when fixing)
     * @param fix    fix report, null for lint-only runs
     */
    public record FileResult(
        Path path,
        LintReport report,
        FixReport fix
    ) {
        public boolean changed() {
            return fix != null && fix.iterationsUsed() > 0;
        }
    }

    /**
     * Lint every file. Results are returned in input order.
     */
    public List<FileResult> lintFiles(List<Path> files) {
        return runAll(files, path -> {
            String text = read(path);
            LintReport report = lintUseCase.lint(LintRequest.of(path.toString(), text));
            return new FileResult(path, report, null);
        });
    }

    /**
     * Fix every file, optionally writing corrected text back. Results are returned in input order.
     */
    public List<FileResult> fixFiles(List<Path> files, int maxIterations, boolean writeBack) {
        return runAll(files, path -> {
            String text = read(path);
            FixReport fix = lintUseCase.fix(FixRequest.of(path.toString(), text, maxIterations));
            if (writeBack && fix.iterationsUsed() > 0) {
                write(path, fix.correctedText());
                log.info("Rewrote {} after {} fix passes", path, fix.iterationsUsed());
            }
            LintReport report = new LintReport(path.toString(), fix.remainingDiagnostics(), fix.status());
            return new FileResult(path, report, fix);
        });
    }

    private List<FileResult> runAll(List<Path> files, Function<Path, FileResult> task) {
        Instant start = Instant.now();
        AtomicInteger failedFiles = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, files.size())));
        try {
            List<Future<FileResult>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> isolate(file, task, failedFiles)));
            }

            List<FileResult> results = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), files.get(i), futures));
            }

            log.info("Processed {} files in {}ms ({} unreadable or failed)",
                    files.size(), Duration.between(start, Instant.now()).toMillis(), failedFiles.get());
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static FileResult isolate(Path file, Function<Path, FileResult> task, AtomicInteger failedFiles) {
        try {
            return task.apply(file);
        } catch (UncheckedFileException e) {
            failedFiles.incrementAndGet();
            log.warn("Cannot read {}: {}", file, e.getCause().getMessage());
            return failure(file, Diagnostic.IO_ERROR_RULE_ID, "Cannot read file: " + e.getCause().getMessage());
        } catch (RuntimeException e) {
            failedFiles.incrementAndGet();
            log.error("Unexpected failure while processing {}", file, e);
            return failure(file, Diagnostic.INTERNAL_ERROR_RULE_ID, "Processing failed: " + e);
        }
    }

    private static FileResult await(Future<FileResult> future, Path file, List<Future<FileResult>> all) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            all.forEach(f -> f.cancel(true));
            throw new CancellationException("Interrupted while processing " + file);
        } catch (ExecutionException e) {
            log.error("Task for {} failed", file, e.getCause());
            return failure(file, Diagnostic.INTERNAL_ERROR_RULE_ID, "Processing failed: " + e.getCause());
        }
    }

    private static FileResult failure(Path file, String ruleId, String message) {
        Diagnostic diagnostic = new Diagnostic(file.toString(), ruleId, Severity.ERROR,
                Span.at(Position.origin()), message, null, null);
        return new FileResult(file, new LintReport(file.toString(), List.of(diagnostic), LintStatus.PARSE_FAILED), null);
    }

    private static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedFileException(e);
        }
    }

    private static void write(Path path, String text) {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedFileException(e);
        }
    }

    private static final class UncheckedFileException extends RuntimeException {
        UncheckedFileException(IOException cause) {
            super(cause);
        }
    }
}
