package com.vidnyan.slate.adapter.out.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.slate.LintProperties;
import com.vidnyan.slate.application.port.out.DiagnosticReporter;
import com.vidnyan.slate.domain.diagnostic.Diagnostic;
import com.vidnyan.slate.domain.diagnostic.LintReport;
import com.vidnyan.slate.domain.rule.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a JSON report of a run to {@code slate.report-file}. Does nothing when no file is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonDiagnosticReporter implements DiagnosticReporter {

    private final ObjectMapper objectMapper;
    private final LintProperties properties;

    @Override
    public void report(List<LintReport> reports) {
        String reportFile = properties.getReportFile();
        if (reportFile == null || reportFile.isBlank()) {
            return;
        }

        Path target = Path.of(reportFile);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, render(reports), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report to " + target, e);
        }
        log.info("Wrote JSON report for {} files to {}", reports.size(), target);
    }

    /**
     * Render reports as a JSON document.
     */
    public String render(List<LintReport> reports) {
        ReportDocument document = new ReportDocument(
                summarize(reports),
                reports.stream().map(JsonDiagnosticReporter::toFileEntry).toList());
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report cannot be serialized", e);
        }
    }

    private static Summary summarize(List<LintReport> reports) {
        Map<String, Integer> bySeverity = Arrays.stream(Severity.values())
                .collect(Collectors.toMap(
                        Severity::name,
                        s -> reports.stream().mapToInt(r -> r.count(s)).sum(),
                        (a, b) -> a,
                        LinkedHashMap::new));
        return new Summary(
                reports.size(),
                reports.stream().mapToInt(r -> r.diagnostics().size()).sum(),
                bySeverity);
    }

    private static FileEntry toFileEntry(LintReport report) {
        return new FileEntry(
                report.filePath(),
                report.status().name(),
                report.diagnostics().stream().map(JsonDiagnosticReporter::toEntry).toList());
    }

    private static DiagnosticEntry toEntry(Diagnostic d) {
        return new DiagnosticEntry(
                d.filePath(),
                d.span().start().line(),
                d.span().start().column(),
                d.span().end().line(),
                d.span().end().column(),
                d.severity().name(),
                d.ruleId(),
                d.message(),
                d.note(),
                d.fix() != null);
    }

    record ReportDocument(Summary summary, List<FileEntry> files) {
    }

    record Summary(int filesChecked, int totalDiagnostics, Map<String, Integer> bySeverity) {
    }

    record FileEntry(String filePath, String status, List<DiagnosticEntry> diagnostics) {
    }

    record DiagnosticEntry(
        String filePath,
        int startLine,
        int startColumn,
        int endLine,
        int endColumn,
        String severity,
        String ruleId,
        String message,
        String note,
        boolean fixable
    ) {
    }
}
