package com.vidnyan.slate.adapter.out.report;

import com.vidnyan.slate.application.port.out.DiagnosticReporter;
import com.vidnyan.slate.domain.diagnostic.Diagnostic;
import com.vidnyan.slate.domain.diagnostic.LintReport;
import com.vidnyan.slate.domain.diagnostic.LintStatus;
import com.vidnyan.slate.domain.rule.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prints a run summary and the diagnostics through the application log.
 */
@Slf4j
@Component
public class LoggingDiagnosticReporter implements DiagnosticReporter {

    static final int MAX_DETAILS = 200;

    @Override
    public void report(List<LintReport> reports) {
        int blockers = count(reports, Severity.BLOCKER);
        int errors = count(reports, Severity.ERROR);
        int warnings = count(reports, Severity.WARN);
        int infos = count(reports, Severity.INFO);
        long parseFailures = reports.stream().filter(r -> r.status() == LintStatus.PARSE_FAILED).count();

        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" LINT RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files checked:    {}", reports.size());
        log.info(" Parse failures:   {}", parseFailures);
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" DIAGNOSTICS:");
        log.info("   Blockers: {}", blockers);
        log.info("   Errors:   {}", errors);
        log.info("   Warnings: {}", warnings);
        log.info("   Info:     {}", infos);
        log.info("═══════════════════════════════════════════════════════════════");

        List<Diagnostic> all = reports.stream()
                .flatMap(r -> r.diagnostics().stream())
                .toList();
        if (all.isEmpty()) {
            log.info("");
            log.info("No diagnostics. All files are clean.");
            return;
        }

        log.info("");
        int shown = 0;
        for (Diagnostic d : all) {
            if (shown == MAX_DETAILS) {
                log.info(" ... and {} more diagnostics", all.size() - MAX_DETAILS);
                break;
            }
            log.info(" {}", d.format());
            shown++;
        }
    }

    private static int count(List<LintReport> reports, Severity severity) {
        return reports.stream().mapToInt(r -> r.count(severity)).sum();
    }
}
