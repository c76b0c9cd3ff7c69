package com.vidnyan.slate.application.port.out;

import com.vidnyan.slate.domain.diagnostic.LintReport;

import java.util.List;

/**
 * Port for presenting diagnostics to the outside world.
 */
public interface DiagnosticReporter {

    /**
     * Report the results of a run.
     */
    void report(List<LintReport> reports);
}
