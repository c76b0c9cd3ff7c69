package com.vidnyan.slate.application.port.in;

import com.vidnyan.slate.domain.diagnostic.FixReport;
import com.vidnyan.slate.domain.diagnostic.LintReport;

/**
 * Primary use case: lint a source text and optionally rewrite it to conform.
 * The configuration is fixed when the service is built; every call sees the same rule set.
 */
public interface LintUseCase {

    /**
     * Lint one source text.
     */
    LintReport lint(LintRequest request);

    /**
     * Run the bounded fix loop on one source text.
     */
    FixReport fix(FixRequest request);

    /**
     * Lint request parameters.
     *
     * @param filePath caller-supplied path, used for parser selection and reporting; may be null
     * @param text     source text
     */
    record LintRequest(
        String filePath,
        String text
    ) {
        public static LintRequest of(String filePath, String text) {
            return new LintRequest(filePath, text);
        }
    }

    /**
     * Fix request parameters.
     *
     * @param filePath      caller-supplied path; may be null
     * @param text          source text
     * @param maxIterations upper bound on fix passes, at least 1
     */
    record FixRequest(
        String filePath,
        String text,
        int maxIterations
    ) {
        public FixRequest {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be at least 1 but was " + maxIterations);
            }
        }

        public static FixRequest of(String filePath, String text, int maxIterations) {
            return new FixRequest(filePath, text, maxIterations);
        }
    }
}
