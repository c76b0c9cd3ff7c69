package com.vidnyan.slate.domain.diagnostic;

/**
 * Overall outcome of linting one file.
 */
public enum LintStatus {
    /** No diagnostic at ERROR severity or above. */
    CLEAN,
    /** At least one diagnostic at ERROR severity or above. */
    VIOLATIONS,
    /** The file could not be parsed; no rules ran. */
    PARSE_FAILED
}
