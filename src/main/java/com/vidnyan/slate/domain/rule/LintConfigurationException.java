package com.vidnyan.slate.domain.rule;

/**
 * Configuration problem that makes the whole run ill-defined.
 * Raised before any file is processed.
 */
public class LintConfigurationException extends RuntimeException {

    public LintConfigurationException(String message) {
        super(message);
    }

    public LintConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
