package com.vidnyan.slate.domain.rule;

/**
 * Configuration could not be read or contains values a rule rejects.
 */
public class InvalidConfigurationException extends LintConfigurationException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
