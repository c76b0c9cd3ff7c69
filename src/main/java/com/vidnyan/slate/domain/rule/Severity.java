package com.vidnyan.slate.domain.rule;

import java.util.Locale;

/**
 * Diagnostic severity levels, most severe first.
 */
public enum Severity {
    BLOCKER,    // Must fix - blocks CI
    ERROR,      // Should fix - fails the run
    WARN,       // Should review - reported but passes
    INFO;       // Informational only

    /**
     * True when this severity is the same as or more severe than the threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return ordinal() <= threshold.ordinal();
    }

    /**
     * Parse a configuration value. Accepts any case and "warning" as an alias of WARN.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "BLOCKER" -> BLOCKER;
            case "ERROR" -> ERROR;
            case "WARN", "WARNING" -> WARN;
            case "INFO" -> INFO;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }
}
