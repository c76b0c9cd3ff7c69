package com.vidnyan.slate.application.port.out;

import com.vidnyan.slate.domain.rule.LintConfiguration;

import java.nio.file.Path;

/**
 * Port for reading the rule configuration.
 */
public interface LintConfigurationLoader {

    /**
     * Load and validate a configuration file.
     *
     * @throws com.vidnyan.slate.domain.rule.InvalidConfigurationException when the file cannot be
     *         read or is malformed
     */
    LintConfiguration load(Path file);
}
