package com.vidnyan.slate;

import com.vidnyan.slate.domain.engine.FixConflictPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for a lint run.
 * Can be configured via application.properties or command line arguments (--slate.paths=src).
 */
@Data
@Component
@ConfigurationProperties(prefix = "slate")
public class LintProperties {

    /**
     * Files or directories to lint. Nothing runs when empty.
     */
    private List<String> paths = new ArrayList<>();

    /**
     * JSON rule configuration file. All rules run with their defaults when unset.
     */
    private String configFile;

    /**
     * Apply fixes and write corrected files back.
     */
    private boolean fix = false;

    private int maxFixIterations = 10;

    /**
     * Number of files processed concurrently.
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    private FixConflictPolicy conflictPolicy = FixConflictPolicy.SKIP_ALL;

    /**
     * Where to write the JSON report. No report file is written when unset.
     */
    private String reportFile;

    /**
     * File extensions picked up when scanning directories.
     */
    private List<String> extensions = new ArrayList<>(List.of(".java"));

    /**
     * Directory names skipped when scanning.
     */
    private List<String> excludedDirectories = new ArrayList<>(List.of(".git", "target", "build", "node_modules"));
}
