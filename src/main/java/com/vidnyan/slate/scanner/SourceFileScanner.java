package com.vidnyan.slate.scanner;

import com.vidnyan.slate.LintProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Collects the files to lint from the configured paths.
 * Files given explicitly are always included; directories are walked for files with a configured
 * extension, skipping excluded directory names.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceFileScanner {

    private final LintProperties properties;

    /**
     * Scan and return all lintable files, sorted within each root and without duplicates.
     */
    public List<Path> scan(List<Path> roots) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (Path root : roots) {
            if (Files.isRegularFile(root)) {
                files.add(root.normalize());
            } else if (Files.isDirectory(root)) {
                files.addAll(scanDirectory(root));
            } else {
                log.warn("Skipping {}: no such file or directory", root);
            }
        }
        log.info("Found {} files to lint under {}", files.size(), roots);
        return new ArrayList<>(files);
    }

    private List<Path> scanDirectory(Path directory) throws IOException {
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(this::hasLintableExtension)
                    .filter(p -> !isExcluded(directory.relativize(p)))
                    .map(Path::normalize)
                    .sorted()
                    .toList();
        }
    }

    private boolean hasLintableExtension(Path file) {
        String name = file.getFileName().toString();
        return properties.getExtensions().stream().anyMatch(name::endsWith);
    }

    private boolean isExcluded(Path relative) {
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (properties.getExcludedDirectories().contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }
}
