package com.sandguard.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Checks for external binary availability by scanning the {@code PATH}
 * directories for an executable file.
 */
public final class Binaries {

    private Binaries() {
    }

    private static final Logger log = LoggerFactory.getLogger(Binaries.class);

    /**
     * Resolve the full path of a binary on the current process PATH.
     *
     * @return the absolute path, or null if not found
     */
    public static String resolveBinaryPath(String name) {
        return resolveBinaryPath(name, System.getenv());
    }

    /**
     * Resolve the full path of a binary on the PATH found in {@code env}.
     * Names containing a path separator are never searched.
     *
     * @return the absolute path, or null if not found
     */
    public static String resolveBinaryPath(String name, Map<String, String> env) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.contains("/") || trimmed.contains("\\")) {
            return null;
        }
        String pathVar = env != null ? env.get("PATH") : null;
        if (pathVar == null || pathVar.isBlank()) {
            return null;
        }
        for (String dir : pathVar.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            try {
                Path candidate = Path.of(dir.trim()).resolve(trimmed);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate.toAbsolutePath().toString();
                }
            } catch (InvalidPathException e) {
                log.debug("Skipping invalid PATH entry '{}': {}", dir, e.getMessage());
            }
        }
        return null;
    }
}
