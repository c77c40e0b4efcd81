package io.rollcron.internal.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves a job's configured {@code working_dir} inside its materialized directory.
 */
public final class WorkDirs {
    private static final Logger log = LoggerFactory.getLogger(WorkDirs.class);

    private WorkDirs() {
    }

    /**
     * Join, canonicalize and check containment. Anything that does not resolve to an existing path inside
     * {@code jobDir} (missing directory, {@code ..} or symlink escape) falls back to {@code jobDir}.
     */
    public static Path resolve(String jobId, Path jobDir, String workingDir) {
        if (workingDir == null || workingDir.isBlank()) {
            return jobDir;
        }
        try {
            Path base = jobDir.toRealPath();
            Path resolved = jobDir.resolve(workingDir).toRealPath();
            if (resolved.startsWith(base)) {
                return resolved;
            }
        } catch (IOException | InvalidPathException e) {
            log.debug("[job:{}] working_dir resolution failed msg={}", jobId, e.getMessage());
        }
        log.warn("[job:{}] Invalid working_dir '{}': path traversal or non-existent, using job root", jobId, workingDir);
        return jobDir;
    }
}
