package io.rollcron.internal.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Projects the current tree of a SOT mirror into a job's working directory.
 *
 * <p>The tree is built in a sibling {@code <jobDir>.tmp} directory and only moved into place once complete,
 * so a job directory is always either the previous complete tree or the new complete tree. On failure the
 * temporary directory is removed and the previous job directory is left untouched.
 */
public class DirectoryMaterializer {
    private static final Logger log = LoggerFactory.getLogger(DirectoryMaterializer.class);

    private final TreeExporter gitExporter;
    private final TreeExporter directoryExporter;

    public DirectoryMaterializer(GitCli git) {
        this(new GitArchiveExporter(git), new DirectoryExporter());
    }

    public DirectoryMaterializer(TreeExporter gitExporter, TreeExporter directoryExporter) {
        this.gitExporter = Objects.requireNonNull(gitExporter, "gitExporter must not be null");
        this.directoryExporter = Objects.requireNonNull(directoryExporter, "directoryExporter must not be null");
    }

    public static Path tempDirFor(Path jobDir) {
        return jobDir.resolveSibling(jobDir.getFileName() + ".tmp");
    }

    static Path retiredDirFor(Path jobDir) {
        return jobDir.resolveSibling(jobDir.getFileName() + ".old");
    }

    public void syncToJobDir(Path sotPath, Path jobDir) {
        Objects.requireNonNull(sotPath, "sotPath must not be null");
        Objects.requireNonNull(jobDir, "jobDir must not be null");
        if (!Files.isDirectory(sotPath)) {
            throw new SyncException("SOT directory does not exist: " + sotPath);
        }

        Path temp = tempDirFor(jobDir);
        try {
            FileTrees.deleteRecursively(temp);
            Files.createDirectories(temp);
        } catch (IOException e) {
            throw new SyncException("Failed to prepare " + temp + ": " + e.getMessage(), e);
        }

        TreeExporter exporter = Files.isDirectory(sotPath.resolve(FileTrees.VCS_DIR)) ? gitExporter : directoryExporter;
        try {
            exporter.export(sotPath, temp);
        } catch (IOException | RuntimeException e) {
            discard(temp);
            if (e instanceof SyncException se) {
                throw se;
            }
            throw new SyncException("Failed to export " + sotPath + " into " + temp + ": " + e.getMessage(), e);
        }

        swap(temp, jobDir);
        log.debug("Materialized job directory sot={} jobDir={}", sotPath, jobDir);
    }

    private void swap(Path temp, Path jobDir) {
        Path retired = retiredDirFor(jobDir);
        try {
            FileTrees.deleteRecursively(retired);
            boolean hadPrevious = Files.exists(jobDir, LinkOption.NOFOLLOW_LINKS);
            if (hadPrevious) {
                move(jobDir, retired);
            }
            try {
                move(temp, jobDir);
            } catch (IOException e) {
                if (hadPrevious) {
                    move(retired, jobDir);
                }
                throw e;
            }
            FileTrees.deleteRecursively(retired);
        } catch (IOException e) {
            discard(temp);
            throw new SyncException("Failed to move " + temp + " to " + jobDir + ": " + e.getMessage(), e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }

    private static void discard(Path temp) {
        try {
            FileTrees.deleteRecursively(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary directory dir={} msg={}", temp, e.getMessage());
        }
    }
}
