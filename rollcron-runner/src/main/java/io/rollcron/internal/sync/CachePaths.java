package io.rollcron.internal.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Naming of the on-disk cache: one SOT mirror per source locator and one working directory per job.
 *
 * <pre>
 *   &lt;base&gt;/&lt;repo&gt;-&lt;hash8&gt;            SOT mirror
 *   &lt;base&gt;/&lt;repo&gt;-&lt;hash8&gt;@&lt;jobId&gt;    job working directory
 * </pre>
 */
public final class CachePaths {
    private static final Logger log = LoggerFactory.getLogger(CachePaths.class);

    private final Path base;

    public CachePaths(Path base) {
        this.base = Objects.requireNonNull(base, "base must not be null");
    }

    /**
     * {@code $XDG_CACHE_HOME/rollcron}, then {@code ~/.cache/rollcron}, then {@code /tmp/rollcron}.
     */
    public static CachePaths platformDefault() {
        String xdg = System.getenv("XDG_CACHE_HOME");
        if (xdg != null && !xdg.isBlank()) {
            return new CachePaths(Paths.get(xdg, "rollcron"));
        }
        String home = System.getProperty("user.home");
        if (home != null && !home.isBlank()) {
            return new CachePaths(Paths.get(home, ".cache", "rollcron"));
        }
        return new CachePaths(Paths.get("/tmp", "rollcron"));
    }

    public Path base() {
        return base;
    }

    /**
     * Mirror directory for a source locator; stable across runs for the same locator string.
     */
    public Path sotPath(String source) {
        return base.resolve(repoName(source) + "-" + shortHash(source));
    }

    public Path jobDir(Path sotPath, String jobId) {
        Path name = sotPath.getFileName();
        String sotName = name == null ? "unknown" : name.toString();
        return base.resolve(sotName + "@" + jobId);
    }

    /**
     * Delete the working directories of the given jobs. Failures are logged.
     */
    public void cleanup(Path sotPath, Collection<String> jobIds) {
        for (String jobId : jobIds) {
            Path dir = jobDir(sotPath, jobId);
            try {
                FileTrees.deleteRecursively(dir);
                FileTrees.deleteRecursively(DirectoryMaterializer.tempDirFor(dir));
            } catch (IOException e) {
                log.warn("Failed to clean up job directory jobId={} dir={} msg={}", jobId, dir, e.getMessage());
            }
        }
    }

    static String repoName(String source) {
        String s = source;
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        if (s.endsWith(".git")) {
            s = s.substring(0, s.length() - 4);
        }
        int cut = Math.max(s.lastIndexOf('/'), s.lastIndexOf(':'));
        String name = cut >= 0 ? s.substring(cut + 1) : s;
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isEmpty() ? "repo" : name;
    }

    static String shortHash(String source) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(source.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
