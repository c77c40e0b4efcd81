package io.rollcron.internal.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Keeps the SOT mirror in the cache up to date.
 *
 * <ul>
 *   <li>Remote locator (URL or scp-style {@code user@host:path}): {@code git clone} on first use,
 *       {@code git pull --ff-only} afterwards. New content means HEAD moved.</li>
 *   <li>Local path: mirrored file by file, without VCS metadata. New content means any entry changed.</li>
 * </ul>
 */
public class SourceSync {
    private static final Logger log = LoggerFactory.getLogger(SourceSync.class);

    private static final Pattern URL = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://.*");
    private static final Pattern SCP_LIKE = Pattern.compile("^[^/\\s]+@[^/:\\s]+:.*");

    private final CachePaths cachePaths;
    private final GitCli git;

    public SourceSync(CachePaths cachePaths, GitCli git) {
        this.cachePaths = Objects.requireNonNull(cachePaths, "cachePaths must not be null");
        this.git = Objects.requireNonNull(git, "git must not be null");
    }

    /**
     * @param sotPath mirror directory
     * @param changed whether new content arrived (always true when the mirror was just created)
     */
    public record Result(Path sotPath, boolean changed) {
    }

    public static boolean isRemote(String source) {
        return URL.matcher(source).matches() || SCP_LIKE.matcher(source).matches();
    }

    public Path sotPath(String source) {
        return cachePaths.sotPath(source);
    }

    public Result ensure(String source) {
        Objects.requireNonNull(source, "source must not be null");
        Path sotPath = cachePaths.sotPath(source);
        try {
            Files.createDirectories(cachePaths.base());
        } catch (IOException e) {
            throw new SyncException("Failed to create cache directory " + cachePaths.base() + ": " + e.getMessage(), e);
        }
        return isRemote(source) ? ensureRemote(source, sotPath) : ensureLocal(source, sotPath);
    }

    private Result ensureRemote(String source, Path sotPath) {
        if (!Files.isDirectory(sotPath.resolve(FileTrees.VCS_DIR))) {
            discardPartialMirror(sotPath);
            log.info("Cloning source source={} cache={}", source, sotPath);
            git.run(null, "clone", "--quiet", source, sotPath.toString());
            return new Result(sotPath, true);
        }

        if (!git.succeeds(sotPath, "rev-parse", "--abbrev-ref", "--symbolic-full-name", "@{upstream}")) {
            log.debug("Mirror has no upstream; skipping pull cache={}", sotPath);
            return new Result(sotPath, false);
        }

        String before = git.run(sotPath, "rev-parse", "HEAD");
        git.run(sotPath, "pull", "--ff-only", "--quiet");
        String after = git.run(sotPath, "rev-parse", "HEAD");
        boolean changed = !before.equals(after);
        if (changed) {
            log.info("Pulled new commits range={}..{}", abbreviate(before), abbreviate(after));
        }
        return new Result(sotPath, changed);
    }

    private Result ensureLocal(String source, Path sotPath) {
        Path src = Paths.get(source);
        if (!Files.isDirectory(src)) {
            throw new SyncException("Source directory does not exist: " + source);
        }
        boolean created = !Files.isDirectory(sotPath);
        try {
            int changes = TreeMirror.mirror(src, sotPath);
            if (changes > 0 && !created) {
                log.info("Source directory changed entries={}", changes);
            }
            return new Result(sotPath, created || changes > 0);
        } catch (IOException e) {
            throw new SyncException("Failed to mirror " + source + " into " + sotPath + ": " + e.getMessage(), e);
        }
    }

    private static void discardPartialMirror(Path sotPath) {
        try {
            FileTrees.deleteRecursively(sotPath);
        } catch (IOException e) {
            throw new SyncException("Failed to remove incomplete mirror " + sotPath + ": " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String sha) {
        return sha.length() > 8 ? sha.substring(0, 8) : sha;
    }
}
