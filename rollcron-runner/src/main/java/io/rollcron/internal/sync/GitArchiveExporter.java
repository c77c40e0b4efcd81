package io.rollcron.internal.sync;

import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Exports {@code HEAD} of a git checkout with {@code git archive}, extracting the stream as it arrives.
 */
public class GitArchiveExporter implements TreeExporter {

    private final GitCli git;

    public GitArchiveExporter(GitCli git) {
        this.git = Objects.requireNonNull(git, "git must not be null");
    }

    @Override
    public void export(Path sotPath, Path target) {
        git.stream(sotPath, stdout -> {
            TarExtractor.extract(stdout, target);
            stdout.transferTo(OutputStream.nullOutputStream()); // trailing record padding
        }, "archive", "--format=tar", "HEAD");
    }
}
