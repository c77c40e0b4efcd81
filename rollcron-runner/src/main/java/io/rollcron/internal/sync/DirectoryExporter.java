package io.rollcron.internal.sync;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Copies a plain directory tree, leaving out VCS metadata.
 */
public class DirectoryExporter implements TreeExporter {

    @Override
    public void export(Path sotPath, Path target) throws IOException {
        FileTrees.copyTree(sotPath, target);
    }
}
