package io.rollcron.internal.sync;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the current tree of a SOT mirror into an empty directory.
 */
@FunctionalInterface
public interface TreeExporter {

    void export(Path sotPath, Path target) throws IOException;
}
