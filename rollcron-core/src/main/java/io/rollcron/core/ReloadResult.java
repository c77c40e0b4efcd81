package io.rollcron.core;

import java.util.List;

/**
 * Result of applying a new job list.
 *
 * added   : ids registered with fresh run state
 * removed : ids dropped from the registry
 * updated : ids kept with their run state but new definition
 */
public record ReloadResult(
        List<String> added,
        List<String> removed,
        List<String> updated
) {
    public ReloadResult {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        updated = List.copyOf(updated);
    }

    public boolean hasEffect() {
        return !added.isEmpty() || !removed.isEmpty() || !updated.isEmpty();
    }
}
