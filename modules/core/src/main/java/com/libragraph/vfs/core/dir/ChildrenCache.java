package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.util.VfsPaths;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Side table of fetched children keyed by directory id. Entries are snapshots: they are
 * dropped when a create or move touches the directory, never patched in place.
 */
@ApplicationScoped
public class ChildrenCache {

    private final ConcurrentHashMap<String, Children> entries = new ConcurrentHashMap<>();

    public Optional<Children> get(String dirId) {
        return Optional.ofNullable(entries.get(dirId));
    }

    public void put(Children children) {
        entries.put(children.parentId(), children);
    }

    public void invalidate(String dirId) {
        if (dirId != null) {
            entries.remove(dirId);
        }
    }

    /** Drops the entries of the directory at {@code path} and of everything under it. */
    public void invalidateSubtree(String path) {
        entries.values().removeIf(c -> c.parentPath().equals(path)
                || VfsPaths.isUnder(c.parentPath(), path));
    }

    /**
     * Clears the cache (for testing).
     */
    public void clear() {
        entries.clear();
    }
}
