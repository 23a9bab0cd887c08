package com.libragraph.vfs.core.dir;

import java.time.Instant;
import java.util.List;

/**
 * Sparse update for {@link DirectoryService#modifyMetadata}. Null components are left
 * unchanged; {@code tags} are added to the existing set, never replace it.
 *
 * <p>Only {@code null} means "no new name". An empty {@code name} is not treated as absent:
 * it fails name validation with {@link com.libragraph.vfs.core.error.InvalidNameException}
 * and the whole patch is rejected.
 */
public record DirectoryPatch(String name, String folderId, List<String> tags, Instant updatedAt) {

    public static DirectoryPatch empty() {
        return new DirectoryPatch(null, null, null, null);
    }

    public static DirectoryPatch rename(String name) {
        return empty().withName(name);
    }

    public static DirectoryPatch moveTo(String folderId) {
        return empty().withFolderId(folderId);
    }

    public DirectoryPatch withName(String newName) {
        return new DirectoryPatch(newName, folderId, tags, updatedAt);
    }

    public DirectoryPatch withFolderId(String newFolderId) {
        return new DirectoryPatch(name, newFolderId, tags, updatedAt);
    }

    public DirectoryPatch withTags(List<String> newTags) {
        return new DirectoryPatch(name, folderId, newTags, updatedAt);
    }

    public DirectoryPatch withUpdatedAt(Instant newUpdatedAt) {
        return new DirectoryPatch(name, folderId, tags, newUpdatedAt);
    }
}
