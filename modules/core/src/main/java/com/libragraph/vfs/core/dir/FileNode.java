package com.libragraph.vfs.core.dir;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Leaf entry of the tree. Only its metadata participates here, as a child of a directory;
 * content lives elsewhere. Files carry no denormalized path.
 */
public record FileNode(
        String id,
        String rev,
        String name,
        String folderId,
        long size,
        String mime,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {

    public FileNode {
        tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
    }
}
