package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.util.VfsPaths;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * One directory of the VFS tree, as persisted in the document store.
 *
 * <p>Immutable. {@code path} is a denormalized cache that must equal the parent's path
 * plus {@code "/" + name}; it is null on a node that has not been created yet.
 * Children are not held here: see {@link ChildrenCache}.
 *
 * @param id        store-assigned id, {@link #ROOT_ID} for the synthetic root
 * @param rev       revision token used as the optimistic-concurrency precondition
 * @param folderId  id of the containing directory
 * @param tags      tag set; duplicates are dropped, first-seen order kept
 */
public record DirectoryNode(
        String id,
        String rev,
        String name,
        String folderId,
        String path,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {

    /** Well-known id of the tree root. Never persisted as a document. */
    public static final String ROOT_ID = "io.libragraph.vfs.root-dir";

    private static final DirectoryNode ROOT = new DirectoryNode(
            ROOT_ID, null, "", "", VfsPaths.ROOT, List.of(), Instant.EPOCH, Instant.EPOCH);

    public DirectoryNode {
        tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
    }

    /**
     * Validating constructor for a directory about to be created. An empty or null parent
     * id means the root.
     *
     * @throws com.libragraph.vfs.core.error.InvalidNameException if the name is not usable
     */
    public static DirectoryNode create(String name, String folderId, Collection<String> tags) {
        return create(name, folderId, tags, Instant.now());
    }

    public static DirectoryNode create(String name, String folderId, Collection<String> tags,
                                       Instant now) {
        PathResolver.checkName(name);
        List<String> tagList = tags == null ? List.of() : new ArrayList<>(tags);
        return new DirectoryNode(null, null, name, parentOrRoot(folderId), null, tagList, now, now);
    }

    /** The synthetic root directory. */
    public static DirectoryNode root() {
        return ROOT;
    }

    static String parentOrRoot(String folderId) {
        return folderId == null || folderId.isEmpty() ? ROOT_ID : folderId;
    }

    public boolean isRoot() {
        return ROOT_ID.equals(id);
    }

    public DirectoryNode withPath(String newPath) {
        return new DirectoryNode(id, rev, name, folderId, newPath, tags, createdAt, updatedAt);
    }

    /** Union of the current tags and {@code extra}, duplicates removed. */
    public List<String> mergedTags(Collection<String> extra) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(tags);
        merged.addAll(extra);
        return List.copyOf(merged);
    }
}
