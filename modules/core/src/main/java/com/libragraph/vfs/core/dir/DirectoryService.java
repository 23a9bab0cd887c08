package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.doc.Selector;
import com.libragraph.vfs.core.doc.StoredDocument;
import com.libragraph.vfs.core.error.AlreadyExistsException;
import com.libragraph.vfs.core.error.ConflictException;
import com.libragraph.vfs.core.error.IllegalTimestampException;
import com.libragraph.vfs.core.error.InvalidPathException;
import com.libragraph.vfs.core.error.NotFoundException;
import com.libragraph.vfs.util.VfsPaths;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Create, lookup and metadata updates (rename, move, retag, touch) of directories.
 *
 * <p>Every call takes an explicit {@link VfsContext}. Validation failures are raised
 * before anything is written. Physical and document changes are not atomic together:
 * <ul>
 *   <li>create makes the physical directory first and removes it again, best effort, if
 *       the document cannot be written; a crash in between leaves an orphan directory</li>
 *   <li>a move renames physically, then fixes descendant documents, then writes the node's
 *       own document; a failure at any step leaves the earlier steps applied</li>
 * </ul>
 */
@ApplicationScoped
public class DirectoryService {

    private static final Logger log = Logger.getLogger(DirectoryService.class);

    @Inject
    PathResolver pathResolver;

    @Inject
    DirectoryLookup lookup;

    @Inject
    ChildrenFetcher childrenFetcher;

    @Inject
    ChildrenCache childrenCache;

    @Inject
    MoveCoordinator moveCoordinator;

    /**
     * Persists a node built with {@link DirectoryNode#create}.
     *
     * @return the stored node with its id, revision and path
     * @throws AlreadyExistsException if the target path is taken, physically or by a document
     */
    public DirectoryNode create(VfsContext ctx, DirectoryNode node) {
        PathResolver.ResolvedPath resolved =
                pathResolver.computeChildPath(ctx, node.name(), node.folderId());
        String path = resolved.path();

        if (!ctx.documents().find(NodeCodec.DOCTYPE,
                Selector.equal(NodeCodec.PATH, path), 1).isEmpty()) {
            throw new AlreadyExistsException(path);
        }
        ctx.physical().mkdir(path).await().indefinitely();

        StoredDocument stored;
        try {
            stored = ctx.documents().create(NodeCodec.DOCTYPE, NodeCodec.encode(node.withPath(path)));
        } catch (RuntimeException e) {
            removeOrphan(ctx, path, e);
            throw e;
        }
        childrenCache.invalidate(resolved.parent().id());
        log.infof("Created directory %s (id=%s)", path, stored.id());
        return NodeCodec.decodeDirectory(stored);
    }

    private void removeOrphan(VfsContext ctx, String path, RuntimeException cause) {
        try {
            ctx.physical().remove(path).await().indefinitely();
            log.warnf("Removed physical directory %s after failed document create: %s",
                    path, cause.getMessage());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.errorf(e, "Physical directory %s is orphaned (no document)", path);
        }
    }

    /**
     * @throws NotFoundException if the id is unknown
     * @throws com.libragraph.vfs.core.error.NotADirectoryException if the id names a file
     */
    public DirectoryNode get(VfsContext ctx, String id, boolean withChildren) {
        DirectoryNode dir = lookup.get(ctx, id);
        if (withChildren) {
            childrenFetcher.fetch(ctx, dir);
        }
        return dir;
    }

    /**
     * @throws NotFoundException if no directory has the path
     */
    public DirectoryNode getByPath(VfsContext ctx, String path, boolean withChildren) {
        DirectoryNode dir = lookup.getByPath(ctx, path);
        if (withChildren) {
            childrenFetcher.fetch(ctx, dir);
        }
        return dir;
    }

    /** Children last fetched for a directory, if any. */
    public Optional<Children> cachedChildren(String dirId) {
        return childrenCache.get(dirId);
    }

    /** Cached children of the directory, fetching them on a miss. */
    public Children children(VfsContext ctx, DirectoryNode dir) {
        return childrenCache.get(dir.id()).orElseGet(() -> childrenFetcher.fetch(ctx, dir));
    }

    /**
     * Applies a sparse update. When the resulting path differs from the current one the
     * directory is moved physically and every descendant document is rewritten before the
     * node's own document is written with {@code current.rev()} as precondition.
     *
     * @param current the node as last read; its revision guards the update
     * @return the node as stored after the update
     * @throws ConflictException if {@code current} is stale
     * @throws com.libragraph.vfs.core.error.PartialFailureException if some descendants could
     *         not be rewritten; the node's own document is then left untouched
     */
    public DirectoryNode modifyMetadata(VfsContext ctx, DirectoryNode current, DirectoryPatch patch) {
        if (current.isRoot()) {
            throw new InvalidPathException(VfsPaths.ROOT, "the root directory cannot be modified");
        }
        String path = current.path();
        String name = current.name();
        String folderId = current.folderId();
        List<String> tags = current.tags();
        Instant updatedAt = current.updatedAt();

        if (patch.name() != null) {
            PathResolver.checkName(patch.name());
        }
        if (patch.folderId() != null) {
            String targetFolder = DirectoryNode.parentOrRoot(patch.folderId());
            if (!targetFolder.equals(folderId)) {
                folderId = targetFolder;
                path = pathResolver.computeChildPath(ctx, name, folderId).path();
            }
        }
        if (patch.name() != null) {
            name = patch.name();
            path = VfsPaths.join(VfsPaths.dirname(path), name);
        }
        if (patch.tags() != null) {
            tags = current.mergedTags(patch.tags());
        }
        if (patch.updatedAt() != null) {
            updatedAt = patch.updatedAt();
        }
        if (updatedAt.isBefore(current.createdAt())) {
            throw new IllegalTimestampException(updatedAt, current.createdAt());
        }

        DirectoryNode next = new DirectoryNode(current.id(), current.rev(), name, folderId, path,
                tags, current.createdAt(), updatedAt);

        if (!path.equals(current.path())) {
            ensureCurrent(ctx, current);
            try {
                int moved = moveCoordinator.move(ctx, current.path(), path);
                log.infof("Moved directory %s -> %s (%d descendants)", current.path(), path, moved);
            } finally {
                childrenCache.invalidateSubtree(current.path());
                childrenCache.invalidate(current.folderId());
                childrenCache.invalidate(folderId);
            }
        }

        StoredDocument stored = ctx.documents().update(new StoredDocument(
                current.id(), current.rev(), NodeCodec.DOCTYPE, NodeCodec.encode(next)));
        childrenCache.invalidate(folderId);
        return NodeCodec.decodeDirectory(stored);
    }

    /**
     * Fails fast on a stale revision before anything physical moves. The final update
     * still re-checks, so this narrows the window without closing it.
     */
    private void ensureCurrent(VfsContext ctx, DirectoryNode current) {
        StoredDocument stored = ctx.documents().get(NodeCodec.DOCTYPE, current.id())
                .orElseThrow(() -> NotFoundException.id(NodeCodec.DOCTYPE, current.id()));
        if (!stored.rev().equals(current.rev())) {
            throw new ConflictException(current.id(), current.rev());
        }
    }
}
