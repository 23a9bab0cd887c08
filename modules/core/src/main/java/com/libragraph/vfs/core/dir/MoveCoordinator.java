package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.error.AlreadyExistsException;
import com.libragraph.vfs.core.error.ForbiddenMoveException;
import com.libragraph.vfs.core.error.InvalidPathException;
import com.libragraph.vfs.util.VfsPaths;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Relocates a directory: the physical rename first, then the descendant path fix-ups.
 *
 * <p>The two steps touch different stores and are not atomic together. Once the rename
 * succeeds nothing is undone, whatever the fix-ups report.
 */
@ApplicationScoped
public class MoveCoordinator {

    private static final Logger log = Logger.getLogger(MoveCoordinator.class);

    @Inject
    DescendantPathFixer fixer;

    /**
     * @return number of descendant documents relocated
     */
    public int move(VfsContext ctx, String oldPath, String newPath) {
        safeRename(ctx, oldPath, newPath);
        return fixer.fixDescendants(ctx, oldPath, newPath);
    }

    /**
     * Validated physical rename.
     *
     * @throws InvalidPathException    if either path is not absolute
     * @throws ForbiddenMoveException  if {@code newPath} is {@code oldPath} or lies under it
     * @throws AlreadyExistsException  if a physical entry already exists at {@code newPath}
     */
    public void safeRename(VfsContext ctx, String oldPath, String newPath) {
        if (!VfsPaths.isAbsolute(oldPath)) {
            throw new InvalidPathException(oldPath, "paths should be absolute");
        }
        if (!VfsPaths.isAbsolute(newPath)) {
            throw new InvalidPathException(newPath, "paths should be absolute");
        }
        String from = VfsPaths.clean(oldPath);
        String to = VfsPaths.clean(newPath);

        if (to.equals(from) || VfsPaths.isUnder(to, from)) {
            throw new ForbiddenMoveException(from, to);
        }
        ctx.cancellation().throwIfCancelled("rename of " + from);

        if (Boolean.TRUE.equals(ctx.physical().exists(to).await().indefinitely())) {
            throw new AlreadyExistsException(to);
        }
        ctx.physical().rename(from, to).await().indefinitely();
        log.infof("Renamed %s -> %s", from, to);
    }
}
