package com.libragraph.vfs.core.error;

/**
 * Thrown when a directory would be moved onto itself or into its own subtree.
 */
public class ForbiddenMoveException extends VfsException {

    public ForbiddenMoveException(String oldPath, String newPath) {
        super(ErrorKind.FORBIDDEN_MOVE,
                "Cannot move " + oldPath + " into its own subtree: " + newPath);
    }
}
