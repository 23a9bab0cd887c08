package com.libragraph.vfs.core.error;

/**
 * Thrown when a parent id does not resolve to an existing directory document.
 */
public class ParentMissingException extends VfsException {

    private final String parentId;

    public ParentMissingException(String parentId, Throwable cause) {
        super(ErrorKind.PARENT_MISSING, "Parent directory does not exist: " + parentId, cause);
        this.parentId = parentId;
    }

    public String parentId() {
        return parentId;
    }
}
