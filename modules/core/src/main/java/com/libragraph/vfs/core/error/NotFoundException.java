package com.libragraph.vfs.core.error;

/**
 * Thrown when an id or path does not resolve to any document.
 */
public class NotFoundException extends VfsException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException id(String doctype, String id) {
        return new NotFoundException("Document not found: doctype=" + doctype + " id=" + id);
    }

    public static NotFoundException path(String path) {
        return new NotFoundException("No directory at path: " + path);
    }
}
