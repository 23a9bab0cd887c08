package com.libragraph.vfs.core.error;

public class NotADirectoryException extends VfsException {

    public NotADirectoryException(String id, String actualType) {
        super(ErrorKind.NOT_A_DIRECTORY,
                "Document " + id + " is not a directory (type=" + actualType + ")");
    }
}
