package com.libragraph.vfs.core.error;

public class InvalidPathException extends VfsException {

    public InvalidPathException(String path, String reason) {
        super(ErrorKind.INVALID_PATH, "Invalid path '" + path + "': " + reason);
    }
}
