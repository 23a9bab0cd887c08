package com.libragraph.vfs.core.error;

public class AlreadyExistsException extends VfsException {

    private final String path;

    public AlreadyExistsException(String path) {
        super(ErrorKind.ALREADY_EXISTS, "Entry already exists: " + path);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
