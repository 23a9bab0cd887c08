package com.libragraph.vfs.core.error;

public class InvalidNameException extends VfsException {

    public InvalidNameException(String name, String reason) {
        super(ErrorKind.INVALID_NAME, "Invalid name '" + name + "': " + reason);
    }
}
