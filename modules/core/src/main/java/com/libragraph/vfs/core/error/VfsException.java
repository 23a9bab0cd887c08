package com.libragraph.vfs.core.error;

/**
 * Base of all failures raised by the VFS directory subsystem and its stores.
 */
public abstract class VfsException extends RuntimeException {

    private final ErrorKind kind;

    protected VfsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected VfsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isClientError() {
        return kind.clientError();
    }
}
