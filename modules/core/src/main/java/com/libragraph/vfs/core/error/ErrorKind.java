package com.libragraph.vfs.core.error;

/**
 * Classifies VFS failures. Client errors are correctable by the caller (4xx-equivalent);
 * the rest are operational failures to surface as-is (5xx-equivalent).
 */
public enum ErrorKind {
    NOT_FOUND(true),
    NOT_A_DIRECTORY(true),
    PARENT_MISSING(true),
    INVALID_NAME(true),
    INVALID_PATH(true),
    ILLEGAL_TIMESTAMP(true),
    FORBIDDEN_MOVE(true),
    ALREADY_EXISTS(true),
    CONFLICT(true),
    CANCELLED(true),
    PARTIAL_FAILURE(false),
    STORAGE(false);

    private final boolean clientError;

    ErrorKind(boolean clientError) {
        this.clientError = clientError;
    }

    public boolean clientError() {
        return clientError;
    }
}
