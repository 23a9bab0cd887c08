package com.libragraph.vfs.core.error;

import java.time.Instant;

/**
 * Thrown when an update would set {@code updatedAt} before {@code createdAt}.
 */
public class IllegalTimestampException extends VfsException {

    public IllegalTimestampException(Instant updatedAt, Instant createdAt) {
        super(ErrorKind.ILLEGAL_TIMESTAMP,
                "updatedAt " + updatedAt + " precedes createdAt " + createdAt);
    }
}
