package com.libragraph.vfs.core.storage;

import com.libragraph.vfs.core.error.ErrorKind;
import com.libragraph.vfs.core.error.VfsException;

/**
 * Wraps checked I/O exceptions from physical storage operations.
 */
public class StorageException extends VfsException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }
}
