package com.libragraph.vfs.core.error;

public class OperationCancelledException extends VfsException {

    public OperationCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }
}
