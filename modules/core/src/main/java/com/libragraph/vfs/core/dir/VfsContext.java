package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.doc.DocumentStore;
import com.libragraph.vfs.core.storage.PhysicalStore;

import java.util.Objects;

/**
 * Explicit handle passed into every directory operation: which document store, which
 * physical store, and the caller's cancellation signal.
 */
public record VfsContext(DocumentStore documents, PhysicalStore physical,
                         CancellationSignal cancellation) {

    public VfsContext {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(physical, "physical");
        Objects.requireNonNull(cancellation, "cancellation");
    }

    public static VfsContext of(DocumentStore documents, PhysicalStore physical) {
        return new VfsContext(documents, physical, new CancellationSignal());
    }
}
