package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.doc.DocumentStore;
import com.libragraph.vfs.core.storage.PhysicalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Builds {@link VfsContext} handles over the configured stores.
 */
@ApplicationScoped
public class VfsContextFactory {

    @Inject
    DocumentStore documents;

    @Inject
    PhysicalStore physical;

    public VfsContext open() {
        return VfsContext.of(documents, physical);
    }

    public VfsContext open(CancellationSignal cancellation) {
        return new VfsContext(documents, physical, cancellation);
    }
}
