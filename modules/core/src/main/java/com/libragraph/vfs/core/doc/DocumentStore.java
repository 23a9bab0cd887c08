package com.libragraph.vfs.core.doc;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Revisioned document database with per-document optimistic concurrency.
 *
 * <p>There is no multi-document transaction: each call stands alone.
 */
public interface DocumentStore {

    /**
     * Persists a new document, assigning its id and first revision.
     */
    StoredDocument create(String doctype, ObjectNode body);

    /**
     * Looks up a document by id. Empty when no document of that doctype has the id.
     */
    Optional<StoredDocument> get(String doctype, String id);

    /**
     * Replaces a document's body if {@code doc.rev()} still matches the stored revision.
     *
     * @return the document with its new revision
     * @throws com.libragraph.vfs.core.error.ConflictException on revision mismatch
     * @throws com.libragraph.vfs.core.error.NotFoundException if the id no longer exists
     */
    StoredDocument update(StoredDocument doc);

    /**
     * Returns matching documents in no particular order.
     *
     * @param limit maximum number of results; {@code <= 0} means unbounded
     */
    List<StoredDocument> find(String doctype, Selector selector, int limit);
}
