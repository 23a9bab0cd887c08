package com.libragraph.vfs.core.doc;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A revisioned document as held by a {@link DocumentStore}.
 *
 * <p>The body never contains the id or revision; those live only on the record.
 */
public record StoredDocument(String id, String rev, String doctype, ObjectNode body) {

    public StoredDocument {
        Objects.requireNonNull(doctype, "doctype");
        Objects.requireNonNull(body, "body");
    }

    public StoredDocument withBody(ObjectNode newBody) {
        return new StoredDocument(id, rev, doctype, newBody);
    }

    /** Returns the textual value of a body field, or null if absent or not textual. */
    public String text(String field) {
        var node = body.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
