package com.libragraph.vfs.core.doc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.vfs.core.error.ConflictException;
import com.libragraph.vfs.core.error.NotFoundException;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Heap-backed DocumentStore for development and testing.
 *
 * <p>Revision checks are a compare-and-swap on the map entry, so concurrent updates of the
 * same document behave like the database-backed store. Bodies are deep-copied on the way
 * in and out.
 */
@ApplicationScoped
@IfBuildProperty(name = "vfs.document-store.type", stringValue = "memory")
public class InMemoryDocumentStore implements DocumentStore {

    private final ConcurrentMap<String, StoredDocument> docs = new ConcurrentHashMap<>();

    private static String key(String doctype, String id) {
        return doctype + "/" + id;
    }

    @Override
    public StoredDocument create(String doctype, ObjectNode body) {
        String id = UUID.randomUUID().toString().replace("-", "");
        StoredDocument stored = new StoredDocument(id, Revisions.first(), doctype, body.deepCopy());
        docs.put(key(doctype, id), stored);
        return copy(stored);
    }

    @Override
    public Optional<StoredDocument> get(String doctype, String id) {
        return Optional.ofNullable(docs.get(key(doctype, id))).map(InMemoryDocumentStore::copy);
    }

    @Override
    public StoredDocument update(StoredDocument doc) {
        String key = key(doc.doctype(), doc.id());
        StoredDocument[] result = new StoredDocument[1];
        StoredDocument updated = docs.computeIfPresent(key, (k, current) -> {
            if (!current.rev().equals(doc.rev())) {
                return current;
            }
            result[0] = new StoredDocument(doc.id(), Revisions.next(current.rev()),
                    doc.doctype(), doc.body().deepCopy());
            return result[0];
        });
        if (updated == null) {
            throw NotFoundException.id(doc.doctype(), doc.id());
        }
        if (result[0] == null) {
            throw new ConflictException(doc.id(), doc.rev());
        }
        return copy(result[0]);
    }

    @Override
    public List<StoredDocument> find(String doctype, Selector selector, int limit) {
        List<StoredDocument> matches = new ArrayList<>();
        for (StoredDocument doc : docs.values()) {
            if (!doc.doctype().equals(doctype) || !selector.matches(doc.text(selector.field()))) {
                continue;
            }
            matches.add(copy(doc));
            if (limit > 0 && matches.size() >= limit) {
                break;
            }
        }
        return matches;
    }

    /** Number of stored documents of a doctype. */
    public int count(String doctype) {
        return (int) docs.values().stream().filter(d -> d.doctype().equals(doctype)).count();
    }

    /** Drops every document (for testing). */
    public void clear() {
        docs.clear();
    }

    private static StoredDocument copy(StoredDocument doc) {
        return doc.withBody(doc.body().deepCopy());
    }
}
