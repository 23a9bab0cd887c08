package com.libragraph.vfs.core.doc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.vfs.core.dao.DocumentDao;
import com.libragraph.vfs.core.dao.DocumentRecord;
import com.libragraph.vfs.core.error.ConflictException;
import com.libragraph.vfs.core.error.NotFoundException;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed DocumentStore. Bodies live in a {@code jsonb} column; updates are a
 * single {@code UPDATE ... WHERE rev = :rev}, so the revision check and the write are one
 * atomic statement.
 */
@ApplicationScoped
@IfBuildProperty(name = "vfs.document-store.type", stringValue = "postgres", enableIfMissing = true)
public class JdbiDocumentStore implements DocumentStore {

    private static final Logger log = Logger.getLogger(JdbiDocumentStore.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectMapper objectMapper;

    public JdbiDocumentStore() {
    }

    public JdbiDocumentStore(Jdbi jdbi, ObjectMapper objectMapper) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        ensureSchema();
    }

    /** Creates the document table and its lookup indexes if missing. Idempotent. */
    public void ensureSchema() {
        jdbi.useExtension(DocumentDao.class, dao -> {
            dao.createTable();
            dao.createPathIndex();
            dao.createFolderIndex();
        });
        log.debug("Document schema ready");
    }

    @Override
    public StoredDocument create(String doctype, ObjectNode body) {
        String id = UUID.randomUUID().toString().replace("-", "");
        String rev = Revisions.first();
        String json = write(body);
        jdbi.useExtension(DocumentDao.class, dao -> dao.insert(id, doctype, rev, json));
        return new StoredDocument(id, rev, doctype, body.deepCopy());
    }

    @Override
    public Optional<StoredDocument> get(String doctype, String id) {
        return jdbi.withExtension(DocumentDao.class, dao -> dao.findById(doctype, id))
                .map(this::toDocument);
    }

    @Override
    public StoredDocument update(StoredDocument doc) {
        // A revision this store never issued cannot match any row.
        String newRev = Revisions.isWellFormed(doc.rev()) ? Revisions.next(doc.rev()) : null;
        int updated = newRev == null ? 0 : jdbi.withExtension(DocumentDao.class,
                dao -> dao.compareAndSet(doc.doctype(), doc.id(), doc.rev(), newRev, write(doc.body())));
        if (updated == 1) {
            return new StoredDocument(doc.id(), newRev, doc.doctype(), doc.body().deepCopy());
        }
        boolean exists = jdbi.withExtension(DocumentDao.class,
                dao -> dao.findById(doc.doctype(), doc.id())).isPresent();
        if (!exists) {
            throw NotFoundException.id(doc.doctype(), doc.id());
        }
        throw new ConflictException(doc.id(), doc.rev());
    }

    @Override
    public List<StoredDocument> find(String doctype, Selector selector, int limit) {
        long max = limit > 0 ? limit : Long.MAX_VALUE;
        List<DocumentRecord> records = jdbi.withExtension(DocumentDao.class, dao ->
                switch (selector.operator()) {
                    case EQUAL -> dao.findEqual(doctype, selector.field(), selector.value(), max);
                    case STARTS_WITH -> dao.findPrefix(doctype, selector.field(), selector.value(), max);
                });
        return records.stream().map(this::toDocument).toList();
    }

    private StoredDocument toDocument(DocumentRecord record) {
        try {
            JsonNode body = objectMapper.readTree(record.body());
            return new StoredDocument(record.id(), record.rev(), record.doctype(), (ObjectNode) body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt document body: id=" + record.id(), e);
        }
    }

    private String write(ObjectNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize document body", e);
        }
    }
}
