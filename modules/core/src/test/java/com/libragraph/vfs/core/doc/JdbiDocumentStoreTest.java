package com.libragraph.vfs.core.doc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.vfs.core.dao.DatabaseDao;
import com.libragraph.vfs.core.db.JdbiProducer;
import com.libragraph.vfs.core.error.ConflictException;
import com.libragraph.vfs.core.error.NotFoundException;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class JdbiDocumentStoreTest {

    private static final String DOCTYPE = "io.libragraph.vfs.test";

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static Jdbi jdbi;
    private static JdbiDocumentStore store;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @BeforeAll
    static void connect() {
        jdbi = JdbiProducer.configure(Jdbi.create(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword()));
        store = new JdbiDocumentStore(jdbi, MAPPER);
        store.ensureSchema();
    }

    @BeforeEach
    void truncate() {
        jdbi.useHandle(h -> h.execute("TRUNCATE vfs_document"));
    }

    private static ObjectNode body(String path, String folderId) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("path", path);
        body.put("folder_id", folderId);
        body.putArray("tags").add("t");
        return body;
    }

    @Test
    void schemaIsIdempotent() {
        assertThatNoException().isThrownBy(store::ensureSchema);
        assertThat(jdbi.withExtension(DatabaseDao.class, DatabaseDao::pgVersion)).contains("PostgreSQL");
    }

    @Test
    void createAndGetKeepBody() {
        StoredDocument created = store.create(DOCTYPE, body("/a", "root"));

        StoredDocument loaded = store.get(DOCTYPE, created.id()).orElseThrow();
        assertThat(loaded.rev()).isEqualTo(created.rev());
        assertThat(loaded.body()).isEqualTo(created.body());
        assertThat(store.get("other.doctype", created.id())).isEmpty();
    }

    @Test
    void revisionCheckedUpdate() {
        StoredDocument created = store.create(DOCTYPE, body("/a", "root"));
        StoredDocument updated = store.update(created.withBody(body("/b", "root")));

        assertThat(Revisions.generation(updated.rev())).isEqualTo(2);
        assertThat(store.get(DOCTYPE, created.id()).orElseThrow().text("path")).isEqualTo("/b");
        assertThatThrownBy(() -> store.update(created.withBody(body("/c", "root"))))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.update(new StoredDocument("ghost", "1-00", DOCTYPE,
                body("/x", "root"))))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void unusableRevisionIsConflictOrNotFound() {
        StoredDocument created = store.create(DOCTYPE, body("/a", "root"));

        assertThatThrownBy(() -> store.update(new StoredDocument(created.id(), null, DOCTYPE,
                body("/b", "root"))))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.update(new StoredDocument(created.id(), "not-a-rev", DOCTYPE,
                body("/b", "root"))))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.update(new StoredDocument("ghost", null, DOCTYPE,
                body("/b", "root"))))
                .isInstanceOf(NotFoundException.class);
        assertThat(store.get(DOCTYPE, created.id()).orElseThrow()).isEqualTo(created);
    }

    @Test
    void findEqualAndPrefix() {
        store.create(DOCTYPE, body("/a", "root"));
        store.create(DOCTYPE, body("/a/b", "p1"));
        store.create(DOCTYPE, body("/a/b/c", "p2"));
        store.create(DOCTYPE, body("/ab", "root"));
        store.create(DOCTYPE, body("/a_x", "root"));

        assertThat(store.find(DOCTYPE, Selector.equal("folder_id", "root"), 0)).hasSize(3);
        assertThat(store.find(DOCTYPE, Selector.equal("folder_id", "root"), 2)).hasSize(2);
        assertThat(store.find(DOCTYPE, Selector.startsWith("path", "/a/"), 0))
                .extracting(d -> d.text("path"))
                .containsExactlyInAnyOrder("/a/b", "/a/b/c");
        // Pattern characters in the prefix are matched literally.
        assertThat(store.find(DOCTYPE, Selector.startsWith("path", "/a_"), 0))
                .extracting(d -> d.text("path"))
                .containsExactly("/a_x");
    }
}
