package com.libragraph.vfs.core.doc;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.vfs.core.error.ConflictException;
import com.libragraph.vfs.core.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class InMemoryDocumentStoreTest {

    private static final String DOCTYPE = "io.libragraph.vfs.test";

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    private static ObjectNode body(String path) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("path", path);
        return body;
    }

    @Test
    void createAssignsIdAndFirstRevision() {
        StoredDocument doc = store.create(DOCTYPE, body("/a"));

        assertThat(doc.id()).isNotBlank();
        assertThat(Revisions.generation(doc.rev())).isEqualTo(1);
        assertThat(store.get(DOCTYPE, doc.id())).contains(doc);
        assertThat(store.get("other.doctype", doc.id())).isEmpty();
    }

    @Test
    void updateBumpsRevision() {
        StoredDocument doc = store.create(DOCTYPE, body("/a"));

        StoredDocument updated = store.update(doc.withBody(body("/b")));

        assertThat(Revisions.generation(updated.rev())).isEqualTo(2);
        assertThat(updated.text("path")).isEqualTo("/b");
        assertThat(store.get(DOCTYPE, doc.id()).orElseThrow().rev()).isEqualTo(updated.rev());
    }

    @Test
    void staleRevisionConflicts() {
        StoredDocument doc = store.create(DOCTYPE, body("/a"));
        store.update(doc.withBody(body("/b")));

        assertThatThrownBy(() -> store.update(doc.withBody(body("/c"))))
                .isInstanceOf(ConflictException.class);
        assertThat(store.get(DOCTYPE, doc.id()).orElseThrow().text("path")).isEqualTo("/b");
    }

    @Test
    void updateOfUnknownIdIsNotFound() {
        StoredDocument ghost = new StoredDocument("ghost", "1-00", DOCTYPE, body("/a"));

        assertThatThrownBy(() -> store.update(ghost)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void unusableRevisionIsConflictOrNotFound() {
        StoredDocument doc = store.create(DOCTYPE, body("/a"));

        assertThatThrownBy(() -> store.update(new StoredDocument(doc.id(), null, DOCTYPE, body("/b"))))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.update(new StoredDocument(doc.id(), "not-a-rev", DOCTYPE, body("/b"))))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.update(new StoredDocument("ghost", null, DOCTYPE, body("/b"))))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void findByEqualityAndPrefix() {
        store.create(DOCTYPE, body("/a"));
        store.create(DOCTYPE, body("/a/b"));
        store.create(DOCTYPE, body("/a/b/c"));
        store.create(DOCTYPE, body("/ab"));
        store.create(DOCTYPE, JsonNodeFactory.instance.objectNode());

        assertThat(store.find(DOCTYPE, Selector.equal("path", "/a"), 0)).hasSize(1);
        assertThat(store.find(DOCTYPE, Selector.startsWith("path", "/a/"), 0))
                .extracting(d -> d.text("path"))
                .containsExactlyInAnyOrder("/a/b", "/a/b/c");
        assertThat(store.find(DOCTYPE, Selector.startsWith("path", "/a/"), 1)).hasSize(1);
        assertThat(store.find("other.doctype", Selector.startsWith("path", "/"), 0)).isEmpty();
    }

    @Test
    void bodiesAreCopiedInAndOut() {
        ObjectNode original = body("/a");
        StoredDocument doc = store.create(DOCTYPE, original);
        original.put("path", "/mutated");
        store.get(DOCTYPE, doc.id()).orElseThrow().body().put("path", "/mutated-too");

        assertThat(store.get(DOCTYPE, doc.id()).orElseThrow().text("path")).isEqualTo("/a");
    }

    @Test
    void concurrentUpdatesWithSameRevisionHaveOneWinner() throws Exception {
        StoredDocument doc = store.create(DOCTYPE, body("/a"));
        int writers = 8;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String path = "/w" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.update(doc.withBody(body(path)));
                    } catch (ConflictException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(conflicts.get()).isEqualTo(writers - 1);
        assertThat(Revisions.generation(store.get(DOCTYPE, doc.id()).orElseThrow().rev())).isEqualTo(2);
    }

    @Test
    void countAndClear() {
        store.create(DOCTYPE, body("/a"));
        store.create(DOCTYPE, body("/b"));
        store.create("other.doctype", body("/c"));

        assertThat(store.count(DOCTYPE)).isEqualTo(2);
        store.clear();
        assertThat(store.count(DOCTYPE)).isZero();
    }
}
