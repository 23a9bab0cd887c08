package com.libragraph.vfs.core.dir;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.vfs.core.doc.Selector;
import com.libragraph.vfs.core.doc.StoredDocument;
import com.libragraph.vfs.core.error.InvalidPathException;
import com.libragraph.vfs.core.error.PartialFailureException;
import com.libragraph.vfs.util.VfsPaths;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Rewrites the {@code path} of every descendant document after a directory moved.
 *
 * <p>One unit of work per descendant, run on the fan-out executor with at most
 * {@code vfs.move.max-concurrent-fixups} in flight. Each unit is an independent
 * revision-checked update; the call returns only after every unit has finished.
 */
@ApplicationScoped
public class DescendantPathFixer {

    private static final Logger log = Logger.getLogger(DescendantPathFixer.class);

    public static final int DEFAULT_MAX_CONCURRENT = 16;

    @ConfigProperty(name = "vfs.move.max-concurrent-fixups", defaultValue = "16")
    int maxConcurrent = DEFAULT_MAX_CONCURRENT;

    @Inject
    @Named("fanoutExecutor")
    ExecutorService executor;

    private record Outcome(StoredDocument doc, Throwable failure) {
        static Outcome ok(StoredDocument doc) {
            return new Outcome(doc, null);
        }

        static Outcome failed(StoredDocument doc, Throwable failure) {
            return new Outcome(doc, failure);
        }
    }

    /**
     * Relocates all proper descendants of {@code oldPath} under {@code newPath}.
     *
     * @return number of descendant documents updated
     * @throws PartialFailureException if any unit failed; successful units stay applied
     */
    public int fixDescendants(VfsContext ctx, String oldPath, String newPath) {
        String from = VfsPaths.clean(oldPath);
        String to = VfsPaths.clean(newPath);

        List<StoredDocument> descendants = ctx.documents().find(NodeCodec.DOCTYPE,
                Selector.startsWith(NodeCodec.PATH, VfsPaths.descendantPrefix(from)), 0);
        if (descendants.isEmpty()) {
            return 0;
        }
        log.infof("Rewriting %d descendant paths: %s -> %s", descendants.size(), from, to);

        List<Outcome> outcomes = Multi.createFrom().iterable(descendants)
                .onItem().transformToUni(doc -> relocateAsync(ctx, doc, from, to))
                .merge(Math.max(1, maxConcurrent))
                .collect().asList()
                .await().indefinitely();

        List<PartialFailureException.Failure> failures = outcomes.stream()
                .filter(o -> o.failure() != null)
                .map(o -> new PartialFailureException.Failure(
                        o.doc().id(), o.doc().text(NodeCodec.PATH), o.failure()))
                .toList();
        if (!failures.isEmpty()) {
            log.errorf("Move %s -> %s left %d of %d descendants unrelocated",
                    from, to, failures.size(), descendants.size());
            throw new PartialFailureException(from, to, descendants.size(), failures);
        }
        return descendants.size();
    }

    private Uni<Outcome> relocateAsync(VfsContext ctx, StoredDocument doc, String from, String to) {
        return Uni.createFrom().item(() -> relocate(ctx, doc, from, to))
                .runSubscriptionOn(executor)
                .onItem().transform(Outcome::ok)
                .onFailure().recoverWithItem(e -> {
                    log.debugf("Descendant %s failed: %s", doc.id(), e.getMessage());
                    return Outcome.failed(doc, e);
                });
    }

    StoredDocument relocate(VfsContext ctx, StoredDocument doc, String from, String to) {
        ctx.cancellation().throwIfCancelled("path fix-up of " + doc.id());
        String current = doc.text(NodeCodec.PATH);
        if (current == null || !VfsPaths.isUnder(current, from)) {
            // Moved out of the subtree between the query and this unit.
            throw new InvalidPathException(String.valueOf(current),
                    "descendant " + doc.id() + " is no longer under " + from);
        }
        ObjectNode body = doc.body().deepCopy();
        body.put(NodeCodec.PATH, VfsPaths.rebase(current, from, to));
        StoredDocument updated = ctx.documents().update(doc.withBody(body));
        log.debugf("Relocated %s: %s -> %s", doc.id(), current, body.get(NodeCodec.PATH).asText());
        return updated;
    }
}
