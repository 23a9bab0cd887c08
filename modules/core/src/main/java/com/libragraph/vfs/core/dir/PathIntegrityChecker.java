package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.doc.Selector;
import com.libragraph.vfs.core.doc.StoredDocument;
import com.libragraph.vfs.types.NodeType;
import com.libragraph.vfs.util.VfsPaths;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a subtree through parent links and reports every directory whose stored path
 * disagrees with {@code parent.path + "/" + name}.
 *
 * <p>Reads every child, not just the first page, so it is meant for offline checks and
 * tests rather than request paths. The walk is not isolated from concurrent moves.
 */
@ApplicationScoped
public class PathIntegrityChecker {

    private static final Logger log = Logger.getLogger(PathIntegrityChecker.class);

    public record Violation(String id, String expectedPath, String actualPath) {}

    public List<Violation> check(VfsContext ctx, DirectoryNode top) {
        List<Violation> violations = new ArrayList<>();
        Deque<DirectoryNode> pending = new ArrayDeque<>();
        pending.add(top);
        Set<String> visited = new HashSet<>();

        while (!pending.isEmpty()) {
            DirectoryNode parent = pending.poll();
            if (!visited.add(parent.id())) {
                continue;
            }
            List<StoredDocument> docs = ctx.documents().find(NodeCodec.DOCTYPE,
                    Selector.equal(NodeCodec.FOLDER_ID, parent.id()), 0);
            for (StoredDocument doc : docs) {
                if (NodeCodec.typeOf(doc).orElse(null) != NodeType.DIRECTORY) {
                    continue;
                }
                DirectoryNode child = NodeCodec.decodeDirectory(doc);
                String expected = VfsPaths.join(parent.path(), child.name());
                if (!expected.equals(child.path())) {
                    violations.add(new Violation(child.id(), expected, child.path()));
                }
                // Descend with the expected path so one bad ancestor does not flag its subtree.
                pending.add(child.withPath(expected));
            }
        }
        if (!violations.isEmpty()) {
            log.warnf("%d path violations under %s (%d directories checked)",
                    violations.size(), top.path(), visited.size());
        }
        return violations;
    }
}
