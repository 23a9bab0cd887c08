package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.doc.Selector;
import com.libragraph.vfs.core.doc.StoredDocument;
import com.libragraph.vfs.core.error.InvalidPathException;
import com.libragraph.vfs.core.error.NotADirectoryException;
import com.libragraph.vfs.core.error.NotFoundException;
import com.libragraph.vfs.types.NodeType;
import com.libragraph.vfs.util.VfsPaths;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Loads single directory documents by id or by path. The root is synthesized, never read.
 */
@ApplicationScoped
public class DirectoryLookup {

    private static final Logger log = Logger.getLogger(DirectoryLookup.class);

    /**
     * @throws NotFoundException       if no document has the id
     * @throws NotADirectoryException  if the document is not a directory
     */
    public DirectoryNode get(VfsContext ctx, String id) {
        if (DirectoryNode.ROOT_ID.equals(id)) {
            return DirectoryNode.root();
        }
        StoredDocument doc = ctx.documents().get(NodeCodec.DOCTYPE, id)
                .orElseThrow(() -> NotFoundException.id(NodeCodec.DOCTYPE, id));
        if (NodeCodec.typeOf(doc).orElse(null) != NodeType.DIRECTORY) {
            throw new NotADirectoryException(id, doc.text(NodeCodec.TYPE));
        }
        return NodeCodec.decodeDirectory(doc);
    }

    /**
     * Exact match on the cleaned path. Paths are meant to be unique but the store does not
     * enforce it; with several matches the first one returned by the store wins.
     *
     * @throws InvalidPathException if the path is not absolute
     * @throws NotFoundException    if no directory has the path
     */
    public DirectoryNode getByPath(VfsContext ctx, String path) {
        if (!VfsPaths.isAbsolute(path)) {
            throw new InvalidPathException(path, "path should be absolute");
        }
        String cleaned = VfsPaths.clean(path);
        if (cleaned.equals(VfsPaths.ROOT)) {
            return DirectoryNode.root();
        }
        List<StoredDocument> docs = ctx.documents().find(NodeCodec.DOCTYPE,
                        Selector.equal(NodeCodec.PATH, cleaned), 2).stream()
                .filter(d -> NodeCodec.typeOf(d).orElse(null) == NodeType.DIRECTORY)
                .toList();
        if (docs.isEmpty()) {
            throw NotFoundException.path(cleaned);
        }
        if (docs.size() > 1) {
            log.warnf("Path %s is held by more than one directory (e.g. %s and %s)",
                    cleaned, docs.get(0).id(), docs.get(1).id());
        }
        return NodeCodec.decodeDirectory(docs.get(0));
    }
}
