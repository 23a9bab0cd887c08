package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.doc.Selector;
import com.libragraph.vfs.core.doc.StoredDocument;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads the direct children of a directory and records them in the {@link ChildrenCache}.
 *
 * <p>Only the first page ({@code vfs.children.page-size} documents) is read; there is no
 * continuation.
 */
@ApplicationScoped
public class ChildrenFetcher {

    private static final Logger log = Logger.getLogger(ChildrenFetcher.class);

    public static final int DEFAULT_PAGE_SIZE = 10;

    @ConfigProperty(name = "vfs.children.page-size", defaultValue = "10")
    int pageSize = DEFAULT_PAGE_SIZE;

    @Inject
    ChildrenCache cache;

    public Children fetch(VfsContext ctx, DirectoryNode parent) {
        List<StoredDocument> docs = ctx.documents().find(NodeCodec.DOCTYPE,
                Selector.equal(NodeCodec.FOLDER_ID, parent.id()), pageSize);

        List<FileNode> files = new ArrayList<>();
        List<DirectoryNode> dirs = new ArrayList<>();
        for (StoredDocument doc : docs) {
            var type = NodeCodec.typeOf(doc);
            if (type.isEmpty()) {
                log.debugf("Skipping child %s of %s with unknown type '%s'",
                        doc.id(), parent.id(), doc.text(NodeCodec.TYPE));
                continue;
            }
            switch (type.get()) {
                case FILE -> files.add(NodeCodec.decodeFile(doc));
                case DIRECTORY -> dirs.add(NodeCodec.decodeDirectory(doc));
            }
        }
        if (docs.size() >= pageSize) {
            log.debugf("Children of %s truncated at %d", parent.path(), pageSize);
        }

        Children children = new Children(parent.id(), parent.path(), files, dirs);
        cache.put(children);
        return children;
    }
}
