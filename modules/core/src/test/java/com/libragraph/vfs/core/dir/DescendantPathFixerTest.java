package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.doc.StoredDocument;
import com.libragraph.vfs.core.error.InvalidPathException;
import com.libragraph.vfs.core.error.OperationCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class DescendantPathFixerTest {

    @TempDir
    Path root;

    private VfsTestSupport vfs;

    @BeforeEach
    void setUp() {
        vfs = new VfsTestSupport(root);
    }

    @AfterEach
    void tearDown() {
        vfs.close();
    }

    private StoredDocument load(DirectoryNode node) {
        return vfs.documents.get(NodeCodec.DOCTYPE, node.id()).orElseThrow();
    }

    @Test
    void rewritesEveryDescendantButNotSiblingsWithCommonPrefix() {
        DirectoryNode a = vfs.mkdir("a");
        DirectoryNode b = vfs.mkdir("b", a);
        DirectoryNode c = vfs.mkdir("c", b);
        DirectoryNode ab = vfs.mkdir("ab");

        int fixed = vfs.fixer.fixDescendants(vfs.ctx, "/a", "/z");

        assertThat(fixed).isEqualTo(2);
        assertThat(vfs.reload(b).path()).isEqualTo("/z/b");
        assertThat(vfs.reload(c).path()).isEqualTo("/z/b/c");
        assertThat(vfs.reload(a).path()).isEqualTo("/a");
        assertThat(vfs.reload(ab)).isEqualTo(ab);
    }

    @Test
    void manyDescendantsWithLowConcurrency() {
        DirectoryNode top = vfs.mkdir("top");
        for (int i = 0; i < 40; i++) {
            vfs.mkdir("d" + i, top);
        }
        vfs.fixer.maxConcurrent = 2;

        assertThat(vfs.fixer.fixDescendants(vfs.ctx, "/top", "/moved")).isEqualTo(40);
    }

    @Test
    void unitRefusesDocumentThatLeftTheSubtree() {
        DirectoryNode a = vfs.mkdir("a");
        DirectoryNode b = vfs.mkdir("b", a);

        assertThatThrownBy(() -> vfs.fixer.relocate(vfs.ctx, load(b), "/other", "/z"))
                .isInstanceOf(InvalidPathException.class);
        assertThat(vfs.reload(b)).isEqualTo(b);
    }

    @Test
    void unitChecksCancellationFirst() {
        DirectoryNode a = vfs.mkdir("a");
        DirectoryNode b = vfs.mkdir("b", a);
        vfs.cancellation.cancel();

        assertThatThrownBy(() -> vfs.fixer.relocate(vfs.ctx, load(b), "/a", "/z"))
                .isInstanceOf(OperationCancelledException.class);
        assertThat(vfs.reload(b)).isEqualTo(b);
    }
}
