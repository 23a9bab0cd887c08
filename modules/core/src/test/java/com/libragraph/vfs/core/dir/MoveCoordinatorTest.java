package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.error.AlreadyExistsException;
import com.libragraph.vfs.core.error.ForbiddenMoveException;
import com.libragraph.vfs.core.error.InvalidPathException;
import com.libragraph.vfs.core.error.NotFoundException;
import com.libragraph.vfs.core.error.OperationCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class MoveCoordinatorTest {

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

    @Test
    void relativePathsAreRejected() {
        assertThatThrownBy(() -> vfs.moveCoordinator.safeRename(vfs.ctx, "a", "/b"))
                .isInstanceOf(InvalidPathException.class);
        assertThatThrownBy(() -> vfs.moveCoordinator.safeRename(vfs.ctx, "/a", "b"))
                .isInstanceOf(InvalidPathException.class);
    }

    @Test
    void moveIntoSelfOrSubtreeIsForbidden() throws Exception {
        Files.createDirectories(root.resolve("a/b"));

        assertThatThrownBy(() -> vfs.moveCoordinator.safeRename(vfs.ctx, "/a", "/a"))
                .isInstanceOf(ForbiddenMoveException.class);
        assertThatThrownBy(() -> vfs.moveCoordinator.safeRename(vfs.ctx, "/a", "/a/b/c"))
                .isInstanceOf(ForbiddenMoveException.class);
        assertThatThrownBy(() -> vfs.moveCoordinator.safeRename(vfs.ctx, "/a/", "/a/./x"))
                .isInstanceOf(ForbiddenMoveException.class);
        assertThat(Files.isDirectory(root.resolve("a/b"))).isTrue();
    }

    @Test
    void siblingWithCommonPrefixIsAllowed() throws Exception {
        Files.createDirectories(root.resolve("a"));

        vfs.moveCoordinator.safeRename(vfs.ctx, "/a", "/ab");

        assertThat(Files.isDirectory(root.resolve("ab"))).isTrue();
        assertThat(Files.exists(root.resolve("a"))).isFalse();
    }

    @Test
    void existingDestinationIsRejected() throws Exception {
        Files.createDirectories(root.resolve("a"));
        Files.createDirectories(root.resolve("b/keep"));

        assertThatThrownBy(() -> vfs.moveCoordinator.safeRename(vfs.ctx, "/a", "/b"))
                .isInstanceOf(AlreadyExistsException.class);
        assertThat(Files.isDirectory(root.resolve("a"))).isTrue();
        assertThat(Files.isDirectory(root.resolve("b/keep"))).isTrue();
    }

    @Test
    void missingSourceIsNotFound() {
        assertThatThrownBy(() -> vfs.moveCoordinator.safeRename(vfs.ctx, "/ghost", "/b"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void cancelledSignalStopsRename() throws Exception {
        Files.createDirectories(root.resolve("a"));
        vfs.cancellation.cancel();

        assertThatThrownBy(() -> vfs.moveCoordinator.safeRename(vfs.ctx, "/a", "/b"))
                .isInstanceOf(OperationCancelledException.class);
        assertThat(Files.isDirectory(root.resolve("a"))).isTrue();
    }

    @Test
    void moveReturnsNumberOfRelocatedDescendants() {
        DirectoryNode a = vfs.mkdir("a");
        DirectoryNode b = vfs.mkdir("b", a);
        vfs.mkdir("c", b);

        int moved = vfs.moveCoordinator.move(vfs.ctx, "/a", "/z");

        assertThat(moved).isEqualTo(2);
        assertThat(vfs.reload(b).path()).isEqualTo("/z/b");
        assertThat(Files.isDirectory(root.resolve("z/b/c"))).isTrue();
    }

    @Test
    void moveOfLeafTouchesNoDocuments() {
        vfs.mkdir("leaf");

        assertThat(vfs.moveCoordinator.move(vfs.ctx, "/leaf", "/other")).isZero();
    }
}
