package com.libragraph.vfs.core.storage;

import com.libragraph.vfs.core.error.AlreadyExistsException;
import com.libragraph.vfs.core.error.InvalidPathException;
import com.libragraph.vfs.core.error.NotFoundException;
import com.libragraph.vfs.util.VfsPaths;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * PhysicalStore backed by a local directory.
 *
 * <p>Layout: VFS path {@code /a/b} lives at {@code {root}/a/b}. Paths are cleaned before
 * resolution and never escape the root.
 */
@ApplicationScoped
public class FilesystemPhysicalStore implements PhysicalStore {

    private static final Logger log = Logger.getLogger(FilesystemPhysicalStore.class);

    @ConfigProperty(name = "vfs.physical-store.filesystem.root")
    String root;

    public FilesystemPhysicalStore() {
    }

    public FilesystemPhysicalStore(String root) {
        this.root = root;
    }

    @PostConstruct
    void init() {
        try {
            Files.createDirectories(rootPath());
            log.infof("Physical store root: %s", rootPath());
        } catch (IOException e) {
            throw new StorageException("Failed to create storage root: " + root, e);
        }
    }

    public Path rootPath() {
        return Path.of(root).toAbsolutePath().normalize();
    }

    Path resolvePath(String vfsPath) {
        if (!VfsPaths.isAbsolute(vfsPath)) {
            throw new InvalidPathException(vfsPath, "path should be absolute");
        }
        Path base = rootPath();
        String relative = VfsPaths.clean(vfsPath).substring(1);
        Path resolved = relative.isEmpty() ? base : base.resolve(relative).normalize();
        if (!resolved.startsWith(base)) {
            throw new InvalidPathException(vfsPath, "resolves outside the storage root");
        }
        return resolved;
    }

    @Override
    public Uni<Void> mkdir(String path) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path target = resolvePath(path);
            try {
                Files.createDirectory(target);
                log.debugf("mkdir %s", path);
            } catch (FileAlreadyExistsException e) {
                throw new AlreadyExistsException(path);
            } catch (IOException e) {
                throw new StorageException("Failed to create directory: " + path, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String path) {
        return Uni.createFrom().item(() -> Files.exists(resolvePath(path)));
    }

    @Override
    public Uni<Void> remove(String path) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path target = resolvePath(path);
            if (target.equals(rootPath())) {
                throw new InvalidPathException(path, "cannot remove the storage root");
            }
            try {
                Files.deleteIfExists(target);
            } catch (IOException e) {
                throw new StorageException("Failed to remove: " + path, e);
            }
        });
    }

    @Override
    public Uni<Void> rename(String oldPath, String newPath) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path source = resolvePath(oldPath);
            Path target = resolvePath(newPath);
            try {
                // Without REPLACE_EXISTING a same-filesystem move is a single rename(2)
                // that refuses an existing target.
                Files.move(source, target);
                log.debugf("rename %s -> %s", oldPath, newPath);
            } catch (FileAlreadyExistsException e) {
                throw new AlreadyExistsException(newPath);
            } catch (NoSuchFileException e) {
                if (!Files.exists(source)) {
                    throw new NotFoundException("No physical entry at path: " + oldPath);
                }
                throw new StorageException("Destination parent missing: " + newPath, e);
            } catch (IOException e) {
                throw new StorageException("Failed to rename " + oldPath + " to " + newPath, e);
            }
        });
    }
}
