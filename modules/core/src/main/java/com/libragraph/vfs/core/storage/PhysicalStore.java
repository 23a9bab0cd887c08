package com.libragraph.vfs.core.storage;

import io.smallrye.mutiny.Uni;

/**
 * Hierarchical storage backend addressed by absolute, slash-separated VFS paths.
 *
 * <p>Mirrors the directory tree whose metadata lives in the document store. There is no
 * transaction spanning both: callers compensate or document the gap.
 */
public interface PhysicalStore {

    /**
     * Creates a directory. The parent must already exist.
     *
     * @throws com.libragraph.vfs.core.error.AlreadyExistsException if an entry exists at the path
     * @throws StorageException on I/O errors
     */
    Uni<Void> mkdir(String path);

    /**
     * Checks whether any entry exists at the path.
     */
    Uni<Boolean> exists(String path);

    /**
     * Removes an empty directory or a file. Missing entries are ignored.
     *
     * @throws StorageException on I/O errors
     */
    Uni<Void> remove(String path);

    /**
     * Atomically moves an entry. Never replaces an existing destination.
     *
     * @throws com.libragraph.vfs.core.error.AlreadyExistsException if the destination exists
     * @throws com.libragraph.vfs.core.error.NotFoundException if the source is missing
     * @throws StorageException on I/O errors
     */
    Uni<Void> rename(String oldPath, String newPath);
}
