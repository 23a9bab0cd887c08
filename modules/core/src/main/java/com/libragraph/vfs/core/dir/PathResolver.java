package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.error.InvalidNameException;
import com.libragraph.vfs.core.error.NotADirectoryException;
import com.libragraph.vfs.core.error.NotFoundException;
import com.libragraph.vfs.core.error.ParentMissingException;
import com.libragraph.vfs.util.VfsPaths;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Computes the canonical path of a child from its name and parent id.
 */
@ApplicationScoped
public class PathResolver {

    public static final int MAX_NAME_LENGTH = 255;

    @Inject
    DirectoryLookup lookup;

    public record ResolvedPath(String path, DirectoryNode parent) {}

    /**
     * Resolves the parent and returns {@code parent.path + "/" + name}, cleaned.
     *
     * @throws InvalidNameException   if the name is not usable
     * @throws ParentMissingException if the parent id is not an existing directory
     */
    public ResolvedPath computeChildPath(VfsContext ctx, String name, String parentId) {
        checkName(name);
        DirectoryNode parent = resolveParent(ctx, DirectoryNode.parentOrRoot(parentId));
        return new ResolvedPath(VfsPaths.join(parent.path(), name), parent);
    }

    private DirectoryNode resolveParent(VfsContext ctx, String parentId) {
        if (DirectoryNode.ROOT_ID.equals(parentId)) {
            return DirectoryNode.root();
        }
        try {
            return lookup.get(ctx, parentId);
        } catch (NotFoundException | NotADirectoryException e) {
            throw new ParentMissingException(parentId, e);
        }
    }

    /**
     * Rejects names that are empty, too long, dot segments, or that contain the separator
     * or control characters.
     */
    public static void checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidNameException(String.valueOf(name), "name is empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidNameException(name,
                    "longer than " + MAX_NAME_LENGTH + " characters");
        }
        if (name.equals(".") || name.equals("..")) {
            throw new InvalidNameException(name, "reserved name");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '/') {
                throw new InvalidNameException(name, "contains the path separator");
            }
            if (Character.isISOControl(c)) {
                throw new InvalidNameException(name, "contains a control character");
            }
        }
    }
}
