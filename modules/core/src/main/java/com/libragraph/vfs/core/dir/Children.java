package com.libragraph.vfs.core.dir;

import java.util.List;

/**
 * Direct children of one directory, in the order the store returned them.
 */
public record Children(String parentId, String parentPath, List<FileNode> files,
                       List<DirectoryNode> dirs) {

    public Children {
        files = List.copyOf(files);
        dirs = List.copyOf(dirs);
    }

    public int size() {
        return files.size() + dirs.size();
    }
}
