package com.libragraph.vfs.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Lexical operations on slash-separated VFS paths.
 *
 * <p>Paths are case-sensitive strings; nothing here touches a filesystem.
 * {@link #clean(String)} follows the usual lexical rules: repeated separators collapse,
 * {@code .} segments drop, {@code ..} removes the preceding segment and cannot climb
 * above the root of an absolute path.
 */
public final class VfsPaths {

    public static final String SEPARATOR = "/";
    public static final String ROOT = "/";

    private VfsPaths() {
    }

    /**
     * Returns the shortest lexically equivalent path. An empty input yields {@code "."}.
     */
    public static String clean(String path) {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            return ".";
        }
        boolean rooted = path.startsWith(SEPARATOR);
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split(SEPARATOR)) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                    segments.removeLast();
                } else if (!rooted) {
                    segments.addLast("..");
                }
                continue;
            }
            segments.addLast(segment);
        }
        String joined = String.join(SEPARATOR, segments);
        if (rooted) {
            return SEPARATOR + joined;
        }
        return joined.isEmpty() ? "." : joined;
    }

    public static boolean isAbsolute(String path) {
        return path != null && path.startsWith(SEPARATOR);
    }

    /**
     * Returns everything but the last segment of the cleaned path.
     * {@code dirname("/a/b") == "/a"}, {@code dirname("/a") == "/"}.
     */
    public static String dirname(String path) {
        String cleaned = clean(path);
        int idx = cleaned.lastIndexOf('/');
        if (idx < 0) {
            return ".";
        }
        if (idx == 0) {
            return ROOT;
        }
        return cleaned.substring(0, idx);
    }

    /**
     * Joins the non-empty elements with a separator and cleans the result.
     */
    public static String join(String... elements) {
        StringBuilder sb = new StringBuilder();
        for (String element : elements) {
            if (element == null || element.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(element);
        }
        return sb.length() == 0 ? "" : clean(sb.toString());
    }

    /**
     * True when {@code path} is a proper descendant of {@code ancestor}. A path is never
     * under itself.
     */
    public static boolean isUnder(String path, String ancestor) {
        String p = clean(path);
        String a = clean(ancestor);
        if (p.equals(a)) {
            return false;
        }
        return p.startsWith(descendantPrefix(a));
    }

    /**
     * Prefix shared by every proper descendant of {@code path}: the path plus a trailing
     * separator, or just the separator for the root.
     */
    public static String descendantPrefix(String path) {
        String cleaned = clean(path);
        return cleaned.equals(ROOT) ? ROOT : cleaned + SEPARATOR;
    }

    /**
     * Rewrites a descendant path from one ancestor to another:
     * {@code rebase("/a/b/c", "/a", "/x") == "/x/b/c"}.
     *
     * @throws IllegalArgumentException if {@code path} is not under {@code oldAncestor}
     */
    public static String rebase(String path, String oldAncestor, String newAncestor) {
        if (!isUnder(path, oldAncestor)) {
            throw new IllegalArgumentException(
                    "Path " + path + " is not under " + oldAncestor);
        }
        String relative = clean(path).substring(descendantPrefix(oldAncestor).length());
        return join(newAncestor, relative);
    }
}
