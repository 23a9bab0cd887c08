package com.libragraph.vfs.core.error;

/**
 * Thrown when an update carries a revision that no longer matches the stored one.
 */
public class ConflictException extends VfsException {

    private final String id;
    private final String expectedRev;

    public ConflictException(String id, String expectedRev) {
        super(ErrorKind.CONFLICT,
                "Revision conflict on document " + id + " (expected rev " + expectedRev + ")");
        this.id = id;
        this.expectedRev = expectedRev;
    }

    public String id() {
        return id;
    }

    public String expectedRev() {
        return expectedRev;
    }
}
