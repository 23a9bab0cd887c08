package com.libragraph.vfs.core.error;

import java.util.List;

/**
 * Thrown after a move when one or more descendant path fix-ups failed.
 *
 * <p>Nothing is rolled back: the physical rename and every fix-up that succeeded stay
 * applied. Each failure is also attached as a suppressed exception.
 */
public class PartialFailureException extends VfsException {

    /** One failed descendant fix-up. */
    public record Failure(String id, String path, Throwable cause) {}

    private final String oldPath;
    private final String newPath;
    private final int attempted;
    private final List<Failure> failures;

    public PartialFailureException(String oldPath, String newPath, int attempted,
                                   List<Failure> failures) {
        super(ErrorKind.PARTIAL_FAILURE,
                failures.size() + " of " + attempted + " descendant updates failed while moving "
                        + oldPath + " to " + newPath);
        this.oldPath = oldPath;
        this.newPath = newPath;
        this.attempted = attempted;
        this.failures = List.copyOf(failures);
        for (Failure f : this.failures) {
            addSuppressed(f.cause());
        }
    }

    public String oldPath() {
        return oldPath;
    }

    public String newPath() {
        return newPath;
    }

    public int attempted() {
        return attempted;
    }

    public List<Failure> failures() {
        return failures;
    }
}
