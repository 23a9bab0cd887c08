package com.libragraph.vfs.core.dir;

import com.libragraph.vfs.core.error.OperationCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Request-scoped cancellation flag owned by the caller. Work already dispatched runs to
 * completion; work that checks the flag afterwards is skipped.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String what) {
        if (cancelled.get()) {
            throw new OperationCancelledException("Cancelled: " + what);
        }
    }
}
