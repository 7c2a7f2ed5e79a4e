package com.questrail.groupchat.internal.exec;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared stop signal for the long-running tasks of one node.
 *
 * <p>Discovery, the reader and the context loop check it at every step; once
 * cancelled a token stays cancelled.</p>
 */
public final class CancellationToken
{
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return {@code true} if this call cancelled the token
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
