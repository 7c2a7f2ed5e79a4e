package com.questrail.groupchat.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task scheduled through {@link MonotonicScheduler}.
 *
 * <p>Used by the recurring background tasks of a node (the context loop tick)
 * so that shutdown can withdraw the next pending run.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled earlier.
     */
    boolean cancel();
}
