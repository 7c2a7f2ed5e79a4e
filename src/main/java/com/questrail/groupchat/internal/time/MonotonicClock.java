package com.questrail.groupchat.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for operational decisions: discovery cadence and the warm-up
 * window that follows start.
 *
 * <p>Wall-clock time is used only for the {@code timestamp} carried on the
 * wire (see {@link WallClock}); it never decides when something runs.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
