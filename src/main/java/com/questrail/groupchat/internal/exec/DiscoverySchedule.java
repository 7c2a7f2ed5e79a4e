package com.questrail.groupchat.internal.exec;

import com.questrail.groupchat.config.GroupChatTimingPolicy;
import com.questrail.groupchat.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * DiscoverySchedule
 * -----------------------------------------------------------------------------
 * Decides when the next recurring discovery scan is due.
 *
 * <p>Short interval during the warm-up window after start, so nodes started
 * together find each other quickly; long interval afterwards, once the mesh
 * has settled.</p>
 *
 * <p>Confined to the event loop; not thread-safe.</p>
 */
public final class DiscoverySchedule
{
    private final MonotonicClock clock;
    private final GroupChatTimingPolicy policy;
    private final long startNanos;

    private long lastRunNanos;

    public DiscoverySchedule(MonotonicClock clock, GroupChatTimingPolicy policy)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.startNanos = clock.nowNanos();
        this.lastRunNanos = startNanos;
    }

    public Duration currentInterval()
    {
        return policy.discoveryIntervalAfter(Duration.ofNanos(clock.nowNanos() - startNanos));
    }

    public boolean isDue()
    {
        return clock.nowNanos() - lastRunNanos >= currentInterval().toNanos();
    }

    public void markRun()
    {
        lastRunNanos = clock.nowNanos();
    }
}
