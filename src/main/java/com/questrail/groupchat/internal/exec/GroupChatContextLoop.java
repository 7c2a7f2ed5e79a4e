package com.questrail.groupchat.internal.exec;

import com.questrail.groupchat.api.ThoughtSink;
import com.questrail.groupchat.internal.time.Cancellable;
import com.questrail.groupchat.internal.time.MonotonicClock;
import com.questrail.groupchat.internal.time.MonotonicScheduler;
import com.questrail.groupchat.internal.time.WallClock;
import com.questrail.groupchat.observability.GroupChatErrorEvent;
import com.questrail.groupchat.observability.GroupChatObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * GroupChatContextLoop
 * =============================================================================
 * Background loop of a running node.
 *
 * <p>Every tick (one injector interval apart):</p>
 * <ol>
 *   <li>start a discovery scan if the {@link DiscoverySchedule} says one is due</li>
 *   <li>drain the inbound queue into the thought sink</li>
 *   <li>schedule the next tick</li>
 * </ol>
 *
 * <p>Ticks are scheduled on the event loop, so discovery, reading and
 * injection never run concurrently with each other. A tick that fails is
 * reported and the next tick is scheduled anyway. Cancellation is checked
 * before each step.</p>
 */
public final class GroupChatContextLoop
{
    private final PeerDiscovery discovery;
    private final DiscoverySchedule schedule;
    private final ContextInjector injector;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration tickInterval;
    private final CancellationToken cancellation;
    private final WallClock wallClock;
    private final GroupChatObservabilitySink sink;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Cancellable nextTick;

    public GroupChatContextLoop(PeerDiscovery discovery,
                                DiscoverySchedule schedule,
                                ContextInjector injector,
                                MonotonicScheduler scheduler,
                                MonotonicClock clock,
                                Duration tickInterval,
                                CancellationToken cancellation,
                                WallClock wallClock,
                                GroupChatObservabilitySink sink)
    {
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.injector = Objects.requireNonNull(injector, "injector");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Start ticking. Idempotent: only the first call has an effect.
     */
    public void start(ThoughtSink consumer)
    {
        Objects.requireNonNull(consumer, "consumer");
        if (started.compareAndSet(false, true)) {
            scheduleNext(consumer);
        }
    }

    /**
     * Withdraw the pending tick. The cancellation token stops a tick that is
     * already running.
     */
    public void stop()
    {
        Cancellable pending = nextTick;
        if (pending != null) {
            pending.cancel();
        }
    }

    public boolean isStarted()
    {
        return started.get();
    }

    private void scheduleNext(ThoughtSink consumer)
    {
        if (!cancellation.isCancelled()) {
            nextTick = scheduler.scheduleAfter(tickInterval, clock, () -> tick(consumer));
        }
    }

    void tick(ThoughtSink consumer)
    {
        if (cancellation.isCancelled()) {
            return;
        }
        try {
            if (schedule.isDue()) {
                schedule.markRun();
                discovery.scan();
            }
            injector.drainTo(consumer);
        } catch (RuntimeException e) {
            sink.onError(new GroupChatErrorEvent(wallClock.now(), "Context loop error", e));
        }
        scheduleNext(consumer);
    }
}
