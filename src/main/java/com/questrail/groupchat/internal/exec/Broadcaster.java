package com.questrail.groupchat.internal.exec;

import com.questrail.groupchat.codec.ChatMessageEncoder;
import com.questrail.groupchat.internal.registry.ConnectionRegistry;
import com.questrail.groupchat.internal.time.WallClock;
import com.questrail.groupchat.model.ChatMessage;
import com.questrail.groupchat.observability.BroadcastEvent;
import com.questrail.groupchat.observability.GroupChatErrorEvent;
import com.questrail.groupchat.observability.GroupChatObservabilitySink;
import com.questrail.groupchat.observability.LinkEvent;
import com.questrail.groupchat.transport.PeerLink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Broadcaster
 * =============================================================================
 * Sends one message to every live link.
 *
 * <h2>Fan-out</h2>
 * The message is encoded once and written to each link of a registry
 * snapshot. Every write is independent: a failed write removes and closes
 * that link only and never stops the others.
 *
 * <h2>Result</h2>
 * {@code true} iff at least one link accepted the write. An empty registry is
 * {@code false} and is not an error.
 *
 * <h2>Synchronous bridge</h2>
 * {@link #broadcast(String)} is for callers that are not on the event loop.
 * It hands the send to the loop and waits at most the broadcast timeout. If
 * the loop is gone, does not answer in time, or the caller <em>is</em> the
 * loop thread, the answer is {@code false}; the bridge never throws and
 * never blocks the loop on itself.
 */
public final class Broadcaster
{
    private final String agentName;
    private final ConnectionRegistry registry;
    private final ChatMessageEncoder encoder;
    private final WallClock wallClock;
    private final ScheduledExecutorService loop;
    private final BooleanSupplier onLoopThread;
    private final Duration broadcastTimeout;
    private final int maxMessageLength;
    private final CancellationToken cancellation;
    private final GroupChatObservabilitySink sink;

    public Broadcaster(String agentName,
                       ConnectionRegistry registry,
                       ChatMessageEncoder encoder,
                       WallClock wallClock,
                       ScheduledExecutorService loop,
                       BooleanSupplier onLoopThread,
                       Duration broadcastTimeout,
                       int maxMessageLength,
                       CancellationToken cancellation,
                       GroupChatObservabilitySink sink)
    {
        this.agentName = Objects.requireNonNull(agentName, "agentName");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.onLoopThread = Objects.requireNonNull(onLoopThread, "onLoopThread");
        this.broadcastTimeout = Objects.requireNonNull(broadcastTimeout, "broadcastTimeout");
        this.maxMessageLength = maxMessageLength;
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.sink = Objects.requireNonNull(sink, "sink");

        if (maxMessageLength < 1) {
            throw new IllegalArgumentException("maxMessageLength must be >= 1");
        }
    }

    /**
     * Blocking send for threads other than the event loop.
     *
     * @return {@code true} iff at least one peer accepted the message within
     *         the broadcast timeout
     */
    public boolean broadcast(String text)
    {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (cancellation.isCancelled() || loop.isShutdown() || onLoopThread.getAsBoolean()) {
            sink.onBroadcast(BroadcastEvent.rejected(wallClock.now(), BroadcastEvent.Outcome.NOT_RUNNING));
            return false;
        }
        if (registry.isEmpty()) {
            sink.onBroadcast(BroadcastEvent.rejected(wallClock.now(), BroadcastEvent.Outcome.NO_PEERS));
            return false;
        }

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        try {
            loop.execute(() -> sendOnLoop(text).whenComplete((ok, e) -> {
                if (e != null) {
                    result.completeExceptionally(e);
                }
                else {
                    result.complete(ok);
                }
            }));
            return result.get(broadcastTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            sink.onBroadcast(BroadcastEvent.rejected(wallClock.now(), BroadcastEvent.Outcome.NOT_RUNNING));
            return false;
        } catch (TimeoutException e) {
            sink.onBroadcast(BroadcastEvent.rejected(wallClock.now(), BroadcastEvent.Outcome.TIMED_OUT));
            return false;
        } catch (ExecutionException e) {
            sink.onError(new GroupChatErrorEvent(wallClock.now(), "Broadcast failed", e.getCause()));
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Non-blocking send from any thread. Hops onto the event loop when called
     * from elsewhere.
     */
    public CompletableFuture<Boolean> broadcastAsync(String text)
    {
        if (onLoopThread.getAsBoolean()) {
            return sendOnLoop(text);
        }

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        try {
            loop.execute(() -> sendOnLoop(text).whenComplete((ok, e) -> {
                if (e != null) {
                    result.completeExceptionally(e);
                }
                else {
                    result.complete(ok);
                }
            }));
        } catch (RejectedExecutionException e) {
            sink.onBroadcast(BroadcastEvent.rejected(wallClock.now(), BroadcastEvent.Outcome.NOT_RUNNING));
            result.complete(false);
        }
        return result;
    }

    /**
     * Fan the message out to the current snapshot. Must run on the event loop.
     */
    CompletableFuture<Boolean> sendOnLoop(String text)
    {
        if (text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(false);
        }
        if (cancellation.isCancelled()) {
            sink.onBroadcast(BroadcastEvent.rejected(wallClock.now(), BroadcastEvent.Outcome.NOT_RUNNING));
            return CompletableFuture.completedFuture(false);
        }

        List<PeerLink> targets = registry.snapshot();
        if (targets.isEmpty()) {
            sink.onBroadcast(BroadcastEvent.rejected(wallClock.now(), BroadcastEvent.Outcome.NO_PEERS));
            return CompletableFuture.completedFuture(false);
        }

        byte[] payload = encoder.encode(ChatMessage.of(agentName, truncate(text), wallClock.now()));

        List<CompletableFuture<Boolean>> writes = new ArrayList<>(targets.size());
        for (PeerLink link : targets) {
            writes.add(writeTo(link, payload));
        }

        return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]))
                .thenApplyAsync(ignored -> settle(targets, writes), loop);
    }

    private static CompletableFuture<Boolean> writeTo(PeerLink link, byte[] payload)
    {
        try {
            return link.write(payload).toCompletableFuture().handle((v, e) -> e == null);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean settle(List<PeerLink> targets, List<CompletableFuture<Boolean>> writes)
    {
        int delivered = 0;
        int pruned = 0;
        for (int i = 0; i < targets.size(); i++) {
            PeerLink link = targets.get(i);
            if (writes.get(i).join()) {
                delivered++;
                continue;
            }
            link.close();
            if (registry.remove(link.id()).isPresent()) {
                pruned++;
                sink.onLinkDown(LinkEvent.of(wallClock.now(), link, registry.size(), null));
            }
        }

        BroadcastEvent.Outcome outcome = delivered > 0
                ? BroadcastEvent.Outcome.SENT
                : BroadcastEvent.Outcome.ALL_FAILED;
        sink.onBroadcast(new BroadcastEvent(wallClock.now(), outcome, targets.size(), delivered, pruned));
        return delivered > 0;
    }

    String truncate(String text)
    {
        return text.length() <= maxMessageLength ? text : text.substring(0, maxMessageLength);
    }
}
