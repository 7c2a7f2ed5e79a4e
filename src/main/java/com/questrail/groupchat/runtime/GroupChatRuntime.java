package com.questrail.groupchat.runtime;

import com.questrail.groupchat.api.GroupChat;
import com.questrail.groupchat.api.ThoughtSink;
import com.questrail.groupchat.codec.impl.JsonChatMessageCodec;
import com.questrail.groupchat.config.GroupChatConfig;
import com.questrail.groupchat.config.GroupChatTimingPolicy;
import com.questrail.groupchat.internal.exec.Broadcaster;
import com.questrail.groupchat.internal.exec.CancellationToken;
import com.questrail.groupchat.internal.exec.ContextInjector;
import com.questrail.groupchat.internal.exec.DiscoverySchedule;
import com.questrail.groupchat.internal.exec.GroupChatContextLoop;
import com.questrail.groupchat.internal.exec.InboundQueue;
import com.questrail.groupchat.internal.exec.PeerDiscovery;
import com.questrail.groupchat.internal.exec.PeerReader;
import com.questrail.groupchat.internal.registry.ConnectionRegistry;
import com.questrail.groupchat.internal.time.MonotonicClock;
import com.questrail.groupchat.internal.time.ScheduledExecutorScheduler;
import com.questrail.groupchat.internal.time.SystemMonotonicClock;
import com.questrail.groupchat.internal.time.SystemWallClock;
import com.questrail.groupchat.internal.time.WallClock;
import com.questrail.groupchat.model.ChatMessage;
import com.questrail.groupchat.observability.GroupChatErrorEvent;
import com.questrail.groupchat.observability.GroupChatObservabilitySink;
import com.questrail.groupchat.observability.NullObservabilitySink;
import com.questrail.groupchat.observability.TransportEvent;
import com.questrail.groupchat.transport.PeerLink;
import com.questrail.groupchat.transport.PeerTransport;
import com.questrail.groupchat.transport.tcp.netty.NettyTcpPeerTransport;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * GroupChatRuntime
 * =============================================================================
 * Composition root and lifecycle owner of one mesh node.
 *
 * <p>Wires the transport, the connection registry, the reader, discovery,
 * the broadcaster and the context loop around a single event loop, and
 * exposes them as a {@link GroupChat}.</p>
 *
 * <h2>Shutdown</h2>
 * {@link #cleanup()} cancels the node-wide {@link CancellationToken} first.
 * Every loop task checks it, so nothing new is dialled, read, injected or
 * sent once cleanup has begun. The listener and links are closed next, and
 * the event loop is released last.
 */
public final class GroupChatRuntime implements GroupChat
{
    private final GroupChatConfig config;
    private final PeerTransport transport;
    private final GroupChatObservabilitySink sink;
    private final WallClock wallClock;

    private final ConnectionRegistry registry;
    private final InboundQueue queue;
    private final CancellationToken cancellation;
    private final PeerDiscovery discovery;
    private final DiscoverySchedule schedule;
    private final Broadcaster broadcaster;
    private final GroupChatContextLoop contextLoop;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean cleanedUp = new AtomicBoolean(false);
    private volatile boolean listenerBound;

    private GroupChatRuntime(Builder builder)
    {
        this.config = builder.config;
        this.transport = builder.transport != null ? builder.transport : new NettyTcpPeerTransport();
        this.sink = builder.observabilitySink;
        this.wallClock = builder.wallClock;
        MonotonicClock clock = builder.monotonicClock;
        GroupChatTimingPolicy timing = config.timingPolicy();

        this.registry = new ConnectionRegistry();
        this.queue = new InboundQueue(config.queueCapacity());
        this.cancellation = new CancellationToken();

        JsonChatMessageCodec codec = new JsonChatMessageCodec();

        transport.setListener(new PeerReader(registry, codec, queue, cancellation, wallClock, sink));

        this.discovery = new PeerDiscovery(
                config.host(),
                config.port(),
                config.discoveryRange(),
                timing.connectTimeout(),
                transport,
                registry,
                cancellation,
                wallClock,
                sink);

        this.schedule = new DiscoverySchedule(clock, timing);

        this.broadcaster = new Broadcaster(
                config.agentName(),
                registry,
                codec,
                wallClock,
                transport.loop(),
                transport::inLoop,
                timing.broadcastTimeout(),
                config.maxMessageLength(),
                cancellation,
                sink);

        ContextInjector injector = new ContextInjector(config.agentName(), queue, cancellation, wallClock, sink);

        this.contextLoop = new GroupChatContextLoop(
                discovery,
                schedule,
                injector,
                new ScheduledExecutorScheduler(transport.loop(), clock),
                clock,
                timing.injectorInterval(),
                cancellation,
                wallClock,
                sink);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public boolean initialize()
    {
        if (cleanedUp.get()) {
            return false;
        }
        if (initialized.get()) {
            return true;
        }

        InetSocketAddress address = config.bindAddress();
        sink.onTransportEvent(event(TransportEvent.Kind.STARTING, null));

        try {
            InetSocketAddress bound = transport.bind(address).toCompletableFuture().get(5, TimeUnit.SECONDS);
            listenerBound = true;
            sink.onTransportEvent(new TransportEvent(
                    wallClock.now(), TransportEvent.Kind.LISTENER_BOUND, bound, config.agentName(), null));
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof BindException) {
                sink.onTransportEvent(event(TransportEvent.Kind.CLIENT_ONLY, cause));
            }
            else {
                sink.onTransportEvent(event(TransportEvent.Kind.LISTENER_FAILED, cause));
                return false;
            }
        } catch (TimeoutException e) {
            sink.onTransportEvent(event(TransportEvent.Kind.LISTENER_FAILED, e));
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }

        GroupChatTimingPolicy timing = config.timingPolicy();
        Duration budget = timing.scanBudget(discovery.candidatePorts().size());

        // Two passes: the second catches peers that were binding during the first.
        schedule.markRun();
        awaitScan(budget);
        if (!sleep(timing.secondPassDelay())) {
            return false;
        }
        awaitScan(budget);

        initialized.set(true);
        return true;
    }

    @Override
    public void startContextLoop(ThoughtSink thoughtSink)
    {
        Objects.requireNonNull(thoughtSink, "thoughtSink");
        if (!initialized.get() || cleanedUp.get()) {
            throw new IllegalStateException("Group chat node is not initialized");
        }
        contextLoop.start(thoughtSink);
    }

    @Override
    public boolean broadcast(String text)
    {
        if (!initialized.get()) {
            return false;
        }
        return broadcaster.broadcast(text);
    }

    @Override
    public CompletionStage<Boolean> broadcastAsync(String text)
    {
        if (!initialized.get()) {
            return CompletableFuture.completedFuture(false);
        }
        return broadcaster.broadcastAsync(text);
    }

    @Override
    public boolean isAvailable()
    {
        return !cleanedUp.get() && (listenerBound || !registry.isEmpty());
    }

    @Override
    public int connectedPeerCount()
    {
        return registry.size();
    }

    @Override
    public Set<Integer> connectedPorts()
    {
        return registry.connectedPorts();
    }

    @Override
    public List<ChatMessage> pendingMessages()
    {
        return queue.drain();
    }

    /**
     * {@inheritDoc}
     *
     * <p>When called on the event loop (e.g. from a thought sink), the node
     * stops at once and the blocking part of shutdown continues on a separate
     * thread; the call returns without waiting for it.</p>
     */
    @Override
    public void cleanup()
    {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }

        cancellation.cancel();
        contextLoop.stop();

        if (transport.inLoop()) {
            Thread closer = new Thread(this::release, "group-chat-cleanup-" + config.agentName());
            closer.setDaemon(true);
            closer.start();
            return;
        }
        release();
    }

    /**
     * Close the listener and links, then release the loop. Must not run on
     * the event loop.
     */
    private void release()
    {
        List<CompletableFuture<Void>> closing = new ArrayList<>();
        closing.add(transport.closeListener().toCompletableFuture());
        listenerBound = false;

        for (PeerLink link : registry.snapshot()) {
            closing.add(link.close().toCompletableFuture());
        }

        try {
            CompletableFuture.allOf(closing.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            sink.onError(new GroupChatErrorEvent(wallClock.now(), "Error while closing links", e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        clearRegistry();
        queue.clear();

        sink.onTransportEvent(event(TransportEvent.Kind.STOPPED, null));
        transport.shutdown();
    }

    private void clearRegistry()
    {
        try {
            CompletableFuture.runAsync(registry::clear, transport.loop()).get(1, TimeUnit.SECONDS);
        } catch (RejectedExecutionException | ExecutionException | TimeoutException e) {
            // Loop already gone; nothing else touches the registry now.
            registry.clear();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            registry.clear();
        }
    }

    private void awaitScan(Duration budget)
    {
        try {
            discovery.requestScan().get(budget.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            sink.onError(new GroupChatErrorEvent(wallClock.now(), "Startup discovery failed", unwrap(e)));
        } catch (TimeoutException e) {
            sink.onError(new GroupChatErrorEvent(wallClock.now(), "Startup discovery did not finish in time", e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean sleep(Duration delay)
    {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private TransportEvent event(TransportEvent.Kind kind, Throwable cause)
    {
        return new TransportEvent(wallClock.now(), kind, config.bindAddress(), config.agentName(), cause);
    }

    private static Throwable unwrap(Throwable error)
    {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    public static final class Builder
    {
        private GroupChatConfig config;
        private PeerTransport transport;
        private GroupChatObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(GroupChatConfig config)
        {
            this.config = config;
            return this;
        }

        /**
         * Replace the Netty transport, e.g. with a test double.
         */
        public Builder withTransport(PeerTransport transport)
        {
            this.transport = transport;
            return this;
        }

        public Builder withObservabilitySink(GroupChatObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock)
        {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock)
        {
            this.wallClock = clock;
            return this;
        }

        public GroupChatRuntime build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(wallClock, "wallClock");
            return new GroupChatRuntime(this);
        }
    }
}
