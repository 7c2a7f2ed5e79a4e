package com.questrail.groupchat.internal.exec;

import com.questrail.groupchat.internal.registry.ConnectionRegistry;
import com.questrail.groupchat.internal.time.WallClock;
import com.questrail.groupchat.observability.DiscoveryEvent;
import com.questrail.groupchat.observability.GroupChatErrorEvent;
import com.questrail.groupchat.observability.GroupChatObservabilitySink;
import com.questrail.groupchat.observability.LinkEvent;
import com.questrail.groupchat.transport.PeerLink;
import com.questrail.groupchat.transport.PeerTransport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PeerDiscovery
 * =============================================================================
 * Dials every port in a fixed window around this node's own port and keeps
 * the links that connect.
 *
 * <h2>Scan</h2>
 * For each offset in {@code [-range, +range]} except zero, in ascending order:
 * <ol>
 *   <li>skip the port if the registry already holds a link to it</li>
 *   <li>otherwise connect with a short timeout</li>
 *   <li>on success, register the link, then start reading it</li>
 *   <li>move on to the next port whatever the outcome</li>
 * </ol>
 * Attempts run one after another so that the registry check of a later port
 * sees the links made earlier in the same scan.
 *
 * <h2>Mutual exclusion</h2>
 * At most one scan is in flight. A scan requested while another runs joins
 * the running one instead of starting a second, so two scans can never race
 * to dial the same port.
 *
 * <h2>Error classification</h2>
 * Refused connections, connect timeouts and other socket errors are the
 * normal result of dialling an empty port and are not reported. Anything else
 * is reported through {@link GroupChatObservabilitySink#onError} and the scan
 * continues.
 */
public final class PeerDiscovery
{
    private final String host;
    private final int basePort;
    private final int range;
    private final Duration connectTimeout;

    private final PeerTransport transport;
    private final ConnectionRegistry registry;
    private final CancellationToken cancellation;
    private final WallClock wallClock;
    private final GroupChatObservabilitySink sink;

    private final AtomicReference<CompletableFuture<Integer>> inFlight = new AtomicReference<>();

    public PeerDiscovery(String host,
                         int basePort,
                         int range,
                         Duration connectTimeout,
                         PeerTransport transport,
                         ConnectionRegistry registry,
                         CancellationToken cancellation,
                         WallClock wallClock,
                         GroupChatObservabilitySink sink)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.basePort = basePort;
        this.range = range;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Ports this node dials, in scan order.
     */
    public List<Integer> candidatePorts()
    {
        List<Integer> ports = new ArrayList<>(2 * range);
        for (int offset = -range; offset <= range; offset++) {
            int port = basePort + offset;
            if (offset != 0 && port >= 1 && port <= 65535) {
                ports.add(port);
            }
        }
        return Collections.unmodifiableList(ports);
    }

    /**
     * Run a scan from any thread. The scan itself executes on the event loop.
     *
     * @return future completing with the number of new links; completes with
     *         zero if the loop no longer accepts work
     */
    public CompletableFuture<Integer> requestScan()
    {
        CompletableFuture<Integer> result = new CompletableFuture<>();
        try {
            transport.loop().execute(() -> scan().whenComplete((n, e) -> {
                if (e != null) {
                    result.completeExceptionally(e);
                }
                else {
                    result.complete(n);
                }
            }));
        } catch (RejectedExecutionException e) {
            result.complete(0);
        }
        return result;
    }

    /**
     * Start a scan, or join the one in flight. Must be called on the event loop.
     */
    public CompletableFuture<Integer> scan()
    {
        CompletableFuture<Integer> fresh = new CompletableFuture<>();
        while (!inFlight.compareAndSet(null, fresh)) {
            CompletableFuture<Integer> running = inFlight.get();
            if (running != null) {
                return running;
            }
        }

        scanFrom(candidatePorts().iterator(), 0, fresh);
        return fresh;
    }

    public boolean isScanning()
    {
        return inFlight.get() != null;
    }

    private void scanFrom(Iterator<Integer> ports, int found, CompletableFuture<Integer> scan)
    {
        while (ports.hasNext() && !cancellation.isCancelled()) {
            int port = ports.next();
            if (registry.isPortConnected(port)) {
                continue;
            }

            final ScheduledExecutorService loop = transport.loop();
            try {
                transport.connect(new InetSocketAddress(host, port), connectTimeout)
                        .whenCompleteAsync((link, error) -> {
                            int total = found;
                            if (error == null) {
                                if (attach(link)) {
                                    total++;
                                }
                            }
                            else {
                                classify(port, error);
                            }
                            scanFrom(ports, total, scan);
                        }, loop);
            } catch (RejectedExecutionException e) {
                finish(found, scan);
            }
            return;
        }

        finish(found, scan);
    }

    private void finish(int found, CompletableFuture<Integer> scan)
    {
        inFlight.compareAndSet(scan, null);
        sink.onDiscoveryCompleted(new DiscoveryEvent(
                wallClock.now(), found, registry.size(), registry.connectedPorts()));
        scan.complete(found);
    }

    /**
     * Registration happens before reading starts; a link that lost the race
     * for its port, closed before this hop, or arrived after shutdown is
     * closed without ever reading.
     */
    private boolean attach(PeerLink link)
    {
        if (cancellation.isCancelled() || !link.isOpen() || !registry.register(link)) {
            link.close();
            return false;
        }
        sink.onLinkUp(LinkEvent.of(wallClock.now(), link, registry.size(), null));
        link.startReading();
        return true;
    }

    private void classify(int port, Throwable error)
    {
        Throwable cause = unwrap(error);
        if (cancellation.isCancelled()
                || cause instanceof IOException
                || cause instanceof TimeoutException) {
            // Nobody listening there (yet).
            return;
        }
        sink.onError(new GroupChatErrorEvent(
                wallClock.now(),
                "Peer discovery error on " + port,
                cause));
    }

    private static Throwable unwrap(Throwable error)
    {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
