package com.questrail.groupchat.internal.exec;

import com.questrail.groupchat.codec.ChatDecodeException;
import com.questrail.groupchat.codec.ChatMessageDecoder;
import com.questrail.groupchat.internal.registry.ConnectionRegistry;
import com.questrail.groupchat.internal.time.WallClock;
import com.questrail.groupchat.model.ChatMessage;
import com.questrail.groupchat.observability.GroupChatErrorEvent;
import com.questrail.groupchat.observability.GroupChatObservabilitySink;
import com.questrail.groupchat.observability.LinkEvent;
import com.questrail.groupchat.transport.PeerLink;
import com.questrail.groupchat.transport.PeerTransportListener;

import java.util.Objects;

/**
 * PeerReader
 * =============================================================================
 * Inbound side of every link: registers accepted links, decodes lines into
 * the inbound queue, and tears links down when they close.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   PeerTransport (line framing)
 *        → ChatMessageDecoder
 *            → InboundQueue
 *                → ContextInjector
 * </pre>
 *
 * <h2>No authorship filtering</h2>
 * Every decoded message is queued, including ones written by this node. The
 * {@link ContextInjector} is the only place self-authored messages are dropped.
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>A line that does not decode is reported and discarded; the link stays open.</li>
 *   <li>A full queue drops the newest message and reports it.</li>
 *   <li>End of stream or a read error removes the link and its port from the
 *       registry. This is the only path that takes a link to its terminal
 *       closed state.</li>
 * </ul>
 *
 * <p>All callbacks run on the event loop.</p>
 */
public final class PeerReader implements PeerTransportListener
{
    private final ConnectionRegistry registry;
    private final ChatMessageDecoder decoder;
    private final InboundQueue queue;
    private final CancellationToken cancellation;
    private final WallClock wallClock;
    private final GroupChatObservabilitySink sink;

    public PeerReader(ConnectionRegistry registry,
                      ChatMessageDecoder decoder,
                      InboundQueue queue,
                      CancellationToken cancellation,
                      WallClock wallClock,
                      GroupChatObservabilitySink sink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void onLinkAccepted(PeerLink link)
    {
        if (cancellation.isCancelled() || !registry.register(link)) {
            link.close();
            return;
        }

        sink.onLinkUp(LinkEvent.of(wallClock.now(), link, registry.size(), null));

        // Registered first, then read: a discovery scan from the same peer
        // now sees this port as taken.
        link.startReading();
    }

    @Override
    public void onLine(PeerLink link, String line)
    {
        if (cancellation.isCancelled() || line.isBlank()) {
            return;
        }

        final ChatMessage message;
        try {
            message = decoder.decode(line);
        } catch (ChatDecodeException e) {
            sink.onDecodeFailure(new GroupChatErrorEvent(
                    wallClock.now(),
                    "Invalid JSON received on link#" + link.id(),
                    e));
            return;
        }

        if (!queue.offer(message)) {
            sink.onInboundDropped(message);
        }
    }

    @Override
    public void onMalformedLine(PeerLink link, Throwable cause)
    {
        sink.onDecodeFailure(new GroupChatErrorEvent(
                wallClock.now(),
                "Discarded over-long line on link#" + link.id(),
                cause));
    }

    @Override
    public void onLinkClosed(PeerLink link, Throwable cause)
    {
        link.close();
        registry.remove(link.id()).ifPresent(removed ->
                sink.onLinkDown(LinkEvent.of(wallClock.now(), removed, registry.size(), cause)));
    }
}
