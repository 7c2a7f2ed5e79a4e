package com.questrail.groupchat.transport;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;

/**
 * PeerTransport
 * -----------------------------------------------------------------------------
 * Port for the stream transport of a mesh node.
 *
 * <p>The transport owns one event loop. Socket callbacks, accepted links and
 * every task submitted to {@link #loop()} run on that single thread, which is
 * what lets the connection registry go without locks.</p>
 *
 * <p>Implementations may be backed by Netty or by a test double.</p>
 */
public interface PeerTransport
{
    /**
     * Register the listener for inbound links, lines and closures. Must be
     * called before {@link #bind(InetSocketAddress)} or
     * {@link #connect(InetSocketAddress, Duration)}.
     */
    void setListener(PeerTransportListener listener);

    /**
     * The event loop, viewed as a scheduled executor.
     */
    ScheduledExecutorService loop();

    /**
     * @return {@code true} if the calling thread is the event loop thread
     */
    boolean inLoop();

    /**
     * Bind the listener socket.
     *
     * @return stage completing with the bound address, or exceptionally with
     *         the bind failure ({@link java.net.BindException} when the
     *         address is already in use)
     */
    CompletionStage<InetSocketAddress> bind(InetSocketAddress local);

    /**
     * @return {@code true} while the listener socket is bound
     */
    boolean isBound();

    /**
     * Open an outbound link. The returned link has reading switched off.
     *
     * @return stage completing with the link, or exceptionally with the
     *         connect failure (refused, timed out, unreachable)
     */
    CompletionStage<PeerLink> connect(InetSocketAddress remote, Duration timeout);

    /**
     * Close the listener socket, if bound. Existing links are unaffected.
     */
    CompletionStage<Void> closeListener();

    /**
     * Shut down the event loop and wait for it to terminate.
     */
    void shutdown();
}
