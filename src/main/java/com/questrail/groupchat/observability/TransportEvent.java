package com.questrail.groupchat.observability;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Listener lifecycle of a node.
 *
 * @param cause bind failure for {@link Kind#CLIENT_ONLY} and
 *              {@link Kind#LISTENER_FAILED}, {@code null} otherwise
 */
public record TransportEvent(
    Instant timestamp,
    Kind kind,
    InetSocketAddress address,
    String agentName,
    Throwable cause
) {
    public enum Kind {
        STARTING,
        LISTENER_BOUND,
        /** Port already in use; running without a listener. */
        CLIENT_ONLY,
        LISTENER_FAILED,
        STOPPED
    }
}
