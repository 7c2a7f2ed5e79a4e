package com.questrail.groupchat.observability;

import com.questrail.groupchat.transport.PeerLink;

import java.time.Instant;
import java.util.OptionalInt;

/**
 * A link entered or left the connection registry.
 *
 * @param totalLinks registry size after the change
 * @param cause      read error that ended the link, {@code null} otherwise
 */
public record LinkEvent(
    Instant timestamp,
    long linkId,
    PeerLink.Direction direction,
    OptionalInt remotePort,
    int totalLinks,
    Throwable cause
) {
    public static LinkEvent of(Instant timestamp, PeerLink link, int totalLinks, Throwable cause) {
        return new LinkEvent(timestamp, link.id(), link.direction(), link.remotePort(), totalLinks, cause);
    }
}
