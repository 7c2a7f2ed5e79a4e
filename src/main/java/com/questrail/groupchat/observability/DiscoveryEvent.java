package com.questrail.groupchat.observability;

import java.time.Instant;
import java.util.Set;

/**
 * Summary of one completed discovery scan.
 */
public record DiscoveryEvent(
    Instant timestamp,
    int newLinks,
    int totalLinks,
    Set<Integer> connectedPorts
) {
    public DiscoveryEvent {
        connectedPorts = Set.copyOf(connectedPorts);
    }
}
