package com.questrail.groupchat.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in a mesh node.
 */
public record GroupChatErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
