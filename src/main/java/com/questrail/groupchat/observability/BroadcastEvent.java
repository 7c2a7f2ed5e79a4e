package com.questrail.groupchat.observability;

import java.time.Instant;

/**
 * Outcome of one broadcast attempt.
 *
 * @param attempted links the message was written to
 * @param delivered links that accepted the write
 * @param pruned    links removed because their write failed
 */
public record BroadcastEvent(
    Instant timestamp,
    Outcome outcome,
    int attempted,
    int delivered,
    int pruned
) {
    public enum Outcome {
        /** At least one link accepted the message. */
        SENT,
        /** Every write failed. */
        ALL_FAILED,
        /** The registry was empty. */
        NO_PEERS,
        /** The node is stopped, or the caller was on the event loop thread. */
        NOT_RUNNING,
        /** The event loop did not report back within the bridge timeout. */
        TIMED_OUT
    }

    public static BroadcastEvent rejected(Instant timestamp, Outcome outcome) {
        return new BroadcastEvent(timestamp, outcome, 0, 0, 0);
    }
}
