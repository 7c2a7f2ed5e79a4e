package com.questrail.groupchat.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One group chat message as it travels on the wire.
 *
 * @param agent     name of the authoring agent
 * @param message   message text
 * @param timestamp wall-clock send time in seconds since the epoch (fractional)
 */
public record ChatMessage(String agent, String message, double timestamp)
{
    public ChatMessage {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Build a message stamped with the given send instant.
     */
    public static ChatMessage of(String agent, String message, Instant sentAt) {
        return new ChatMessage(agent, message, toEpochSeconds(sentAt));
    }

    /**
     * Whether this message was written by {@code agentName}.
     */
    public boolean isAuthoredBy(String agentName) {
        return agent.equals(agentName);
    }

    public static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
