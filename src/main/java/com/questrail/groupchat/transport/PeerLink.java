package com.questrail.groupchat.transport;

import java.util.OptionalInt;
import java.util.concurrent.CompletionStage;

/**
 * PeerLink
 * -----------------------------------------------------------------------------
 * One established duplex stream to a peer.
 *
 * <p>A link is created by the transport (on accept or on a successful connect)
 * with reading switched off. The component that registers the link switches
 * reading on with {@link #startReading()} only after registration, so no line
 * can arrive for a link the registry does not yet know.</p>
 *
 * <p>Link ids are assigned monotonically by the transport and never reused
 * within a process; they are the registry key.</p>
 */
public interface PeerLink
{
    enum Direction { INBOUND, OUTBOUND }

    long id();

    Direction direction();

    /**
     * Remote port of the peer, when known. For outbound links this is the
     * dialled port; for inbound links it is the peer's source port.
     */
    OptionalInt remotePort();

    /**
     * Write one encoded payload.
     *
     * @return stage completing normally once the bytes were handed to the
     *         socket, exceptionally if the write failed
     */
    CompletionStage<Void> write(byte[] payload);

    /**
     * Begin delivering inbound lines for this link to the transport listener.
     */
    void startReading();

    /**
     * Close the link. Idempotent.
     */
    CompletionStage<Void> close();

    boolean isOpen();
}
