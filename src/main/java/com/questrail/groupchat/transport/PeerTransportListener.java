package com.questrail.groupchat.transport;

/**
 * PeerTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link PeerTransport}.
 *
 * <p>All callbacks are delivered on the transport's event loop, one at a time.
 * For a given link the order is:</p>
 * <pre>
 *   onLinkAccepted   (inbound links only)
 *   onLine* / onMalformedLine*
 *   onLinkClosed     (exactly once)
 * </pre>
 */
public interface PeerTransportListener
{
    /**
     * A peer connected to our listener. Reading is still off; the listener
     * decides whether to keep the link and then calls
     * {@link PeerLink#startReading()}.
     */
    void onLinkAccepted(PeerLink link);

    /**
     * A complete line arrived, terminator removed.
     */
    void onLine(PeerLink link, String line);

    /**
     * A line could not be framed (for example it exceeded the frame limit)
     * and was discarded. The link stays open.
     */
    void onMalformedLine(PeerLink link, Throwable cause);

    /**
     * The link is closed: end of stream, read error, or local close.
     *
     * @param cause read error that closed the link; {@code null} for an
     *              orderly end of stream or a local close
     */
    void onLinkClosed(PeerLink link, Throwable cause);
}
