package com.questrail.groupchat.observability;

import com.questrail.groupchat.model.ChatMessage;

/**
 * Main interface for receiving mesh observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on the event loop thread or on a broadcasting
 * caller's thread. Implementations must not block.</p>
 */
public interface GroupChatObservabilitySink {
    /**
     * Called when the listener is bound, skipped, fails, or the node stops.
     */
    void onTransportEvent(TransportEvent event);

    /**
     * Called when a link is added to the connection registry.
     */
    void onLinkUp(LinkEvent event);

    /**
     * Called when a link is removed from the connection registry.
     */
    void onLinkDown(LinkEvent event);

    /**
     * Called at the end of every discovery scan.
     */
    void onDiscoveryCompleted(DiscoveryEvent event);

    /**
     * Called once per broadcast attempt, including rejected ones.
     */
    void onBroadcast(BroadcastEvent event);

    /**
     * Called when an inbound message is handed to the thought sink.
     */
    void onMessageInjected(ChatMessage message);

    /**
     * Called when an inbound message is dropped because the queue is full.
     */
    void onInboundDropped(ChatMessage message);

    /**
     * Called when a received line cannot be decoded. The link stays open.
     */
    void onDecodeFailure(GroupChatErrorEvent event);

    /**
     * Called when an unexpected error occurs. Never fatal to the node.
     */
    void onError(GroupChatErrorEvent event);
}
