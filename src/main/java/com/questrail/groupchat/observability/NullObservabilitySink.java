package com.questrail.groupchat.observability;

import com.questrail.groupchat.model.ChatMessage;

/**
 * No-op implementation of GroupChatObservabilitySink.
 */
public final class NullObservabilitySink implements GroupChatObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(TransportEvent event) {}

    @Override
    public void onLinkUp(LinkEvent event) {}

    @Override
    public void onLinkDown(LinkEvent event) {}

    @Override
    public void onDiscoveryCompleted(DiscoveryEvent event) {}

    @Override
    public void onBroadcast(BroadcastEvent event) {}

    @Override
    public void onMessageInjected(ChatMessage message) {}

    @Override
    public void onInboundDropped(ChatMessage message) {}

    @Override
    public void onDecodeFailure(GroupChatErrorEvent event) {}

    @Override
    public void onError(GroupChatErrorEvent event) {}
}
