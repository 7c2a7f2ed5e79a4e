package com.questrail.groupchat.observability;

import com.questrail.groupchat.model.ChatMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.TreeSet;

/**
 * Production implementation of GroupChatObservabilitySink that emits logs via SLF4J.
 *
 * <p>Expected network churn (a link closing, a discovery scan finding nothing)
 * is logged at INFO or DEBUG. Nothing a peer can cause is logged at ERROR.</p>
 */
public final class Slf4jGroupChatObservabilitySink implements GroupChatObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGroupChatObservabilitySink.class);

    private static final int PREVIEW_CHARS = 60;

    @Override
    public void onTransportEvent(TransportEvent event) {
        switch (event.kind()) {
            case STARTING -> log.info("[group_chat] Initializing on {} as agent '{}'",
                event.address(), event.agentName());
            case LISTENER_BOUND -> log.info("[group_chat] Server started on {}", event.address());
            case CLIENT_ONLY -> log.warn("[group_chat] Port {} in use, connecting as client only",
                event.address().getPort());
            case LISTENER_FAILED -> log.error("[group_chat] Failed to start server on {}",
                event.address(), event.cause());
            case STOPPED -> log.info("[group_chat] Server closed");
        }
    }

    @Override
    public void onLinkUp(LinkEvent event) {
        log.info("[group_chat] {} link#{} established{}, total links: {}",
            event.direction(),
            event.linkId(),
            event.remotePort().isPresent() ? " on port " + event.remotePort().getAsInt() : "",
            event.totalLinks());
    }

    @Override
    public void onLinkDown(LinkEvent event) {
        if (event.cause() != null) {
            log.warn("[group_chat] link#{} closed after error, total links: {}",
                event.linkId(), event.totalLinks(), event.cause());
        }
        else {
            log.info("[group_chat] link#{} closed, total links: {}", event.linkId(), event.totalLinks());
        }
    }

    @Override
    public void onDiscoveryCompleted(DiscoveryEvent event) {
        if (event.newLinks() > 0) {
            log.info("[group_chat] Discovery: {} new, {} total, ports: {}",
                event.newLinks(), event.totalLinks(), new TreeSet<>(event.connectedPorts()));
        }
        else {
            log.debug("[group_chat] Discovery: no new peers, {} total active", event.totalLinks());
        }
    }

    @Override
    public void onBroadcast(BroadcastEvent event) {
        switch (event.outcome()) {
            case SENT -> log.info("[group_chat] Broadcast sent to {} peer(s), {} pruned",
                event.delivered(), event.pruned());
            case ALL_FAILED -> log.warn("[group_chat] Broadcast failed on all {} link(s)", event.attempted());
            case NO_PEERS -> log.warn("[group_chat] No peer connections - broadcast skipped");
            case NOT_RUNNING -> log.warn("[group_chat] Cannot broadcast - tool not running");
            case TIMED_OUT -> log.warn("[group_chat] Broadcast not confirmed in time");
        }
    }

    @Override
    public void onMessageInjected(ChatMessage message) {
        log.info("[group_chat] Injected from {}: {}", message.agent(), preview(message.message()));
    }

    @Override
    public void onInboundDropped(ChatMessage message) {
        log.warn("[group_chat] Inbound queue full, dropped message from {}", message.agent());
    }

    @Override
    public void onDecodeFailure(GroupChatErrorEvent event) {
        log.warn("[group_chat] {}", event.message());
        log.debug("[group_chat] Decode failure detail", event.cause());
    }

    @Override
    public void onError(GroupChatErrorEvent event) {
        log.warn("[group_chat] {}", event.message(), event.cause());
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_CHARS ? text : text.substring(0, PREVIEW_CHARS) + "...";
    }
}
