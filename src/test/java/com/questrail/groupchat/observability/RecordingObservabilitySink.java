package com.questrail.groupchat.observability;

import com.questrail.groupchat.model.ChatMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements GroupChatObservabilitySink {

    /** Wraps a message so injected and dropped messages can be told apart. */
    public record Injected(ChatMessage message) {}

    public record Dropped(ChatMessage message) {}

    public record DecodeFailure(GroupChatErrorEvent event) {}

    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTransportEvent(TransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onLinkUp(LinkEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onLinkDown(LinkEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDiscoveryCompleted(DiscoveryEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onBroadcast(BroadcastEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onMessageInjected(ChatMessage message) {
        events.add(new Injected(message));
    }

    @Override
    public synchronized void onInboundDropped(ChatMessage message) {
        events.add(new Dropped(message));
    }

    @Override
    public synchronized void onDecodeFailure(GroupChatErrorEvent event) {
        events.add(new DecodeFailure(event));
    }

    @Override
    public synchronized void onError(GroupChatErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    public synchronized List<BroadcastEvent.Outcome> broadcastOutcomes() {
        return eventsOfType(BroadcastEvent.class).stream()
            .map(BroadcastEvent::outcome)
            .collect(Collectors.toList());
    }

    public synchronized List<TransportEvent.Kind> transportKinds() {
        return eventsOfType(TransportEvent.class).stream()
            .map(TransportEvent::kind)
            .collect(Collectors.toList());
    }
}
