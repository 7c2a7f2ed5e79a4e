package com.questrail.groupchat.internal.exec;

import com.questrail.groupchat.api.ThoughtSink;
import com.questrail.groupchat.model.ChatMessage;
import com.questrail.groupchat.observability.GroupChatErrorEvent;
import com.questrail.groupchat.observability.RecordingObservabilitySink;
import com.questrail.groupchat.time.FixedWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ContextInjectorTest
 * -----------------------------------------------------------------------------
 * Self filter, rendering and resilience to a failing thought sink.
 */
class ContextInjectorTest {

    private InboundQueue queue;
    private CancellationToken cancellation;
    private RecordingObservabilitySink sink;
    private ContextInjector injector;
    private List<String> thoughts;
    private ThoughtSink recorder;

    @BeforeEach
    void setUp() {
        queue = new InboundQueue(10);
        cancellation = new CancellationToken();
        sink = new RecordingObservabilitySink();
        injector = new ContextInjector("Anna", queue, cancellation, new FixedWallClock(), sink);
        thoughts = new ArrayList<>();
        recorder = (content, source) -> thoughts.add(source + "|" + content);
    }

    @Test
    void forwardsOtherAgentsMessages() {
        queue.offer(new ChatMessage("Miku", "hello", 1.0));

        assertEquals(1, injector.drainTo(recorder));
        assertEquals(List.of("group_chat|Miku said: hello"), thoughts);
        assertEquals(1, sink.eventsOfType(RecordingObservabilitySink.Injected.class).size());
    }

    @Test
    void ownMessagesAreNeverForwarded() {
        queue.offer(new ChatMessage("Anna", "my own words", 1.0));
        queue.offer(new ChatMessage("Miku", "reply", 2.0));

        injector.drainTo(recorder);

        assertEquals(List.of("group_chat|Miku said: reply"), thoughts);
        assertEquals(0, queue.size());
    }

    @Test
    void emptyMessagesAreSkipped() {
        queue.offer(new ChatMessage("Miku", "", 1.0));

        assertEquals(0, injector.drainTo(recorder));
        assertTrue(thoughts.isEmpty());
    }

    @Test
    void preservesArrivalOrder() {
        queue.offer(new ChatMessage("Miku", "one", 1.0));
        queue.offer(new ChatMessage("Bob", "two", 2.0));
        queue.offer(new ChatMessage("Miku", "three", 3.0));

        injector.drainTo(recorder);

        assertEquals(List.of(
                "group_chat|Miku said: one",
                "group_chat|Bob said: two",
                "group_chat|Miku said: three"), thoughts);
    }

    @Test
    void failingSinkIsReportedAndDrainContinues() {
        queue.offer(new ChatMessage("Miku", "boom", 1.0));
        queue.offer(new ChatMessage("Bob", "fine", 2.0));
        ThoughtSink flaky = (content, source) -> {
            if (content.contains("boom")) {
                throw new IllegalStateException("agent busy");
            }
            thoughts.add(content);
        };

        assertEquals(1, injector.drainTo(flaky));
        assertEquals(List.of("Bob said: fine"), thoughts);
        assertEquals(1, sink.eventsOfType(GroupChatErrorEvent.class).size());
    }

    @Test
    void cancelledInjectorLeavesQueueUntouched() {
        queue.offer(new ChatMessage("Miku", "hello", 1.0));
        cancellation.cancel();

        assertEquals(0, injector.drainTo(recorder));
        assertEquals(1, queue.size());
    }

    @Test
    void rendersAgentSaidMessage() {
        assertEquals("Miku said: hi", ContextInjector.render(new ChatMessage("Miku", "hi", 0.0)));
    }
}
