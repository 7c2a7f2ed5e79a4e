package com.questrail.groupchat.internal.exec;

import com.questrail.groupchat.api.ThoughtSink;
import com.questrail.groupchat.internal.time.WallClock;
import com.questrail.groupchat.model.ChatMessage;
import com.questrail.groupchat.observability.GroupChatErrorEvent;
import com.questrail.groupchat.observability.GroupChatObservabilitySink;

import java.util.Objects;

/**
 * ContextInjector
 * =============================================================================
 * Moves inbound messages from the queue into the agent's {@link ThoughtSink}.
 *
 * <p>This is the single point where self-authored messages are dropped: a
 * message whose agent equals this node's identity (looped-back link, or a
 * copy arriving over a second link) never reaches the sink. Messages with
 * empty text are dropped too.</p>
 *
 * <p>Forwarded text is rendered as {@code "{agent} said: {message}"} with the
 * source tag {@value #SOURCE}.</p>
 */
public final class ContextInjector
{
    public static final String SOURCE = "group_chat";

    private final String agentName;
    private final InboundQueue queue;
    private final CancellationToken cancellation;
    private final WallClock wallClock;
    private final GroupChatObservabilitySink sink;

    public ContextInjector(String agentName,
                           InboundQueue queue,
                           CancellationToken cancellation,
                           WallClock wallClock,
                           GroupChatObservabilitySink sink)
    {
        this.agentName = Objects.requireNonNull(agentName, "agentName");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Drain the queue without blocking. Stops at the first check after
     * cancellation, leaving the remaining entries unprocessed.
     *
     * @return number of messages forwarded to {@code consumer}
     */
    public int drainTo(ThoughtSink consumer)
    {
        Objects.requireNonNull(consumer, "consumer");

        int forwarded = 0;
        while (!cancellation.isCancelled()) {
            ChatMessage message = queue.poll();
            if (message == null) {
                break;
            }
            if (message.isAuthoredBy(agentName) || message.message().isEmpty()) {
                continue;
            }

            try {
                consumer.addProcessedThought(render(message), SOURCE);
            } catch (RuntimeException e) {
                sink.onError(new GroupChatErrorEvent(wallClock.now(), "Thought sink rejected message", e));
                continue;
            }
            sink.onMessageInjected(message);
            forwarded++;
        }
        return forwarded;
    }

    static String render(ChatMessage message)
    {
        return message.agent() + " said: " + message.message();
    }
}
