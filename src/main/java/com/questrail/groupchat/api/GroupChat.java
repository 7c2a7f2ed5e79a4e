package com.questrail.groupchat.api;

import com.questrail.groupchat.model.ChatMessage;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * GroupChat
 * =============================================================================
 * Public surface of a group chat mesh node.
 *
 * <p>A node shares short text messages with every other node it can reach in
 * a bounded port window around its own port. There is no coordinator: each
 * node listens on its own port and periodically dials its neighbours.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   initialize()             → bind listener, run the two startup discovery passes
 *   startContextLoop(sink)   → recurring discovery + delivery of inbound text to the sink
 *   broadcast(text)          → send from any thread, blocks briefly
 *   cleanup()                → close the listener and every link
 * </pre>
 *
 * <h2>Failure model</h2>
 * No operation on this interface throws for network conditions. Missing
 * peers, a port already taken, or a dead link all degrade to "fewer peers".
 */
public interface GroupChat
{
    /**
     * Bind the listener and run the startup discovery passes.
     *
     * <p>A port that is already in use is not a failure: the node continues in
     * client-only mode.</p>
     *
     * @return {@code true} if the node is running (with or without a listener);
     *         {@code false} if the listener could not be bound for any other reason
     */
    boolean initialize();

    /**
     * Close the listener and every link, stop all recurring tasks and release
     * the event loop. Blocks until the links are closed.
     */
    void cleanup();

    /**
     * Synchronous broadcast for callers outside the event loop.
     *
     * @return {@code true} iff at least one peer received the message
     */
    boolean broadcast(String text);

    /**
     * Asynchronous broadcast. May be called from any thread, including the
     * event loop itself.
     */
    CompletionStage<Boolean> broadcastAsync(String text);

    /**
     * @return {@code true} iff the listener is bound or at least one link is live
     */
    boolean isAvailable();

    /**
     * Start the background loop: discovery on its adaptive schedule and
     * delivery of inbound messages from other agents to {@code sink}.
     *
     * @throws IllegalStateException if {@link #initialize()} has not succeeded
     */
    void startContextLoop(ThoughtSink sink);

    /**
     * @return number of live links
     */
    int connectedPeerCount();

    /**
     * @return snapshot of the remote ports currently linked
     */
    Set<Integer> connectedPorts();

    /**
     * Pull-mode alternative to the context loop: take every message currently
     * waiting in the inbound queue without blocking.
     *
     * <p>Messages are returned as received, own messages included; the author
     * filter applies only to what the context loop forwards. When the context
     * loop is running, this returns whatever it has not consumed yet.</p>
     *
     * @return pending messages, oldest first; empty if none
     */
    List<ChatMessage> pendingMessages();
}
