package com.questrail.groupchat.internal.exec;

import com.questrail.groupchat.model.ChatMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * InboundQueue
 * -----------------------------------------------------------------------------
 * Bounded hand-off between the readers and the context injector.
 *
 * <p>When the queue is full the newest message is refused; readers never wait
 * for space.</p>
 */
public final class InboundQueue
{
    private final BlockingQueue<ChatMessage> queue;

    public InboundQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return {@code false} if the queue is full and the message was dropped
     */
    public boolean offer(ChatMessage message) {
        Objects.requireNonNull(message, "message");
        return queue.offer(message);
    }

    /**
     * @return the oldest message, or {@code null} if the queue is empty
     */
    public ChatMessage poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    /**
     * Remove and return everything queued right now, oldest first. Never waits.
     */
    public List<ChatMessage> drain() {
        List<ChatMessage> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    public void clear() {
        queue.clear();
    }
}
