package com.questrail.groupchat.codec;

import com.questrail.groupchat.model.ChatMessage;

/**
 * ChatMessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound wire boundary: {@link ChatMessage} to bytes.
 *
 * <p>The returned bytes are one complete line: UTF-8 text terminated by a
 * single {@code '\n'}. The encoded text itself never contains a raw newline,
 * so a receiver can frame purely on line breaks.</p>
 */
public interface ChatMessageEncoder
{
    /**
     * Encode a message into a wire-ready, newline-terminated line.
     */
    byte[] encode(ChatMessage message);
}
