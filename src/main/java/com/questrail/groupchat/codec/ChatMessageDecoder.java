package com.questrail.groupchat.codec;

import com.questrail.groupchat.model.ChatMessage;

/**
 * ChatMessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound wire boundary: one line of text to a {@link ChatMessage}.
 *
 * <p>The decoder sees exactly one line with the terminator already removed.
 * It never buffers across calls. A line that cannot be decoded is a defect of
 * that line only; the caller drops it and keeps the link open.</p>
 */
public interface ChatMessageDecoder
{
    /**
     * @param line one received line, without its terminator
     * @return the decoded message
     * @throws ChatDecodeException if the line is not a valid message
     */
    ChatMessage decode(String line);
}
