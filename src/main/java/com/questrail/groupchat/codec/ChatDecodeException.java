package com.questrail.groupchat.codec;

/**
 * Indicates that a received line could not be translated into a
 * {@link com.questrail.groupchat.model.ChatMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text that is not JSON at all</li>
 *   <li>JSON that is not an object</li>
 * </ul>
 */
public final class ChatDecodeException extends RuntimeException
{
    public ChatDecodeException(String message) {
        super(message);
    }

    public ChatDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
