package com.questrail.groupchat.api;

/**
 * ThoughtSink
 * -----------------------------------------------------------------------------
 * Consumer of inbound group chat text.
 *
 * <p>The surrounding agent supplies an implementation (its thought buffer).
 * The mesh calls it once per forwarded inbound message, already rendered as
 * {@code "{agent} said: {message}"}. What the agent does with the text is
 * outside this library.</p>
 */
@FunctionalInterface
public interface ThoughtSink
{
    /**
     * Accept processed text.
     *
     * @param content rendered message text
     * @param source  tag identifying the producer (always {@code group_chat} for the mesh)
     */
    void addProcessedThought(String content, String source);
}
