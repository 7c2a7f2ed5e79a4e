/**
 * Group Chat Wire Codec
 * =============================================================================
 *
 * <p>The wire format is one JSON object per line, UTF-8, newline-terminated,
 * over a plain stream socket:</p>
 *
 * <pre>
 *   {"agent": "Anna", "message": "hello", "timestamp": 1718000000.25}\n
 * </pre>
 *
 * <h2>Placement</h2>
 * <pre>
 *   stream bytes
 *        → line framing            (transport, splits on '\n')
 *            → ChatMessageDecoder  (this package)
 *                → ChatMessage
 *                    → inbound queue
 * </pre>
 *
 * <p>Framing lives in the transport; this layer only converts a single line
 * to and from a {@link com.questrail.groupchat.model.ChatMessage}. Decoding is
 * lenient about missing fields (a missing agent reads as {@code Unknown}, a
 * missing message as empty text) and strict about structure (the line must be
 * a JSON object).</p>
 */
package com.questrail.groupchat.codec;
