package com.questrail.groupchat.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.groupchat.codec.ChatDecodeException;
import com.questrail.groupchat.codec.ChatMessageDecoder;
import com.questrail.groupchat.codec.ChatMessageEncoder;
import com.questrail.groupchat.model.ChatMessage;

import java.util.Arrays;
import java.util.Objects;

/**
 * JsonChatMessageCodec
 * -----------------------------------------------------------------------------
 * Jackson-backed implementation of both codec directions.
 *
 * <p>Field names are {@code agent}, {@code message} and {@code timestamp}.
 * Unknown fields are ignored on decode.</p>
 */
public final class JsonChatMessageCodec implements ChatMessageEncoder, ChatMessageDecoder
{
    static final String FIELD_AGENT = "agent";
    static final String FIELD_MESSAGE = "message";
    static final String FIELD_TIMESTAMP = "timestamp";

    static final String UNKNOWN_AGENT = "Unknown";

    private static final byte NEWLINE = '\n';

    private final ObjectMapper mapper;

    public JsonChatMessageCodec() {
        this(new ObjectMapper());
    }

    public JsonChatMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(ChatMessage message) {
        Objects.requireNonNull(message, "message");

        ObjectNode node = mapper.createObjectNode();
        node.put(FIELD_AGENT, message.agent());
        node.put(FIELD_MESSAGE, message.message());
        node.put(FIELD_TIMESTAMP, message.timestamp());

        final byte[] json;
        try {
            json = mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chat message", e);
        }

        byte[] line = Arrays.copyOf(json, json.length + 1);
        line[json.length] = NEWLINE;
        return line;
    }

    @Override
    public ChatMessage decode(String line) {
        Objects.requireNonNull(line, "line");

        final JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ChatDecodeException("Invalid JSON received", e);
        }

        if (node == null || !node.isObject()) {
            throw new ChatDecodeException("Expected a JSON object per line");
        }

        String agent = textOrDefault(node.get(FIELD_AGENT), UNKNOWN_AGENT);
        String message = textOrDefault(node.get(FIELD_MESSAGE), "");

        JsonNode ts = node.get(FIELD_TIMESTAMP);
        double timestamp = (ts != null && ts.isNumber()) ? ts.asDouble() : 0.0;

        return new ChatMessage(agent, message, timestamp);
    }

    private static String textOrDefault(JsonNode value, String fallback) {
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.asText();
    }
}
