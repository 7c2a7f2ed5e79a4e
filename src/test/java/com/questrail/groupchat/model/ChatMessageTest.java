package com.questrail.groupchat.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ChatMessageTest {

    @Test
    void timestampIsFractionalEpochSeconds() {
        ChatMessage message = ChatMessage.of("Anna", "hi", Instant.parse("2024-05-01T12:00:00.250Z"));

        assertEquals(1714564800.25, message.timestamp(), 1e-6);
    }

    @Test
    void authorshipIsExactNameMatch() {
        ChatMessage message = new ChatMessage("Anna", "hi", 0.0);

        assertTrue(message.isAuthoredBy("Anna"));
        assertFalse(message.isAuthoredBy("anna"));
        assertFalse(message.isAuthoredBy("Miku"));
    }

    @Test
    void rejectsNullFields() {
        assertThrows(NullPointerException.class, () -> new ChatMessage(null, "x", 0.0));
        assertThrows(NullPointerException.class, () -> new ChatMessage("Anna", null, 0.0));
    }
}
