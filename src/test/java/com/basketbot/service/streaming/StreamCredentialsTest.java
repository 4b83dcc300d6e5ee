package com.basketbot.service.streaming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StreamCredentialsTest {

    @Test
    void keepsClientAndAccessTokenApart() {
        StreamCredentials credentials = new StreamCredentials("AB1234", "abcdef987");
        assertEquals("AB1234", credentials.getClientId());
        assertEquals("abcdef987", credentials.getAccessToken());
    }

    @Test
    void toStringMasksAccessToken() {
        String text = new StreamCredentials("AB1234", "abcdef987").toString();
        assertFalse(text.contains("abcdef"));
        assertTrue(text.endsWith("****f987)"));
    }
}
