package com.finopti.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestContextTest {

    @Test
    void toStringNeverContainsCredential() {
        RequestContext context = RequestContext.of("s-1", "ops@example.com", "Bearer super-secret-token");

        String text = context.toString();

        assertFalse(text.contains("super-secret-token"));
        assertTrue(text.contains("credential=present"));
        assertTrue(text.contains("ops@example.com"));
    }

    @Test
    void blankValuesBecomeAbsent() {
        RequestContext context = RequestContext.of(" ", "", null);

        assertNull(context.getSessionId());
        assertFalse(context.hasCallerIdentity());
        assertFalse(context.hasCredential());
        assertTrue(context.toString().contains("credential=none"));
    }

    @Test
    void credentialIsKeptAsGiven() {
        RequestContext context = RequestContext.of("s", "a@b.c", "Bearer abc.def");

        assertEquals("Bearer abc.def", context.getUpstreamCredential());
    }

    @Test
    void generatedSessionIds() {
        String id = RequestContext.generateSessionId();

        assertTrue(id.matches("gen-[0-9a-f]{12}"), id);
        assertNotEquals(id, RequestContext.generateSessionId());
    }
}
