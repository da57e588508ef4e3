package com.smancode.companion.thinking;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ThinkingSessionRegistry 测试
 */
class ThinkingSessionRegistryTest {

    @Test
    void testAcquire_ReturnsExistingWhileActive() {
        ThinkingSessionRegistry registry = new ThinkingSessionRegistry();

        ThinkingSessionRegistry.Registration first = registry.acquire("m1");
        ThinkingSessionRegistry.Registration second = registry.acquire("m2");

        assertTrue(first.created());
        assertFalse(second.created());
        assertSame(first.session(), second.session());
        assertEquals("m1", second.session().getUserMessage());
        assertSame(first.session(), registry.current());
    }

    @Test
    void testRelease_FreesSlot() {
        ThinkingSessionRegistry registry = new ThinkingSessionRegistry();
        ThinkingSession session = registry.acquire("m1").session();

        registry.release(session);
        assertNull(registry.current());

        ThinkingSessionRegistry.Registration next = registry.acquire("m2");
        assertTrue(next.created());
        assertNotSame(session, next.session());
    }

    @Test
    void testRelease_IgnoresStaleSession() {
        ThinkingSessionRegistry registry = new ThinkingSessionRegistry();
        ThinkingSession stale = new ThinkingSession("old");
        ThinkingSession active = registry.acquire("m1").session();

        registry.release(stale);
        assertSame(active, registry.current());
    }

    @Test
    void testFinalizedSession_CountsAsIdle() {
        ThinkingSessionRegistry registry = new ThinkingSessionRegistry();
        ThinkingSession session = registry.acquire("m1").session();
        session.finish(EndReason.FAILURE);

        assertNull(registry.current());
        assertTrue(registry.acquire("m2").created());
    }
}
