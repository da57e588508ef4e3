package com.smancode.companion.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConversationContextService 测试
 */
class ConversationContextServiceTest {

    @Test
    void testSummary_NullWhenEmpty() {
        assertNull(new ConversationContextService(100, 6, 300).getRecentContextSummary());
    }

    @Test
    @DisplayName("摘要只包含最近几条，并带发送方标签")
    void testSummary_UsesRecentMessages() {
        ConversationContextService service = new ConversationContextService(100, 2, 300);
        service.recordUserMessage("first question");
        service.recordAgentMessage("first answer");
        service.recordUserMessage("second question");

        assertEquals("Agent: first answer\nUser: second question", service.getRecentContextSummary());
    }

    @Test
    void testRecord_BoundedAndIgnoresBlank() {
        ConversationContextService service = new ConversationContextService(3, 6, 300);
        for (int i = 0; i < 5; i++) {
            service.recordUserMessage("message " + i);
        }
        service.recordAgentMessage("   ");
        service.recordAgentMessage(null);

        assertEquals(3, service.size());
        assertEquals("message 2", service.getMessages().get(0).content());
    }

    @Test
    @DisplayName("过长消息截断，换行折叠为空格")
    void testSummary_TruncatesLongMessages() {
        ConversationContextService service = new ConversationContextService(100, 6, 10);
        service.recordAgentMessage("line one\nline two is long");

        assertEquals("Agent: line one l...", service.getRecentContextSummary());
    }

    @Test
    void testClear() {
        ConversationContextService service = new ConversationContextService(100, 6, 300);
        service.recordUserMessage("hello");
        service.clear();

        assertEquals(0, service.size());
        assertNull(service.getRecentContextSummary());
    }

    @Test
    void testConstructor_RejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> new ConversationContextService(0, 6, 300));
    }
}
