package com.smancode.companion.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smancode.companion.context.ConversationContextService;
import com.smancode.companion.thinking.ThinkingEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WebSocket 协议测试：start → thinking 帧 → agent_response → thinking_complete
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "companion.thinking.poll-quantum-ms=10",
        "companion.thinking.typing-delay-min-ms=0",
        "companion.thinking.typing-delay-max-ms=0",
        "companion.thinking.initial-pause-min-ms=10",
        "companion.thinking.initial-pause-max-ms=10",
        "companion.thinking.continuous-delay-min-ms=100",
        "companion.thinking.continuous-delay-max-ms=100",
        "companion.thinking.generation-enabled=false"
})
class ThinkingWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @LocalServerPort
    private int port;

    @Autowired
    private ConversationContextService contextService;

    @Autowired
    private ThinkingEngine thinkingEngine;

    @AfterEach
    void tearDown() throws Exception {
        thinkingEngine.requestNaturalTermination();
        long deadline = System.currentTimeMillis() + 2000;
        while (thinkingEngine.getActiveSession() != null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    private WebSocketSession connect(BlockingQueue<String> frames) throws Exception {
        return new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession s, TextMessage message) {
                        frames.add(message.getPayload());
                    }
                }, "ws://localhost:" + port + "/ws/thinking")
                .get(5, TimeUnit.SECONDS);
    }

    private JsonNode nextOfType(BlockingQueue<String> frames, String type) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            String frame = frames.poll(100, TimeUnit.MILLISECONDS);
            if (frame == null) {
                continue;
            }
            JsonNode node = objectMapper.readTree(frame);
            if (type.equals(node.path("type").asText())) {
                return node;
            }
        }
        fail("没有收到消息: " + type);
        return null;
    }

    @Test
    @DisplayName("完整思考流程")
    void testThinkingRoundTrip() throws Exception {
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        TextWebSocketHandler clientHandler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                frames.add(message.getPayload());
            }
        };

        WebSocketSession session = new StandardWebSocketClient()
                .execute(clientHandler, "ws://localhost:" + port + "/ws/thinking")
                .get(5, TimeUnit.SECONDS);
        try {
            nextOfType(frames, "connected");

            session.sendMessage(new TextMessage("{\"type\":\"ping\"}"));
            assertTrue(nextOfType(frames, "pong").has("timestamp"));

            session.sendMessage(new TextMessage("{\"type\":\"start\",\"message\":\"How do I fix a memory leak?\"}"));
            JsonNode thinking = nextOfType(frames, "thinking");
            String sessionId = thinking.path("sessionId").asText();
            assertTrue(sessionId.startsWith("thinking-"));
            assertFalse(thinking.path("content").asText().isEmpty());

            Thread.sleep(300);
            session.sendMessage(new TextMessage("{\"type\":\"agent_response\",\"text\":\"Take a heap dump first.\"}"));

            JsonNode complete = nextOfType(frames, "thinking_complete");
            assertEquals(sessionId, complete.path("sessionId").asText());
            assertTrue(complete.path("thoughtCount").asInt() >= 1);
            assertTrue(complete.path("endReason").asText().endsWith("TERMINATION"));

            String summary = contextService.getRecentContextSummary();
            assertTrue(summary.contains("User: How do I fix a memory leak?"));
            assertTrue(summary.contains("Agent: Take a heap dump first."));
        } finally {
            session.close();
        }
    }

    @Test
    @DisplayName("第二个连接附着到已有会话，两个连接都收到 thinking_complete")
    void testSecondClientAttachesAndReceivesCompletion() throws Exception {
        BlockingQueue<String> first = new LinkedBlockingQueue<>();
        BlockingQueue<String> second = new LinkedBlockingQueue<>();
        WebSocketSession firstSession = connect(first);
        WebSocketSession secondSession = connect(second);
        try {
            nextOfType(first, "connected");
            nextOfType(second, "connected");

            firstSession.sendMessage(new TextMessage("{\"type\":\"start\",\"message\":\"Why is my build slow?\"}"));
            String sessionId = nextOfType(first, "thinking").path("sessionId").asText();

            secondSession.sendMessage(new TextMessage("{\"type\":\"start\",\"message\":\"Another question\"}"));
            assertEquals(sessionId, nextOfType(second, "attached").path("sessionId").asText());

            firstSession.sendMessage(new TextMessage("{\"type\":\"terminate\"}"));

            JsonNode firstComplete = nextOfType(first, "thinking_complete");
            JsonNode secondComplete = nextOfType(second, "thinking_complete");
            assertEquals(sessionId, firstComplete.path("sessionId").asText());
            assertEquals(sessionId, secondComplete.path("sessionId").asText());
            assertEquals(firstComplete.path("endReason").asText(), secondComplete.path("endReason").asText());
        } finally {
            firstSession.close();
            secondSession.close();
        }
    }

    @Test
    void testInvalidMessagesGetErrors() throws Exception {
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        WebSocketSession session = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession s, TextMessage message) {
                        frames.add(message.getPayload());
                    }
                }, "ws://localhost:" + port + "/ws/thinking")
                .get(5, TimeUnit.SECONDS);
        try {
            nextOfType(frames, "connected");

            session.sendMessage(new TextMessage("{\"type\":\"start\",\"message\":\"\"}"));
            assertEquals("message 不能为空", nextOfType(frames, "error").path("message").asText());

            session.sendMessage(new TextMessage("not json"));
            assertTrue(nextOfType(frames, "error").path("message").asText().startsWith("处理失败"));

            session.sendMessage(new TextMessage("{\"type\":\"dance\"}"));
            assertTrue(nextOfType(frames, "error").path("message").asText().contains("dance"));
        } finally {
            session.close();
        }
    }
}
