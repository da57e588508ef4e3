package com.smancode.companion.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smancode.companion.context.ConversationContextService;
import com.smancode.companion.thinking.ThinkingEngine;
import com.smancode.companion.thinking.ThinkingSession;
import com.smancode.companion.thinking.ThinkingSessionRegistry;
import com.smancode.companion.util.StackTraceUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 思考推送 WebSocket 处理器
 * <p>
 * 客户端消息：
 * <ul>
 *     <li>start：{"type":"start","message":"..."}，开始思考（已有会话时附着）</li>
 *     <li>agent_response：{"type":"agent_response","text":"..."}，真实回复到达，记录上下文并请求自然终止</li>
 *     <li>terminate：{"type":"terminate"}，只请求终止</li>
 *     <li>ping</li>
 * </ul>
 * 服务端消息：connected / attached / thinking / thinking_complete / pong / error
 * <p>
 * 每个 start 过的连接（包括附着方）都会在会话结束时收到 thinking_complete。
 */
@Component
public class ThinkingWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ThinkingWebSocketHandler.class);

    private final ThinkingEngine thinkingEngine;

    private final ConversationContextService contextService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ThinkingWebSocketHandler(ThinkingEngine thinkingEngine, ConversationContextService contextService) {
        this.thinkingEngine = thinkingEngine;
        this.contextService = contextService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        logger.info("WebSocket 连接建立: wsSessionId={}", session.getId());
        sendMessage(session, Map.of(
                "type", "connected",
                "message", "WebSocket 连接成功"
        ));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String payload = message.getPayload();
        logger.debug("收到 WebSocket 消息: wsSessionId={}, payload={}", session.getId(), payload);

        try {
            Map<String, Object> request = objectMapper.readValue(payload, Map.class);
            Object type = request.get("type");
            if (!(type instanceof String)) {
                sendError(session, "缺少消息类型");
                return;
            }

            switch ((String) type) {
                case "start" -> handleStart(session, request);
                case "agent_response" -> handleAgentResponse(request);
                case "terminate" -> thinkingEngine.requestNaturalTermination();
                case "ping" -> handlePing(session);
                default -> {
                    logger.warn("未知消息类型: {}", type);
                    sendError(session, "未知消息类型: " + type);
                }
            }

        } catch (Exception e) {
            logger.error("处理消息失败: {}", StackTraceUtils.formatStackTrace(e));
            sendError(session, "处理失败: " + StackTraceUtils.rootCauseMessage(e));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        // 思考会话在下一次推送时发现连接关闭并自行结束
        logger.info("WebSocket 连接关闭: wsSessionId={}, status={}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("WebSocket 传输错误: wsSessionId={}, {}", session.getId(), exception.getMessage());
    }

    /**
     * 开始思考
     */
    private void handleStart(WebSocketSession wsSession, Map<String, Object> request) {
        Object message = request.get("message");
        if (!(message instanceof String userMessage) || userMessage.isBlank()) {
            sendError(wsSession, "message 不能为空");
            return;
        }

        ThinkingSessionRegistry.Registration registration =
                thinkingEngine.open(userMessage, new WebSocketDisplaySink(wsSession, objectMapper));
        ThinkingSession thinkingSession = registration.session();

        MDC.put("sessionId", thinkingSession.getId());
        try {
            if (registration.created()) {
                contextService.recordUserMessage(userMessage);
            } else {
                // 附着方不接收 thinking 帧，只接收结束通知
                logger.info("附着到已有思考会话: wsSessionId={}", wsSession.getId());
                sendAttached(wsSession, thinkingSession);
            }
            thinkingSession.getCompletionSignal().whenResolved(() -> sendComplete(wsSession, thinkingSession));
        } finally {
            MDC.remove("sessionId");
        }
    }

    /**
     * 真实回复到达
     */
    private void handleAgentResponse(Map<String, Object> request) {
        Object text = request.get("text");
        if (text instanceof String agentText) {
            contextService.recordAgentMessage(agentText);
        }
        thinkingEngine.requestNaturalTermination();
    }

    private void sendAttached(WebSocketSession wsSession, ThinkingSession thinkingSession) {
        try {
            sendMessage(wsSession, Map.of(
                    "type", "attached",
                    "sessionId", thinkingSession.getId()
            ));
        } catch (Exception e) {
            logger.warn("发送附着消息失败: wsSessionId={}, {}", wsSession.getId(), e.getMessage());
        }
    }

    private void sendComplete(WebSocketSession wsSession, ThinkingSession thinkingSession) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "thinking_complete");
        message.put("sessionId", thinkingSession.getId());
        message.put("endReason", String.valueOf(thinkingSession.getEndReason()));
        message.put("thoughtCount", thinkingSession.getThoughtIndex());
        try {
            sendMessage(wsSession, message);
        } catch (Exception e) {
            logger.warn("发送思考完成消息失败: wsSessionId={}, {}", wsSession.getId(), e.getMessage());
        }
    }

    /**
     * 处理心跳
     */
    private void handlePing(WebSocketSession session) throws Exception {
        sendMessage(session, Map.of(
                "type", "pong",
                "timestamp", System.currentTimeMillis()
        ));
    }

    /**
     * 发送消息到 WebSocket
     */
    private void sendMessage(WebSocketSession session, Object data) throws Exception {
        if (session == null || !session.isOpen()) {
            logger.warn("WebSocket session 已关闭，无法发送消息");
            return;
        }
        String json = objectMapper.writeValueAsString(data);
        synchronized (session) {
            session.sendMessage(new TextMessage(json));
        }
    }

    /**
     * 发送错误消息
     */
    private void sendError(WebSocketSession session, String error) {
        try {
            sendMessage(session, Map.of(
                    "type", "error",
                    "message", error
            ));
        } catch (Exception e) {
            logger.error("发送错误消息失败: {}", StackTraceUtils.formatStackTrace(e));
        }
    }
}
