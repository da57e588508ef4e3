package com.smancode.companion.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smancode.companion.thinking.DisplaySink;
import com.smancode.companion.thinking.SinkUnavailableException;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把思考内容推送到 WebSocket 客户端的显示端
 * <p>
 * 每一帧都是完整内容：{"type":"thinking","sessionId":...,"content":...}。
 * 连接已关闭或发送失败时抛出 SinkUnavailableException，思考会话随之结束。
 */
public class WebSocketDisplaySink implements DisplaySink {

    private final WebSocketSession wsSession;

    private final ObjectMapper objectMapper;

    private volatile String thinkingSessionId;

    public WebSocketDisplaySink(WebSocketSession wsSession, ObjectMapper objectMapper) {
        this.wsSession = wsSession;
        this.objectMapper = objectMapper;
    }

    @Override
    public void onSessionStarted(String sessionId) {
        this.thinkingSessionId = sessionId;
    }

    @Override
    public void renderFull(String content) {
        if (!wsSession.isOpen()) {
            throw new SinkUnavailableException("WebSocket 已关闭: wsSessionId=" + wsSession.getId());
        }

        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "thinking");
        frame.put("sessionId", thinkingSessionId);
        frame.put("content", content);

        try {
            String json = objectMapper.writeValueAsString(frame);
            // 同一连接上思考线程和入站处理线程都可能发送
            synchronized (wsSession) {
                wsSession.sendMessage(new TextMessage(json));
            }
        } catch (JsonProcessingException e) {
            throw new SinkUnavailableException("思考帧序列化失败", e);
        } catch (IOException | IllegalStateException e) {
            throw new SinkUnavailableException("WebSocket 发送失败: wsSessionId=" + wsSession.getId(), e);
        }
    }
}
