package com.smancode.companion.controller;

import com.smancode.companion.context.ConversationContextService;
import com.smancode.companion.thinking.ThinkingEngine;
import com.smancode.companion.thinking.ThinkingSession;
import com.smancode.companion.thinking.ThinkingSessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 思考会话 REST API
 * <p>
 * 供不走 WebSocket 的客户端使用：start 之后轮询 status 读取已渲染内容。
 */
@RestController
@RequestMapping("/api/thinking")
@CrossOrigin(origins = "*")
public class ThinkingController {

    private static final Logger logger = LoggerFactory.getLogger(ThinkingController.class);

    private final ThinkingEngine thinkingEngine;

    private final ConversationContextService contextService;

    public ThinkingController(ThinkingEngine thinkingEngine, ConversationContextService contextService) {
        this.thinkingEngine = thinkingEngine;
        this.contextService = contextService;
    }

    /**
     * 开始思考
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody Map<String, String> request) {
        String message = request.get("message");
        if (message == null || message.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "message 不能为空"));
        }

        // 内容保存在会话里，由 status 读取
        ThinkingSessionRegistry.Registration registration = thinkingEngine.open(message, content -> {
        });
        ThinkingSession session = registration.session();
        if (registration.created()) {
            contextService.recordUserMessage(message);
        }
        logger.info("REST 开始思考: sessionId={}, attached={}", session.getId(), !registration.created());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", session.getId());
        body.put("state", session.getState().name());
        body.put("attached", !registration.created());
        return ResponseEntity.ok(body);
    }

    /**
     * 请求自然终止，可附带真实回复写入上下文
     */
    @PostMapping("/terminate")
    public ResponseEntity<Map<String, Object>> terminate(@RequestBody(required = false) Map<String, String> request) {
        if (request != null && request.get("text") != null) {
            contextService.recordAgentMessage(request.get("text"));
        }
        boolean wasActive = thinkingEngine.getActiveSession() != null;
        thinkingEngine.requestNaturalTermination();
        return ResponseEntity.ok(Map.of("requested", wasActive));
    }

    /**
     * 最近一次会话的状态
     * <p>
     * 会话结束后仍返回其最终内容和 endReason，直到下一次 start。
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        ThinkingSession session = thinkingEngine.getLastSession();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", session != null && session.isActive());
        if (session != null) {
            body.put("sessionId", session.getId());
            body.put("state", session.getState().name());
            body.put("thoughtCount", session.getThoughtIndex());
            body.put("renderedContent", session.getDisplayedContent());
            if (session.getEndReason() != null) {
                body.put("endReason", session.getEndReason().name());
            }
        }
        return ResponseEntity.ok(body);
    }

    /**
     * 健康检查
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "thinking-companion"
        ));
    }
}
