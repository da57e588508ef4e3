package com.smancode.companion.websocket;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket 配置
 * <p>
 * 端点 /ws/thinking：思考过程的推送通道
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ThinkingWebSocketHandler thinkingWebSocketHandler;

    public WebSocketConfig(ThinkingWebSocketHandler thinkingWebSocketHandler) {
        this.thinkingWebSocketHandler = thinkingWebSocketHandler;
    }

    /**
     * 思考帧是完整内容，随思考增长，缓冲区放宽到 1MB
     */
    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(1024 * 1024);
        container.setMaxBinaryMessageBufferSize(1024 * 1024);
        // 10 分钟
        container.setMaxSessionIdleTimeout(10 * 60 * 1000L);
        return container;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(thinkingWebSocketHandler, "/ws/thinking")
                .setAllowedOrigins("*");
    }
}
