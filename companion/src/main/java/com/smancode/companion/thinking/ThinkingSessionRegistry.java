package com.smancode.companion.thinking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 思考会话登记表（单槽位）
 * <p>
 * 全进程同一时刻最多一个活跃会话。重复 start 不会创建第二个写入方，而是返回已有会话。
 * 如需支持多对话，可把槽位换成按对话 ID 索引的 Map，每个键仍然只允许一个写入方。
 */
public class ThinkingSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ThinkingSessionRegistry.class);

    private ThinkingSession active;

    /**
     * 登记结果
     *
     * @param session 当前槽位中的会话
     * @param created 是否为本次新建
     */
    public record Registration(ThinkingSession session, boolean created) {
    }

    /**
     * 槽位空闲时为该消息新建会话，否则返回已有会话
     */
    public synchronized Registration acquire(String userMessage) {
        if (active != null && active.getState() != ThinkingState.FINALIZED) {
            logger.info("已有活跃思考会话，复用: sessionId={}, state={}", active.getId(), active.getState());
            return new Registration(active, false);
        }
        active = new ThinkingSession(userMessage);
        return new Registration(active, true);
    }

    /**
     * 当前会话（已结束的会话视为空闲）
     */
    public synchronized ThinkingSession current() {
        if (active != null && active.getState() == ThinkingState.FINALIZED) {
            return null;
        }
        return active;
    }

    /**
     * 释放槽位，只有槽位中仍是该会话时才生效
     */
    public synchronized void release(ThinkingSession session) {
        if (active == session) {
            active = null;
            logger.debug("思考会话槽位已释放: sessionId={}", session.getId());
        }
    }
}
