package com.smancode.companion.thinking;

/**
 * 思考会话状态
 * <p>
 * IDLE → STREAMING_INITIAL → STREAMING_CONTINUOUS → ENDING_NATURALLY → FINALIZED，
 * 任意非终态都可以直接进入 FINALIZED。
 */
public enum ThinkingState {

    /**
     * 已创建，循环尚未启动
     */
    IDLE,

    /**
     * 正在流式输出初始批次
     */
    STREAMING_INITIAL,

    /**
     * 持续生成阶段，无自然终点
     */
    STREAMING_CONTINUOUS,

    /**
     * 已收到真实回复，正在追加收尾语
     */
    ENDING_NATURALLY,

    /**
     * 终态
     */
    FINALIZED;

    public boolean canTransitionTo(ThinkingState target) {
        if (target == FINALIZED) {
            return this != FINALIZED;
        }
        return switch (this) {
            case IDLE -> target == STREAMING_INITIAL;
            case STREAMING_INITIAL -> target == STREAMING_CONTINUOUS;
            case STREAMING_CONTINUOUS -> target == ENDING_NATURALLY;
            case ENDING_NATURALLY, FINALIZED -> false;
        };
    }

    /**
     * 对外可见的"活跃"区间：STREAMING_INITIAL 到 ENDING_NATURALLY
     */
    public boolean isActive() {
        return this == STREAMING_INITIAL || this == STREAMING_CONTINUOUS || this == ENDING_NATURALLY;
    }
}
