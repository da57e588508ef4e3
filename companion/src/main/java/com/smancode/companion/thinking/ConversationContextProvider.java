package com.smancode.companion.thinking;

/**
 * 对话上下文提供方，仅用于丰富生成提示词
 */
@FunctionalInterface
public interface ConversationContextProvider {

    /**
     * @return 最近对话摘要，没有上下文时返回 null 或空串
     */
    String getRecentContextSummary();
}
