package com.smancode.companion.thinking;

/**
 * 显示端
 * <p>
 * 每次接收截至当前的完整内容（而非增量字符），实现方需保证重复调用幂等且廉价。
 */
@FunctionalInterface
public interface DisplaySink {

    void renderFull(String content);

    /**
     * 会话线程开始执行、首次渲染之前调用一次
     */
    default void onSessionStarted(String sessionId) {
    }
}
