package com.smancode.companion.thinking;

/**
 * 显示端缺失或渲染失败
 * <p>
 * 由会话循环的顶层捕获，按提前终止处理。
 */
public class SinkUnavailableException extends RuntimeException {

    public SinkUnavailableException(String message) {
        super(message);
    }

    public SinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
