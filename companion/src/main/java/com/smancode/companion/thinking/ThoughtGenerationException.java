package com.smancode.companion.thinking;

/**
 * 思考生成失败（服务调用失败或返回不可用文本）
 * <p>
 * 只在思考生成器内部流转，由降级链消化，不会抛给调用方。
 */
public class ThoughtGenerationException extends RuntimeException {

    public ThoughtGenerationException(String message) {
        super(message);
    }

    public ThoughtGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
