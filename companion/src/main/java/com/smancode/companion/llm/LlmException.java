package com.smancode.companion.llm;

/**
 * LLM 调用失败（无可用端点、网络错误、HTTP 错误）
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
