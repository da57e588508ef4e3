package com.smancode.companion.thinking;

/**
 * 一条思考内容
 */
public record Thought(String text, ThoughtOrigin origin) {

    public Thought {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("思考内容不能为空");
        }
        if (origin == null) {
            throw new IllegalArgumentException("思考来源不能为空");
        }
    }

    public static Thought template(String text) {
        return new Thought(text, ThoughtOrigin.TEMPLATE);
    }

    public static Thought generated(String text) {
        return new Thought(text, ThoughtOrigin.GENERATED);
    }
}
