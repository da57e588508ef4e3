package com.smancode.companion.prompt;

/**
 * 提示词模板键
 * <p>
 * 每个键对应 resources/prompts 下的一个默认模板文件，可被用户覆盖。
 */
public enum PromptKey {

    THINKING_GENERATION("thinking/thinking-generation.md", "Thinking Content Generation",
            "生成初始批次思考内容（多行）"),

    QUESTION_ANALYSIS("thinking/question-analysis.md", "Question Analysis",
            "针对问题本身的深入分析"),

    CONTEXTUAL_THINKING("thinking/contextual-thinking.md", "Contextual Thinking",
            "结合对话上下文的思考"),

    PRACTICAL_THINKING("thinking/practical-thinking.md", "Practical Thinking",
            "侧重实际落地的思考"),

    SYNTHESIS_THINKING("thinking/synthesis-thinking.md", "Synthesis Thinking",
            "汇总已有思考，准备回答"),

    SIMPLE_CONTINUATION("thinking/simple-continuation.md", "Simple Continuation",
            "上下文无关的简短延续（降级使用）");

    private final String path;

    private final String displayName;

    private final String description;

    PromptKey(String path, String displayName, String description) {
        this.path = path;
        this.displayName = displayName;
        this.description = description;
    }

    public String getPath() {
        return path;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 按名称查找，大小写和连字符不敏感（"simple-continuation" 等价于 SIMPLE_CONTINUATION）
     *
     * @return 找不到时返回 null
     */
    public static PromptKey fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(java.util.Locale.ROOT);
        for (PromptKey key : values()) {
            if (key.name().equals(normalized)) {
                return key;
            }
        }
        return null;
    }
}
