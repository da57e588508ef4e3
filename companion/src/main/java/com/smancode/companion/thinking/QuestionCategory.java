package com.smancode.companion.thinking;

import java.util.List;
import java.util.Locale;

/**
 * 用户问题类别，决定初始批次使用哪组模板
 * <p>
 * 按声明顺序匹配关键词，先命中者优先。
 */
public enum QuestionCategory {

    TROUBLESHOOTING(List.of("error", "bug", "fix", "issue", "problem", "fail", "broken", "exception",
            "crash", "not working", "错误", "报错", "异常", "失败", "故障", "修复", "问题")),

    COMPARISON(List.of(" vs ", "versus", "compare", "comparison", "difference", "better than",
            "区别", "对比", "比较", "哪个好", "差异")),

    HOW_TO(List.of("how do", "how to", "how can", "how should", "steps", "guide", "set up", "setup",
            "如何", "怎么", "怎样", "步骤", "教程")),

    EXPLANATION(List.of("what is", "what are", "why", "explain", "meaning", "definition", "describe",
            "什么是", "为什么", "解释", "含义", "原理", "是什么")),

    GENERAL(List.of());

    private final List<String> keywords;

    QuestionCategory(List<String> keywords) {
        this.keywords = keywords;
    }

    public static QuestionCategory classify(String userMessage) {
        if (userMessage == null || userMessage.isBlank()) {
            return GENERAL;
        }
        String normalized = " " + userMessage.toLowerCase(Locale.ROOT) + " ";
        for (QuestionCategory category : values()) {
            for (String keyword : category.keywords) {
                if (normalized.contains(keyword)) {
                    return category;
                }
            }
        }
        return GENERAL;
    }
}
