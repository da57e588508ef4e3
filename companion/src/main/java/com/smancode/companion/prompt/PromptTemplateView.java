package com.smancode.companion.prompt;

/**
 * 提示词模板视图（对外展示）
 */
public record PromptTemplateView(String key, String name, String description, String template, boolean customized) {
}
