package com.smancode.companion.context;

/**
 * 对话中的一条消息
 *
 * @param role      发送方
 * @param content   消息内容
 * @param timestamp 记录时间（毫秒）
 */
public record ConversationMessage(Role role, String content, long timestamp) {

    public enum Role {
        USER("User"),
        AGENT("Agent");

        private final String label;

        Role(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
