package com.smancode.companion.context;

import com.smancode.companion.thinking.ConversationContextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 对话上下文（内存，有界）
 * <p>
 * 记录用户消息和真实回复，向思考生成器提供最近几条消息的摘要：
 * <pre>
 * User: ...
 * Agent: ...
 * </pre>
 */
@Service
public class ConversationContextService implements ConversationContextProvider {

    private static final Logger logger = LoggerFactory.getLogger(ConversationContextService.class);

    private final int maxMessages;

    private final int summaryMessages;

    private final int maxMessageLength;

    private final Deque<ConversationMessage> messages = new ArrayDeque<>();

    public ConversationContextService(@Value("${companion.context.max-messages:100}") int maxMessages,
                                      @Value("${companion.context.summary-messages:6}") int summaryMessages,
                                      @Value("${companion.context.max-message-length:300}") int maxMessageLength) {
        if (maxMessages <= 0 || summaryMessages <= 0 || maxMessageLength <= 0) {
            throw new IllegalArgumentException("上下文参数必须为正数: maxMessages=" + maxMessages
                    + ", summaryMessages=" + summaryMessages + ", maxMessageLength=" + maxMessageLength);
        }
        this.maxMessages = maxMessages;
        this.summaryMessages = summaryMessages;
        this.maxMessageLength = maxMessageLength;
    }

    public void recordUserMessage(String content) {
        record(ConversationMessage.Role.USER, content);
    }

    public void recordAgentMessage(String content) {
        record(ConversationMessage.Role.AGENT, content);
    }

    private synchronized void record(ConversationMessage.Role role, String content) {
        if (content == null || content.isBlank()) {
            return;
        }
        messages.addLast(new ConversationMessage(role, content.strip(), System.currentTimeMillis()));
        while (messages.size() > maxMessages) {
            messages.removeFirst();
        }
        logger.debug("对话上下文已更新: role={}, total={}", role, messages.size());
    }

    /**
     * 最近消息摘要，无消息时返回 null
     */
    @Override
    public synchronized String getRecentContextSummary() {
        if (messages.isEmpty()) {
            return null;
        }
        List<ConversationMessage> all = new ArrayList<>(messages);
        List<String> lines = new ArrayList<>();
        for (int i = Math.max(0, all.size() - summaryMessages); i < all.size(); i++) {
            ConversationMessage message = all.get(i);
            lines.add(message.role().getLabel() + ": " + truncate(message.content()));
        }
        return String.join("\n", lines);
    }

    public synchronized List<ConversationMessage> getMessages() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized void clear() {
        messages.clear();
        logger.info("对话上下文已清空");
    }

    private String truncate(String content) {
        String flat = content.replaceAll("\\s+", " ");
        if (flat.codePointCount(0, flat.length()) <= maxMessageLength) {
            return flat;
        }
        int end = flat.offsetByCodePoints(0, maxMessageLength);
        return flat.substring(0, end) + "...";
    }
}
