package com.smancode.companion.thinking;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 思考会话
 * <p>
 * 一次引擎运行，对应一条等待真实回复的用户消息。
 * 内容缓冲只追加不改写，FINALIZED 之后不可变；
 * 所有写操作只发生在会话循环线程上，字段以 volatile 发布给状态查询方。
 */
public class ThinkingSession {

    /**
     * 思考内容之间的分隔（空行）
     */
    public static final String THOUGHT_SEPARATOR = "\n\n";

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String id;

    private final String userMessage;

    private final ThinkingLanguage language;

    private final CancellationToken cancellationToken = new CancellationToken();

    private final CompletionSignal completionSignal;

    private final List<Thought> thoughts = Collections.synchronizedList(new ArrayList<>());

    private final Instant startedAt = Instant.now();

    private volatile ThinkingState state = ThinkingState.IDLE;

    private volatile String accumulatedContent = "";

    private volatile int renderedOffset = 0;

    private volatile String displayedContent = "";

    private volatile int thoughtIndex = 0;

    private volatile EndReason endReason;

    private volatile Instant finishedAt;

    public ThinkingSession(String userMessage) {
        if (userMessage == null || userMessage.isBlank()) {
            throw new IllegalArgumentException("用户消息不能为空");
        }
        this.id = "thinking-" + System.currentTimeMillis() + "-" + SEQUENCE.incrementAndGet();
        this.userMessage = userMessage;
        this.language = ThinkingLanguage.detect(userMessage);
        this.completionSignal = new CompletionSignal(id);
    }

    /**
     * 状态转换，非法转换抛出 IllegalStateException
     */
    void transitionTo(ThinkingState target) {
        ThinkingState current = this.state;
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("非法状态转换: " + current + " -> " + target + ", sessionId=" + id);
        }
        this.state = target;
    }

    /**
     * 追加一条思考内容（首条之外以空行分隔）
     *
     * @return 追加后的完整内容
     */
    String appendThought(Thought thought) {
        String updated = append(thought.text());
        thoughts.add(thought);
        thoughtIndex++;
        return updated;
    }

    /**
     * 追加收尾语，不计入思考序号
     */
    String appendClosingLine(String closingLine) {
        return append(closingLine);
    }

    private String append(String text) {
        if (state == ThinkingState.FINALIZED) {
            throw new IllegalStateException("会话已结束，内容不可变: sessionId=" + id);
        }
        String current = accumulatedContent;
        accumulatedContent = current.isEmpty() ? text : current + THOUGHT_SEPARATOR + text;
        return accumulatedContent;
    }

    /**
     * 推进已渲染游标，只允许前进且不能越过内容末尾
     */
    void advanceRenderedOffset(int offset) {
        if (offset < renderedOffset) {
            throw new IllegalStateException("渲染游标不能回退: " + renderedOffset + " -> " + offset);
        }
        if (offset > accumulatedContent.length()) {
            throw new IllegalStateException("渲染游标越界: " + offset + " > " + accumulatedContent.length());
        }
        renderedOffset = offset;
    }

    /**
     * 记录显示端最近一次成功收到的内容
     */
    void recordDisplayed(String content) {
        displayedContent = content;
    }

    void finish(EndReason reason) {
        transitionTo(ThinkingState.FINALIZED);
        this.endReason = reason;
        this.finishedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getUserMessage() {
        return userMessage;
    }

    public ThinkingLanguage getLanguage() {
        return language;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public CompletionSignal getCompletionSignal() {
        return completionSignal;
    }

    public ThinkingState getState() {
        return state;
    }

    public boolean isActive() {
        return state.isActive();
    }

    public String getAccumulatedContent() {
        return accumulatedContent;
    }

    public int getRenderedOffset() {
        return renderedOffset;
    }

    /**
     * 显示端实际收到的最新内容（逐字推进，被中断的思考只包含已输出部分）
     */
    public String getDisplayedContent() {
        return displayedContent;
    }

    public int getThoughtIndex() {
        return thoughtIndex;
    }

    /**
     * 已追加的思考内容快照
     */
    public List<Thought> getThoughts() {
        synchronized (thoughts) {
            return List.copyOf(thoughts);
        }
    }

    public EndReason getEndReason() {
        return endReason;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    @Override
    public String toString() {
        return "ThinkingSession{" +
                "id='" + id + '\'' +
                ", state=" + state +
                ", thoughtIndex=" + thoughtIndex +
                ", contentLength=" + accumulatedContent.length() +
                ", renderedOffset=" + renderedOffset +
                ", endReason=" + endReason +
                '}';
    }
}
