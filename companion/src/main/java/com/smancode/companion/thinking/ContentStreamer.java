package com.smancode.companion.thinking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * 内容流式输出器
 * <p>
 * 把增长中的内容逐字推给显示端。显示端每次收到的都是截至当前的完整内容，
 * 已渲染部分由会话的 renderedOffset 记录，只输出增量。
 */
public class ContentStreamer {

    private static final Logger logger = LoggerFactory.getLogger(ContentStreamer.class);

    private final InterruptibleDelay delay;

    private final Random random;

    private final long typingDelayMinMs;

    private final long typingDelayMaxMs;

    public ContentStreamer(InterruptibleDelay delay, Random random, long typingDelayMinMs, long typingDelayMaxMs) {
        this.delay = delay;
        this.random = random;
        this.typingDelayMinMs = typingDelayMinMs;
        this.typingDelayMaxMs = typingDelayMaxMs;
    }

    /**
     * 逐字输出 [renderedOffset, newFullContent.length()) 区间
     * <p>
     * 每个字符输出前检查取消令牌，被取消时立即停止，已输出的部分即为该条思考的最终显示。
     * 无论是否被中断，结束后 renderedOffset 都推进到 newFullContent 末尾。
     *
     * @param session        当前会话
     * @param newFullContent 追加后的完整内容，必须以已渲染部分为前缀
     * @param sink           显示端
     * @param token          取消令牌
     * @return 实际推送给显示端的字符数
     */
    public int streamDelta(ThinkingSession session, String newFullContent, DisplaySink sink, CancellationToken token) {
        int start = session.getRenderedOffset();
        int emitted = 0;
        try {
            requireSink(sink, session);
            int position = start;
            while (position < newFullContent.length()) {
                if (token.isCancelled()) {
                    logger.debug("逐字输出被取消: sessionId={}, 已输出 {}/{} 字符",
                            session.getId(), position - start, newFullContent.length() - start);
                    break;
                }

                // 按码点推进，避免拆开代理对
                position += Character.charCount(newFullContent.codePointAt(position));
                render(sink, newFullContent.substring(0, position), session);
                emitted++;

                if (position < newFullContent.length()) {
                    delay.delay(InterruptibleDelay.randomBetween(random, typingDelayMinMs, typingDelayMaxMs), token);
                }
            }
        } finally {
            session.advanceRenderedOffset(newFullContent.length());
        }
        return emitted;
    }

    /**
     * 一次性渲染完整内容（收尾语使用，不逐字输出）
     */
    public void renderAll(ThinkingSession session, String fullContent, DisplaySink sink) {
        requireSink(sink, session);
        render(sink, fullContent, session);
        session.advanceRenderedOffset(fullContent.length());
    }

    private void requireSink(DisplaySink sink, ThinkingSession session) {
        if (sink == null) {
            throw new SinkUnavailableException("显示端不存在: sessionId=" + session.getId());
        }
    }

    private void render(DisplaySink sink, String content, ThinkingSession session) {
        try {
            sink.renderFull(content);
            session.recordDisplayed(content);
        } catch (SinkUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SinkUnavailableException("显示端渲染失败: sessionId=" + session.getId(), e);
        }
    }
}
