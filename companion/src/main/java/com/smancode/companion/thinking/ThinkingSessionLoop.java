package com.smancode.companion.thinking;

import com.smancode.companion.util.StackTraceUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Random;

/**
 * 单个思考会话的执行循环
 * <p>
 * 状态机：
 * <pre>
 * IDLE → STREAMING_INITIAL → STREAMING_CONTINUOUS → ENDING_NATURALLY → FINALIZED
 *              │                      │
 *              └──────────────────────┴──→ FINALIZED（提前终止 / 异常）
 * </pre>
 * 整个会话在同一个工作线程上顺序执行，挂起点只有可中断延时和文本生成调用，
 * 每次从挂起点返回后都重新检查取消令牌。
 * <p>
 * 无论以何种方式结束，完成信号都会被解决，且是会话的最后一个可观察副作用。
 */
public class ThinkingSessionLoop implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ThinkingSessionLoop.class);

    private final ThinkingSession session;

    private final DisplaySink sink;

    private final ThoughtGenerator generator;

    private final ContentStreamer streamer;

    private final InterruptibleDelay delay;

    private final Random random;

    private final ThinkingSessionRegistry registry;

    private final PacingConfig pacing;

    /**
     * 节奏参数（毫秒）
     */
    public record PacingConfig(long initialPauseMinMs, long initialPauseMaxMs,
                               long continuousDelayMinMs, long continuousDelayMaxMs) {
    }

    public ThinkingSessionLoop(ThinkingSession session,
                               DisplaySink sink,
                               ThoughtGenerator generator,
                               ContentStreamer streamer,
                               InterruptibleDelay delay,
                               Random random,
                               ThinkingSessionRegistry registry,
                               PacingConfig pacing) {
        this.session = session;
        this.sink = sink;
        this.generator = generator;
        this.streamer = streamer;
        this.delay = delay;
        this.random = random;
        this.registry = registry;
        this.pacing = pacing;
    }

    @Override
    public void run() {
        MDC.put("sessionId", session.getId());
        CancellationToken token = session.getCancellationToken();
        EndReason reason = EndReason.FAILURE;
        try {
            session.transitionTo(ThinkingState.STREAMING_INITIAL);
            logger.info("思考会话开始: sessionId={}, language={}", session.getId(), session.getLanguage());
            if (sink != null) {
                sink.onSessionStarted(session.getId());
            }

            if (!runInitialPhase(token)) {
                reason = EndReason.EARLY_TERMINATION;
                return;
            }

            session.transitionTo(ThinkingState.STREAMING_CONTINUOUS);
            logger.debug("进入持续生成阶段: sessionId={}, thoughts={}", session.getId(), session.getThoughtIndex());
            runContinuousPhase(token);

            if (token.isCancelled()) {
                endNaturally();
                reason = EndReason.NATURAL_TERMINATION;
            } else {
                // 持续循环只会因取消而退出
                logger.warn("持续生成循环在未取消的情况下退出: sessionId={}", session.getId());
                reason = EndReason.LOOP_EXHAUSTED;
            }
        } catch (SinkUnavailableException e) {
            logger.warn("显示端不可用，提前结束思考: sessionId={}, {}", session.getId(), e.getMessage());
            reason = EndReason.FAILURE;
        } catch (Exception e) {
            logger.error("思考会话异常，提前结束: sessionId={}, {}", session.getId(), StackTraceUtils.formatStackTrace(e));
            reason = EndReason.FAILURE;
        } finally {
            finalizeSession(reason);
            MDC.remove("sessionId");
        }
    }

    /**
     * 初始阶段：逐条输出初始批次
     *
     * @return 批次完整输出且未被取消时返回 true
     */
    private boolean runInitialPhase(CancellationToken token) {
        List<Thought> batch = generator.initialBatch(session, token);
        for (int i = 0; i < batch.size(); i++) {
            if (token.isCancelled()) {
                return false;
            }
            if (i > 0 && !pause(pacing.initialPauseMinMs(), pacing.initialPauseMaxMs(), token)) {
                return false;
            }
            String content = session.appendThought(batch.get(i));
            streamer.streamDelta(session, content, sink, token);
        }
        return !token.isCancelled();
    }

    /**
     * 持续阶段：没有迭代上限，直到取消令牌被翻转
     */
    private void runContinuousPhase(CancellationToken token) {
        while (!token.isCancelled()) {
            if (!pause(pacing.continuousDelayMinMs(), pacing.continuousDelayMaxMs(), token)) {
                continue;
            }

            Thought thought = generator.nextThought(session, session.getThoughtIndex(), token);
            if (token.isCancelled()) {
                logger.debug("终止请求到达时丢弃在途思考: sessionId={}, origin={}", session.getId(), thought.origin());
                break;
            }

            String content = session.appendThought(thought);
            streamer.streamDelta(session, content, sink, token);
        }
    }

    /**
     * 自然结束：追加收尾语并一次性渲染
     */
    private void endNaturally() {
        session.transitionTo(ThinkingState.ENDING_NATURALLY);
        String content = session.appendClosingLine(ThoughtTemplates.closingLine(session.getLanguage()));
        streamer.renderAll(session, content, sink);
    }

    /**
     * 随机停顿
     *
     * @return 完整停顿返回 true，被取消返回 false
     */
    private boolean pause(long minMs, long maxMs, CancellationToken token) {
        boolean completed = delay.delay(InterruptibleDelay.randomBetween(random, minMs, maxMs), token);
        if (!completed && !token.isCancelled() && Thread.currentThread().isInterrupted()) {
            throw new IllegalStateException("思考线程被中断: sessionId=" + session.getId());
        }
        return completed;
    }

    /**
     * 任务未能提交执行时直接结束会话，保证完成信号被解决
     */
    void abandon() {
        finalizeSession(EndReason.FAILURE);
    }

    private void finalizeSession(EndReason reason) {
        try {
            session.finish(reason);
        } catch (IllegalStateException e) {
            logger.error("结束会话状态异常: {}", e.getMessage());
        }

        logger.info("思考会话结束: sessionId={}, reason={}, thoughts={}, length={}",
                session.getId(), reason, session.getThoughtIndex(), session.getAccumulatedContent().length());

        registry.release(session);
        session.getCompletionSignal().resolve();
    }

    public ThinkingSession getSession() {
        return session;
    }
}
