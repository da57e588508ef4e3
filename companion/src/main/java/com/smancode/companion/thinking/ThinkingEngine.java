package com.smancode.companion.thinking;

import com.smancode.companion.config.ThinkingProperties;
import com.smancode.companion.prompt.PromptTemplateService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 思考模拟引擎（对外入口）
 * <p>
 * 真实回复在途期间生成并逐字展示"思考过程"，真实回复到达时由调用方请求自然终止，
 * 引擎收尾后解决完成信号，调用方再渲染真实回复。
 * <ul>
 *     <li>{@link #start} 开始新会话，或在已有活跃会话时返回同一个完成信号</li>
 *     <li>{@link #requestNaturalTermination} 幂等、立即返回</li>
 *     <li>完成信号在任何情况下都会被解决</li>
 * </ul>
 */
@Service
public class ThinkingEngine {

    private static final Logger logger = LoggerFactory.getLogger(ThinkingEngine.class);

    private final ThinkingProperties properties;

    private final ExecutorService executorService;

    private final Random random;

    private final ThinkingSessionRegistry registry = new ThinkingSessionRegistry();

    private final InterruptibleDelay delay;

    private final ThoughtGenerator generator;

    private final ContentStreamer streamer;

    private final ThinkingSessionLoop.PacingConfig pacing;

    private volatile ThinkingSession lastSession;

    @Autowired
    public ThinkingEngine(ThinkingProperties properties,
                          PromptTemplateService promptTemplateService,
                          TextGenerationProvider textGenerationProvider,
                          ConversationContextProvider contextProvider,
                          @Qualifier("thinkingExecutorService") ExecutorService executorService) {
        this(properties, promptTemplateService, textGenerationProvider, contextProvider, executorService, new Random());
    }

    public ThinkingEngine(ThinkingProperties properties,
                          PromptTemplateService promptTemplateService,
                          TextGenerationProvider textGenerationProvider,
                          ConversationContextProvider contextProvider,
                          ExecutorService executorService,
                          Random random) {
        this.properties = properties;
        this.executorService = executorService;
        this.random = random;
        this.delay = new InterruptibleDelay(properties.getPollQuantumMs());
        this.streamer = new ContentStreamer(delay, random,
                properties.getTypingDelayMinMs(), properties.getTypingDelayMaxMs());
        this.generator = new ThoughtGenerator(
                properties.isGenerationEnabled() ? textGenerationProvider : null,
                contextProvider,
                promptTemplateService,
                new ThoughtSanitizer(properties.getMaxThoughtLength()),
                new InitialThoughtSelector(random, properties.getInitialBatchMinSize(), properties.getInitialBatchMaxSize()),
                properties.getSummaryAfterThoughts(),
                properties.getSummaryThoughtCount());
        this.pacing = new ThinkingSessionLoop.PacingConfig(
                properties.getInitialPauseMinMs(), properties.getInitialPauseMaxMs(),
                properties.getContinuousDelayMinMs(), properties.getContinuousDelayMaxMs());

        logger.info("思考引擎初始化: generationEnabled={}, quantum={}ms, continuousDelay={}-{}ms",
                properties.isGenerationEnabled(), properties.getPollQuantumMs(),
                properties.getContinuousDelayMinMs(), properties.getContinuousDelayMaxMs());
    }

    /**
     * 开始思考会话
     * <p>
     * 已有活跃会话时不创建新会话，直接返回其完成信号（消息参数被忽略）。
     *
     * @param userMessage 触发本次思考的用户消息
     * @param sink        显示端
     * @return 会话结束时解决的完成信号
     */
    public CompletionSignal start(String userMessage, DisplaySink sink) {
        return open(userMessage, sink).session().getCompletionSignal();
    }

    /**
     * 同 {@link #start}，额外返回会话本身和是否为新建
     */
    public ThinkingSessionRegistry.Registration open(String userMessage, DisplaySink sink) {
        if (userMessage == null || userMessage.isBlank()) {
            throw new IllegalArgumentException("用户消息不能为空");
        }

        ThinkingSessionRegistry.Registration registration = registry.acquire(userMessage);
        if (!registration.created()) {
            return registration;
        }

        ThinkingSession session = registration.session();
        lastSession = session;
        ThinkingSessionLoop loop = new ThinkingSessionLoop(
                session, sink, generator, streamer, delay, random, registry, pacing);
        try {
            executorService.execute(loop);
            logger.info("思考会话已提交: sessionId={}", session.getId());
        } catch (RejectedExecutionException e) {
            logger.error("思考任务被线程池拒绝，直接结束会话: sessionId={}, {}", session.getId(), e.getMessage());
            loop.abandon();
        }
        return registration;
    }

    /**
     * 请求自然终止（真实回复已到达）
     * <p>
     * 只有活跃会话创建后的第一次调用生效，其余调用和无活跃会话时的调用都是空操作。
     */
    public void requestNaturalTermination() {
        ThinkingSession session = registry.current();
        if (session == null) {
            logger.debug("没有活跃的思考会话，忽略终止请求");
            return;
        }
        if (session.getCancellationToken().cancel()) {
            logger.info("收到自然终止请求: sessionId={}, state={}", session.getId(), session.getState());
        } else {
            logger.debug("重复的终止请求，忽略: sessionId={}", session.getId());
        }
    }

    /**
     * 是否处于 STREAMING_INITIAL 到 ENDING_NATURALLY 之间
     */
    public boolean isActive() {
        ThinkingSession session = registry.current();
        return session != null && session.isActive();
    }

    /**
     * 当前会话的完成信号，空闲时返回 null
     * <p>
     * 槽位在信号解决之前释放，所以结束中的会话在信号解决前这里已返回 null；
     * 需要等待某个会话时应持有 {@link #start} 返回的信号。
     */
    public CompletionSignal getCompletionSignal() {
        ThinkingSession session = registry.current();
        return session != null ? session.getCompletionSignal() : null;
    }

    /**
     * 当前会话（只读快照用途），空闲时返回 null
     */
    public ThinkingSession getActiveSession() {
        return registry.current();
    }

    /**
     * 最近一次创建的会话（可能已结束），从未开始过时返回 null
     */
    public ThinkingSession getLastSession() {
        return lastSession;
    }

    /**
     * 停机时终止活跃会话并等待其结束
     */
    @PreDestroy
    public void shutdown() {
        ThinkingSession session = registry.current();
        if (session == null) {
            return;
        }
        logger.info("停机，终止活跃思考会话: sessionId={}", session.getId());
        session.getCancellationToken().cancel();
        try {
            if (!session.getCompletionSignal().await(Duration.ofMillis(properties.getShutdownAwaitMs()))) {
                logger.warn("思考会话未在 {} ms 内结束: sessionId={}", properties.getShutdownAwaitMs(), session.getId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("等待思考会话结束被中断: sessionId={}", session.getId());
        }
    }
}
