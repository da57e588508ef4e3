package com.smancode.companion.thinking;

import com.smancode.companion.prompt.PromptKey;
import com.smancode.companion.prompt.PromptTemplateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 思考内容生成器
 * <p>
 * 降级链（逐级尝试，每一级自行消化异常）：
 * 1. 结合上下文的生成（按序号轮换提示词，靠后的思考附带已有思考摘要）
 * 2. 简短延续生成（上下文无关）
 * 3. 模板兜底（按序号取模，不会失败）
 * <p>
 * 对调用方永不抛异常。
 */
public class ThoughtGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ThoughtGenerator.class);

    /**
     * 持续阶段按序号轮换的提示词
     */
    private static final PromptKey[] ROTATION = {
            PromptKey.QUESTION_ANALYSIS,
            PromptKey.CONTEXTUAL_THINKING,
            PromptKey.PRACTICAL_THINKING,
            PromptKey.SYNTHESIS_THINKING
    };

    /**
     * 生成批次的最少可用条数，不足时改用模板
     */
    private static final int MIN_GENERATED_BATCH = 3;

    private final TextGenerationProvider provider;

    private final ConversationContextProvider contextProvider;

    private final PromptTemplateService promptTemplateService;

    private final ThoughtSanitizer sanitizer;

    private final InitialThoughtSelector selector;

    private final int summaryAfterThoughts;

    private final int summaryThoughtCount;

    /**
     * @param provider        文本生成服务，为 null 时只使用模板
     * @param contextProvider 对话上下文，可为 null
     */
    public ThoughtGenerator(TextGenerationProvider provider,
                            ConversationContextProvider contextProvider,
                            PromptTemplateService promptTemplateService,
                            ThoughtSanitizer sanitizer,
                            InitialThoughtSelector selector,
                            int summaryAfterThoughts,
                            int summaryThoughtCount) {
        this.provider = provider;
        this.contextProvider = contextProvider;
        this.promptTemplateService = promptTemplateService;
        this.sanitizer = sanitizer;
        this.selector = selector;
        this.summaryAfterThoughts = summaryAfterThoughts;
        this.summaryThoughtCount = summaryThoughtCount;
    }

    /**
     * 生成初始批次
     * <p>
     * 先尝试一次多行生成，可用条数不足时使用问题类别对应的模板批次，
     * 两种来源都经过同一选择规则。
     */
    public List<Thought> initialBatch(ThinkingSession session, CancellationToken token) {
        if (provider != null && !token.isCancelled()) {
            try {
                String prompt = promptTemplateService.render(PromptKey.THINKING_GENERATION,
                        baseVariables(session, true, false));
                List<String> lines = sanitizer.sanitizeLines(provider.generate(prompt));
                if (lines.size() >= MIN_GENERATED_BATCH) {
                    logger.debug("初始批次使用生成内容: sessionId={}, lines={}", session.getId(), lines.size());
                    return selector.select(lines).stream().map(Thought::generated).toList();
                }
                logger.debug("生成的初始批次不足 {} 条，改用模板: sessionId={}, lines={}",
                        MIN_GENERATED_BATCH, session.getId(), lines.size());
            } catch (Exception e) {
                logger.warn("生成初始批次失败，改用模板: sessionId={}, 错误: {}", session.getId(), e.getMessage());
            }
        }

        QuestionCategory category = QuestionCategory.classify(session.getUserMessage());
        logger.debug("初始批次使用模板: sessionId={}, category={}, language={}",
                session.getId(), category, session.getLanguage());
        return selector.select(ThoughtTemplates.initialBatch(category, session.getLanguage()))
                .stream()
                .map(Thought::template)
                .toList();
    }

    /**
     * 生成下一条思考
     *
     * @param session 当前会话
     * @param index   思考序号，用于轮换提示词和选取模板
     * @param token   取消令牌，已取消时跳过外部调用
     */
    public Thought nextThought(ThinkingSession session, int index, CancellationToken token) {
        if (provider != null && !token.isCancelled()) {
            try {
                return Thought.generated(generateContextual(session, index));
            } catch (Exception e) {
                logger.debug("上下文思考生成失败，尝试简短延续: sessionId={}, index={}, 错误: {}",
                        session.getId(), index, e.getMessage());
            }

            if (!token.isCancelled()) {
                try {
                    return Thought.generated(generateSimple(session));
                } catch (Exception e) {
                    logger.warn("思考生成全部失败，使用模板: sessionId={}, index={}, 错误: {}",
                            session.getId(), index, e.getMessage());
                }
            }
        }

        return Thought.template(ThoughtTemplates.continuation(index, session.getLanguage()));
    }

    private String generateContextual(ThinkingSession session, int index) {
        PromptKey key = ROTATION[Math.floorMod(index, ROTATION.length)];
        String prompt = promptTemplateService.render(key,
                baseVariables(session, true, index >= summaryAfterThoughts));
        return sanitizer.sanitize(callProvider(prompt));
    }

    private String generateSimple(ThinkingSession session) {
        String prompt = promptTemplateService.render(PromptKey.SIMPLE_CONTINUATION,
                baseVariables(session, false, false));
        return sanitizer.sanitize(callProvider(prompt));
    }

    private String callProvider(String prompt) {
        try {
            return provider.generate(prompt);
        } catch (ThoughtGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ThoughtGenerationException("文本生成调用失败: " + e.getMessage(), e);
        }
    }

    private Map<String, String> baseVariables(ThinkingSession session, boolean withContext, boolean withSummary) {
        Map<String, String> variables = new HashMap<>();
        variables.put("USER_MESSAGE", session.getUserMessage());
        variables.put("LANGUAGE_INSTRUCTION", session.getLanguage().getInstruction());
        variables.put("CONTEXT_PART", withContext ? buildContextPart() : "");
        variables.put("THINKING_PROGRESS_SUMMARY", withSummary ? buildProgressSummary(session) : "");
        return variables;
    }

    private String buildContextPart() {
        if (contextProvider == null) {
            return "";
        }
        try {
            String summary = contextProvider.getRecentContextSummary();
            if (summary == null || summary.isBlank()) {
                return "";
            }
            return "\n\nRecent conversation context:\n" + summary.strip() + "\n";
        } catch (Exception e) {
            logger.debug("获取对话上下文失败，忽略: {}", e.getMessage());
            return "";
        }
    }

    private String buildProgressSummary(ThinkingSession session) {
        List<Thought> thoughts = session.getThoughts();
        if (thoughts.isEmpty()) {
            return "";
        }
        List<String> recent = new ArrayList<>();
        for (int i = Math.max(0, thoughts.size() - summaryThoughtCount); i < thoughts.size(); i++) {
            recent.add(thoughts.get(i).text());
        }
        return " Thinking progress so far: " + String.join(" / ", recent) + ".";
    }
}
