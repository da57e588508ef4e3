package com.smancode.companion.thinking;

import com.smancode.companion.prompt.PromptKey;
import com.smancode.companion.prompt.PromptTemplateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ThoughtGenerator 测试
 * <p>
 * 覆盖降级链：上下文生成 → 简短延续 → 模板
 */
class ThoughtGeneratorTest {

    private PromptTemplateService promptTemplateService;

    private final List<String> prompts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        promptTemplateService = new PromptTemplateService();
        prompts.clear();
    }

    private ThoughtGenerator generator(Function<String, String> behaviour, ConversationContextProvider context) {
        TextGenerationProvider provider = behaviour == null ? null : prompt -> {
            prompts.add(prompt);
            return behaviour.apply(prompt);
        };
        return new ThoughtGenerator(provider, context, promptTemplateService,
                new ThoughtSanitizer(200), new InitialThoughtSelector(new Random(5), 3, 5), 3, 3);
    }

    private static CancellationToken liveToken() {
        return new CancellationToken();
    }

    @Test
    @DisplayName("上下文生成成功时使用生成内容")
    void testNextThought_ContextualSuccess() {
        ThoughtGenerator generator = generator(prompt -> "- **Checking the connection pool limits.**", null);
        ThinkingSession session = new ThinkingSession("Why is my database slow?");

        Thought thought = generator.nextThought(session, 0, liveToken());

        assertEquals(ThoughtOrigin.GENERATED, thought.origin());
        assertEquals("Checking the connection pool limits.", thought.text());
        assertEquals(1, prompts.size());
        assertTrue(prompts.get(0).contains("Why is my database slow?"));
        assertTrue(prompts.get(0).contains("Respond in English."));
    }

    @Test
    @DisplayName("上下文生成失败时降级为简短延续")
    void testNextThought_FallsBackToSimpleContinuation() {
        ThoughtGenerator generator = generator(prompt -> {
            if (prompt.startsWith("Generate a single brief thinking statement")) {
                return "Still narrowing things down.";
            }
            throw new ThoughtGenerationException("timeout");
        }, null);
        ThinkingSession session = new ThinkingSession("Why is my database slow?");

        Thought thought = generator.nextThought(session, 1, liveToken());

        assertEquals(ThoughtOrigin.GENERATED, thought.origin());
        assertEquals("Still narrowing things down.", thought.text());
        assertEquals(2, prompts.size());
    }

    @Test
    @DisplayName("两级生成都失败时使用模板，且不抛异常")
    void testNextThought_FallsBackToTemplate() {
        ThoughtGenerator generator = generator(prompt -> {
            throw new IllegalStateException("endpoint down");
        }, null);
        ThinkingSession session = new ThinkingSession("Why is my database slow?");

        Thought thought = generator.nextThought(session, 7, liveToken());

        assertEquals(ThoughtOrigin.TEMPLATE, thought.origin());
        assertEquals(ThoughtTemplates.continuation(7, ThinkingLanguage.ENGLISH), thought.text());
    }

    @Test
    @DisplayName("空白生成结果视为失败")
    void testNextThought_BlankOutputCountsAsFailure() {
        ThoughtGenerator generator = generator(prompt -> "   \n  ", null);
        ThinkingSession session = new ThinkingSession("数据库为什么慢？");

        Thought thought = generator.nextThought(session, 2, liveToken());

        assertEquals(ThoughtOrigin.TEMPLATE, thought.origin());
        assertEquals(ThoughtTemplates.continuation(2, ThinkingLanguage.CHINESE), thought.text());
    }

    @Test
    void testNextThought_NoProviderUsesTemplates() {
        ThoughtGenerator generator = generator(null, null);
        ThinkingSession session = new ThinkingSession("hello there");

        for (int i = 0; i < 12; i++) {
            Thought thought = generator.nextThought(session, i, liveToken());
            assertEquals(ThoughtTemplates.continuation(i, ThinkingLanguage.ENGLISH), thought.text());
        }
    }

    @Test
    @DisplayName("已取消时不再调用外部生成")
    void testNextThought_CancelledSkipsProvider() {
        ThoughtGenerator generator = generator(prompt -> "should not be used", null);
        CancellationToken token = new CancellationToken();
        token.cancel();

        Thought thought = generator.nextThought(new ThinkingSession("hello there"), 0, token);

        assertEquals(ThoughtOrigin.TEMPLATE, thought.origin());
        assertTrue(prompts.isEmpty());
    }

    @Test
    @DisplayName("提示词按序号轮换")
    void testNextThought_RotatesPrompts() {
        promptTemplateService.updateTemplate(PromptKey.QUESTION_ANALYSIS, "QA {{USER_MESSAGE}}");
        promptTemplateService.updateTemplate(PromptKey.CONTEXTUAL_THINKING, "CT {{USER_MESSAGE}}");
        promptTemplateService.updateTemplate(PromptKey.PRACTICAL_THINKING, "PT {{USER_MESSAGE}}");
        promptTemplateService.updateTemplate(PromptKey.SYNTHESIS_THINKING, "ST {{USER_MESSAGE}}");
        ThoughtGenerator generator = generator(prompt -> "ok", null);
        ThinkingSession session = new ThinkingSession("hello there");

        for (int i = 0; i < 5; i++) {
            generator.nextThought(session, i, liveToken());
        }

        assertEquals(List.of("QA hello there", "CT hello there", "PT hello there", "ST hello there",
                "QA hello there"), prompts);
    }

    @Test
    @DisplayName("靠后的思考附带已有思考摘要")
    void testNextThought_AddsProgressSummaryAfterThreshold() {
        promptTemplateService.updateTemplate(PromptKey.QUESTION_ANALYSIS, "[{{THINKING_PROGRESS_SUMMARY}}]");
        promptTemplateService.updateTemplate(PromptKey.CONTEXTUAL_THINKING, "[{{THINKING_PROGRESS_SUMMARY}}]");
        ThoughtGenerator generator = generator(prompt -> "ok", null);
        ThinkingSession session = new ThinkingSession("hello there");
        session.appendThought(Thought.template("one"));
        session.appendThought(Thought.template("two"));
        session.appendThought(Thought.template("three"));
        session.appendThought(Thought.template("four"));

        generator.nextThought(session, 0, liveToken());
        generator.nextThought(session, 5, liveToken());

        assertEquals("[]", prompts.get(0));
        assertEquals("[ Thinking progress so far: two / three / four.]", prompts.get(1));
    }

    @Test
    void testNextThought_IncludesConversationContext() {
        promptTemplateService.updateTemplate(PromptKey.QUESTION_ANALYSIS, "{{CONTEXT_PART}}");
        ThoughtGenerator generator = generator(prompt -> "ok", () -> "User: earlier question\nAgent: earlier answer");

        generator.nextThought(new ThinkingSession("hello there"), 0, liveToken());

        assertEquals("\n\nRecent conversation context:\nUser: earlier question\nAgent: earlier answer\n", prompts.get(0));
    }

    @Test
    void testNextThought_BrokenContextIsIgnored() {
        promptTemplateService.updateTemplate(PromptKey.QUESTION_ANALYSIS, "<{{CONTEXT_PART}}>");
        ThoughtGenerator generator = generator(prompt -> "ok", () -> {
            throw new IllegalStateException("context store offline");
        });

        Thought thought = generator.nextThought(new ThinkingSession("hello there"), 0, liveToken());

        assertEquals("ok", thought.text());
        assertEquals("<>", prompts.get(0));
    }

    @Test
    @DisplayName("初始批次：生成内容足够时使用生成内容")
    void testInitialBatch_UsesGeneratedLines() {
        ThoughtGenerator generator = generator(prompt ->
                "1. Understanding your question\n2. Looking at causes\n3. Checking logs\n4. Comparing fixes\n5. Preparing the answer", null);

        List<Thought> batch = generator.initialBatch(new ThinkingSession("My build fails"), liveToken());

        assertTrue(batch.size() >= 3 && batch.size() <= 5);
        assertTrue(batch.stream().allMatch(t -> t.origin() == ThoughtOrigin.GENERATED));
        assertEquals("Understanding your question", batch.get(0).text());
        assertEquals("Preparing the answer", batch.get(batch.size() - 1).text());
        assertTrue(prompts.get(0).contains("3-5 short thinking statements"));
    }

    @Test
    @DisplayName("初始批次：生成内容不足三条时改用类别模板")
    void testInitialBatch_TooFewLinesUsesTemplates() {
        ThoughtGenerator generator = generator(prompt -> "Only one line\nand two", null);
        String message = "I have an error in my code, how do I fix it?";

        List<Thought> batch = generator.initialBatch(new ThinkingSession(message), liveToken());
        List<String> templates = ThoughtTemplates.initialBatch(QuestionCategory.TROUBLESHOOTING, ThinkingLanguage.ENGLISH);

        assertTrue(batch.size() >= 3);
        assertTrue(batch.stream().allMatch(t -> t.origin() == ThoughtOrigin.TEMPLATE));
        assertEquals(templates.get(0), batch.get(0).text());
        assertEquals(templates.get(templates.size() - 1), batch.get(batch.size() - 1).text());
        assertTrue(batch.get(0).text().contains("error"));
    }

    @Test
    void testInitialBatch_ProviderFailureUsesTemplates() {
        ThoughtGenerator generator = generator(prompt -> {
            throw new ThoughtGenerationException("no endpoint");
        }, null);

        List<Thought> batch = generator.initialBatch(new ThinkingSession("如何配置线程池？"), liveToken());

        assertTrue(batch.size() >= 3);
        assertEquals(ThoughtTemplates.initialBatch(QuestionCategory.HOW_TO, ThinkingLanguage.CHINESE).get(0),
                batch.get(0).text());
    }
}
