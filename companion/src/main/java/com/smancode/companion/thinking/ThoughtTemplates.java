package com.smancode.companion.thinking;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 思考模板库
 * <p>
 * 初始批次按问题类别 × 语言组织，每组 5 条：第 0 条理解问题，最后一条准备回答。
 * 持续阶段的通用模板按序号取模选取，保证生成服务不可用时仍有内容输出。
 */
public final class ThoughtTemplates {

    private static final Map<QuestionCategory, List<String>> INITIAL_EN = new EnumMap<>(QuestionCategory.class);

    private static final Map<QuestionCategory, List<String>> INITIAL_ZH = new EnumMap<>(QuestionCategory.class);

    static {
        INITIAL_EN.put(QuestionCategory.TROUBLESHOOTING, List.of(
                "Let me first understand the error you're running into and where it shows up.",
                "I'm thinking about the most common causes behind this kind of error.",
                "It helps to separate the symptom from the underlying problem before suggesting a fix.",
                "I'm considering which checks would confirm the cause quickly.",
                "I'm putting together a step-by-step fix you can try right away."
        ));
        INITIAL_EN.put(QuestionCategory.COMPARISON, List.of(
                "Let me make sure I understand which options you want to compare.",
                "I'm lining up the criteria that matter most for this comparison.",
                "Each option has trade-offs, so I'm weighing strengths against limitations.",
                "I'm thinking about which scenarios favor one choice over the other.",
                "I'm preparing a side-by-side summary with a clear recommendation."
        ));
        INITIAL_EN.put(QuestionCategory.HOW_TO, List.of(
                "Let me work out exactly what you want to accomplish.",
                "I'm breaking the task down into smaller, manageable steps.",
                "I'm checking which prerequisites you'll need before starting.",
                "I'm thinking about pitfalls that often come up along the way.",
                "I'm organizing the steps into a clear guide for you."
        ));
        INITIAL_EN.put(QuestionCategory.EXPLANATION, List.of(
                "Let me pin down the core concept behind your question.",
                "I'm recalling the key background that makes this easier to follow.",
                "A concrete example could make the idea clearer.",
                "I'm considering how this connects to related concepts.",
                "I'm shaping an explanation that goes from the basics to the details."
        ));
        INITIAL_EN.put(QuestionCategory.GENERAL, List.of(
                "Let me make sure I understand what you're asking.",
                "I'm identifying the key points your question touches on.",
                "I'm thinking about the context that would make the answer most useful.",
                "I'm weighing a few different angles on this.",
                "I'm gathering everything into a clear answer for you."
        ));

        INITIAL_ZH.put(QuestionCategory.TROUBLESHOOTING, List.of(
                "先弄清楚你遇到的错误是什么、在什么情况下出现。",
                "我在梳理这类错误最常见的几种原因。",
                "在给出修复方案前，需要把表面现象和根本问题区分开。",
                "我在考虑哪些检查能最快确认问题所在。",
                "正在整理一套可以马上动手的修复步骤。"
        ));
        INITIAL_ZH.put(QuestionCategory.COMPARISON, List.of(
                "先确认一下你想比较的是哪几个选项。",
                "我在梳理这次比较中最关键的几个维度。",
                "每个选项都有取舍，我在权衡各自的优势和局限。",
                "我在思考哪些场景更适合哪一种选择。",
                "正在准备一份对比总结和明确的建议。"
        ));
        INITIAL_ZH.put(QuestionCategory.HOW_TO, List.of(
                "先弄清楚你具体想要完成什么。",
                "我在把这个任务拆解成几个可执行的小步骤。",
                "我在确认开始之前需要准备哪些前置条件。",
                "我在考虑过程中容易踩到的坑。",
                "正在把这些步骤整理成清晰的操作指南。"
        ));
        INITIAL_ZH.put(QuestionCategory.EXPLANATION, List.of(
                "先抓住你这个问题背后的核心概念。",
                "我在回顾理解它所需要的关键背景。",
                "举一个具体的例子可能会更容易理解。",
                "我在思考它和相关概念之间的联系。",
                "正在组织一份由浅入深的解释。"
        ));
        INITIAL_ZH.put(QuestionCategory.GENERAL, List.of(
                "先确认一下我理解了你的问题。",
                "我在梳理这个问题涉及的几个要点。",
                "我在思考哪些背景信息能让回答更有帮助。",
                "我在从几个不同的角度权衡这个问题。",
                "正在把这些整理成一个清晰的回答。"
        ));
    }

    private static final List<String> CONTINUATION_EN = List.of(
            "I'm double-checking the details to make sure nothing important is missed.",
            "Let me consider whether there's a simpler way to approach this.",
            "I'm thinking about edge cases that might change the answer.",
            "I'm connecting this with similar situations I've seen before.",
            "Let me weigh which points matter most for you.",
            "I'm looking at this from a practical, hands-on perspective.",
            "I'm checking that the reasoning holds together end to end.",
            "I'm considering what follow-up questions you might have.",
            "Let me refine the structure so the answer is easy to follow.",
            "I'm bringing the different considerations together."
    );

    private static final List<String> CONTINUATION_ZH = List.of(
            "我在反复核对细节，确保没有遗漏重要的地方。",
            "我在想有没有更简单直接的思路。",
            "我在考虑可能影响结论的边界情况。",
            "我在把它和类似的场景联系起来看。",
            "我在权衡哪些要点对你最重要。",
            "我在从实际操作的角度重新审视这个问题。",
            "我在检查整个推理过程是否前后一致。",
            "我在考虑你接下来可能会关心的问题。",
            "我在调整回答的结构，让它更容易理解。",
            "我在把各方面的考虑汇总到一起。"
    );

    private static final String CLOSING_EN = "I've gathered my thoughts and I'm ready to share the answer.";

    private static final String CLOSING_ZH = "思考完成，正在为你呈现答案。";

    private ThoughtTemplates() {
    }

    /**
     * 初始批次模板（5 条，首条理解问题，末条准备回答）
     */
    public static List<String> initialBatch(QuestionCategory category, ThinkingLanguage language) {
        Map<QuestionCategory, List<String>> bank = language == ThinkingLanguage.CHINESE ? INITIAL_ZH : INITIAL_EN;
        return bank.getOrDefault(category, bank.get(QuestionCategory.GENERAL));
    }

    /**
     * 持续阶段通用模板，按 index mod size 选取
     */
    public static String continuation(int index, ThinkingLanguage language) {
        List<String> bank = language == ThinkingLanguage.CHINESE ? CONTINUATION_ZH : CONTINUATION_EN;
        return bank.get(Math.floorMod(index, bank.size()));
    }

    public static int continuationBankSize(ThinkingLanguage language) {
        return (language == ThinkingLanguage.CHINESE ? CONTINUATION_ZH : CONTINUATION_EN).size();
    }

    /**
     * 收尾语
     */
    public static String closingLine(ThinkingLanguage language) {
        return language == ThinkingLanguage.CHINESE ? CLOSING_ZH : CLOSING_EN;
    }
}
