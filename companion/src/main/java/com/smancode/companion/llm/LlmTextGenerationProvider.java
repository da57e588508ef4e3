package com.smancode.companion.llm;

import com.smancode.companion.thinking.TextGenerationProvider;
import com.smancode.companion.thinking.ThoughtGenerationException;
import org.springframework.stereotype.Component;

/**
 * 基于 LLM 端点池的文本生成服务
 * <p>
 * 每次只调用一次，失败转换为 ThoughtGenerationException，由思考生成器降级。
 */
@Component
public class LlmTextGenerationProvider implements TextGenerationProvider {

    /**
     * 思考内容的系统提示词
     */
    static final String SYSTEM_PROMPT = "You write short, natural first-person thinking statements "
            + "shown to a user while their answer is being prepared. Never answer the question itself.";

    private final LlmService llmService;

    public LlmTextGenerationProvider(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String generate(String prompt) {
        if (!llmService.isConfigured()) {
            throw new ThoughtGenerationException("未配置 LLM 端点");
        }
        try {
            return llmService.requestOnce(SYSTEM_PROMPT, prompt);
        } catch (LlmException e) {
            throw new ThoughtGenerationException(e.getMessage(), e);
        }
    }
}
