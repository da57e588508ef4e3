package com.smancode.companion.thinking;

/**
 * 外部文本生成服务
 * <p>
 * 可能抛出任意运行时异常；引擎不做重试，由思考生成器的降级链兜底。
 */
@FunctionalInterface
public interface TextGenerationProvider {

    /**
     * @param prompt 完整提示词
     * @return 生成的文本
     */
    String generate(String prompt);
}
