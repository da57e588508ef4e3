package com.smancode.companion.thinking;

/**
 * 思考内容语言
 * <p>
 * 启发式检测：用户消息中出现任意 CJK 字符即判定为中文，否则为英文。
 * 这不是完整的语言分类器，混合语言的消息会被归为中文。
 */
public enum ThinkingLanguage {

    ENGLISH("Respond in English."),

    CHINESE("请使用中文回答。");

    private final String instruction;

    ThinkingLanguage(String instruction) {
        this.instruction = instruction;
    }

    /**
     * 提示词中的语言指令
     */
    public String getInstruction() {
        return instruction;
    }

    public static ThinkingLanguage detect(String text) {
        if (text == null || text.isEmpty()) {
            return ENGLISH;
        }
        return text.codePoints().anyMatch(ThinkingLanguage::isCjk) ? CHINESE : ENGLISH;
    }

    private static boolean isCjk(int codePoint) {
        return (codePoint >= 0x4E00 && codePoint <= 0x9FFF)      // CJK 统一表意文字
                || (codePoint >= 0x3400 && codePoint <= 0x4DBF)  // 扩展 A
                || (codePoint >= 0x3040 && codePoint <= 0x30FF)  // 平假名、片假名
                || (codePoint >= 0xF900 && codePoint <= 0xFAFF); // 兼容表意文字
    }
}
