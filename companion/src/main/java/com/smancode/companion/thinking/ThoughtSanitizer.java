package com.smancode.companion.thinking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 生成内容后处理
 * <p>
 * 只取第一行非空文本，去掉列表符号、Markdown 标记和外围引号，折叠空白，
 * 超长时截断。处理后为空则视为生成失败。
 */
public class ThoughtSanitizer {

    private static final String ELLIPSIS = "...";

    /**
     * 列表符号与编号："- "、"* "、"• "、"1. "、"2) "、"（3）"
     */
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•·]+\\s*|\\(?（?\\d{1,2}[.)）、](?!\\d)\\s*)");

    /**
     * 标题与引用标记
     */
    private static final Pattern HEADING_MARKER = Pattern.compile("^(?:#{1,6}|>)\\s*");

    /**
     * 强调与行内代码标记
     */
    private static final Pattern EMPHASIS = Pattern.compile("\\*\\*|__|`+|~~");

    /**
     * "Thought:"、"思考：" 之类的前缀
     */
    private static final Pattern LABEL_PREFIX = Pattern.compile("^(?i:thinking|thought|思考)\\s*[:：]\\s*");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String OPENING_QUOTES = "\"'“‘「『《";

    private static final String CLOSING_QUOTES = "\"'”’」』》";

    private final int maxLength;

    public ThoughtSanitizer(int maxLength) {
        if (maxLength <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("最大长度过小: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    /**
     * 处理单条生成结果
     *
     * @throws ThoughtGenerationException 处理后为空
     */
    public String sanitize(String raw) {
        if (raw == null) {
            throw new ThoughtGenerationException("生成结果为 null");
        }
        for (String line : raw.split("\\R")) {
            String cleaned = cleanLine(line);
            if (!cleaned.isEmpty()) {
                return truncate(cleaned);
            }
        }
        throw new ThoughtGenerationException("生成结果处理后为空");
    }

    /**
     * 处理多行生成结果（初始批次），逐行清理并丢弃空行
     */
    public List<String> sanitizeLines(String raw) {
        List<String> lines = new ArrayList<>();
        if (raw == null) {
            return lines;
        }
        for (String line : raw.split("\\R")) {
            String cleaned = cleanLine(line);
            if (!cleaned.isEmpty()) {
                lines.add(truncate(cleaned));
            }
        }
        return lines;
    }

    private String cleanLine(String line) {
        String text = line.strip();
        text = HEADING_MARKER.matcher(text).replaceFirst("");
        text = LIST_MARKER.matcher(text).replaceFirst("");
        text = EMPHASIS.matcher(text).replaceAll("");
        text = LABEL_PREFIX.matcher(text.strip()).replaceFirst("");
        text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        return stripQuotes(text);
    }

    private String stripQuotes(String text) {
        String result = text;
        while (result.length() >= 2) {
            int open = OPENING_QUOTES.indexOf(result.charAt(0));
            int close = CLOSING_QUOTES.indexOf(result.charAt(result.length() - 1));
            if (open < 0 || close < 0) {
                break;
            }
            result = result.substring(1, result.length() - 1).strip();
        }
        return result;
    }

    private String truncate(String text) {
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        int end = text.offsetByCodePoints(0, maxLength - ELLIPSIS.length());
        return text.substring(0, end).stripTrailing() + ELLIPSIS;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
