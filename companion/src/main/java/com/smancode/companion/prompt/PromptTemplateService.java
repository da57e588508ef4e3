package com.smancode.companion.prompt;

import com.smancode.companion.util.StackTraceUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 提示词模板服务
 * <p>
 * 从 classpath 的 prompts 目录加载默认模板并缓存，支持 {{VARIABLE_NAME}} 变量替换。
 * 用户覆盖只保存在内存中，重置后回到默认模板。
 */
@Service
public class PromptTemplateService {

    private static final Logger logger = LoggerFactory.getLogger(PromptTemplateService.class);

    /**
     * 提示词基础路径
     */
    private static final String PROMPTS_BASE_PATH = "prompts/";

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{([A-Z0-9_]+)}}");

    /**
     * 默认模板缓存
     */
    private final Map<PromptKey, String> defaultCache = new ConcurrentHashMap<>();

    /**
     * 用户覆盖的模板
     */
    private final Map<PromptKey, String> userTemplates = new ConcurrentHashMap<>();

    /**
     * 获取模板（用户覆盖优先）
     */
    public String getTemplate(PromptKey key) {
        String userTemplate = userTemplates.get(key);
        if (userTemplate != null) {
            return userTemplate;
        }
        return getDefaultTemplate(key);
    }

    /**
     * 获取默认模板（带缓存）
     */
    public String getDefaultTemplate(PromptKey key) {
        return defaultCache.computeIfAbsent(key, this::loadFromClasspath);
    }

    /**
     * 获取模板并替换变量
     * <p>
     * 值为 null 的变量替换为空串；模板中未提供的变量保持原样。
     *
     * @param key       模板键
     * @param variables 变量映射
     * @return 替换后的提示词
     */
    public String render(PromptKey key, Map<String, String> variables) {
        return replaceVariables(getTemplate(key), variables);
    }

    /**
     * 覆盖模板
     */
    public void updateTemplate(PromptKey key, String template) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("模板内容不能为空: " + key);
        }
        userTemplates.put(key, template);
        logger.info("提示词模板已覆盖: key={}, length={}", key, template.length());
    }

    /**
     * 恢复单个模板为默认
     */
    public void resetTemplate(PromptKey key) {
        if (userTemplates.remove(key) != null) {
            logger.info("提示词模板已恢复默认: key={}", key);
        }
    }

    /**
     * 恢复全部模板为默认
     */
    public void resetAll() {
        userTemplates.clear();
        logger.info("全部提示词模板已恢复默认");
    }

    public boolean isCustomized(PromptKey key) {
        return userTemplates.containsKey(key);
    }

    /**
     * 列出所有模板
     */
    public List<PromptTemplateView> listTemplates() {
        List<PromptTemplateView> views = new ArrayList<>();
        for (PromptKey key : PromptKey.values()) {
            views.add(view(key));
        }
        return views;
    }

    public PromptTemplateView view(PromptKey key) {
        return new PromptTemplateView(
                key.name(),
                key.getDisplayName(),
                key.getDescription(),
                getTemplate(key),
                isCustomized(key));
    }

    private String loadFromClasspath(PromptKey key) {
        ClassPathResource resource = new ClassPathResource(PROMPTS_BASE_PATH + key.getPath());
        try (InputStream in = resource.getInputStream()) {
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            logger.debug("加载提示词: {}, 长度: {} 字符", key.getPath(), content.length());
            return content;
        } catch (IOException e) {
            logger.error("加载提示词失败: {}, {}", key.getPath(), StackTraceUtils.formatStackTrace(e));
            throw new IllegalStateException("加载提示词失败: " + key.getPath(), e);
        }
    }

    /**
     * 单次扫描替换占位符，替换进来的值不会再被展开；未提供的变量保留原样
     */
    private String replaceVariables(String template, Map<String, String> variables) {
        if (variables == null || variables.isEmpty()) {
            return template;
        }

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        return matcher.replaceAll(match -> {
            String name = match.group(1);
            if (!variables.containsKey(name)) {
                return Matcher.quoteReplacement(match.group());
            }
            String value = variables.get(name);
            return Matcher.quoteReplacement(value != null ? value : "");
        });
    }
}
