package com.smancode.companion.prompt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PromptTemplateService 测试
 */
class PromptTemplateServiceTest {

    private PromptTemplateService service;

    @BeforeEach
    void setUp() {
        service = new PromptTemplateService();
    }

    @Test
    @DisplayName("所有默认模板都能从 classpath 加载")
    void testDefaultTemplates_LoadFromClasspath() {
        for (PromptKey key : PromptKey.values()) {
            String template = service.getDefaultTemplate(key);
            assertFalse(template.isBlank(), key.name());
            assertTrue(template.contains("{{USER_MESSAGE}}"), key.name());
            assertTrue(template.contains("{{LANGUAGE_INSTRUCTION}}"), key.name());
        }
    }

    @Test
    void testRender_ReplacesVariables() {
        Map<String, String> variables = new HashMap<>();
        variables.put("USER_MESSAGE", "How do I rotate keys?");
        variables.put("LANGUAGE_INSTRUCTION", "Respond in English.");
        variables.put("CONTEXT_PART", null);
        variables.put("THINKING_PROGRESS_SUMMARY", "");

        String prompt = service.render(PromptKey.CONTEXTUAL_THINKING, variables);

        assertTrue(prompt.startsWith("User asked: \"How do I rotate keys?\"."));
        assertTrue(prompt.contains("Respond in English."));
        assertFalse(prompt.contains("{{"));
    }

    @Test
    @DisplayName("变量值中的占位符和特殊字符原样保留，不会被再次展开")
    void testRender_DoesNotExpandPlaceholdersInsideValues() {
        service.updateTemplate(PromptKey.SIMPLE_CONTINUATION,
                "Q: {{USER_MESSAGE}} | C: {{CONTEXT_PART}} | S: {{THINKING_PROGRESS_SUMMARY}} | {{UNKNOWN}}");
        Map<String, String> variables = new HashMap<>();
        variables.put("USER_MESSAGE", "what does {{CONTEXT_PART}} or {{THINKING_PROGRESS_SUMMARY}} cost in $1 \\ ?");
        variables.put("CONTEXT_PART", "ctx");
        variables.put("THINKING_PROGRESS_SUMMARY", "summary");

        String prompt = service.render(PromptKey.SIMPLE_CONTINUATION, variables);

        assertEquals("Q: what does {{CONTEXT_PART}} or {{THINKING_PROGRESS_SUMMARY}} cost in $1 \\ ?"
                + " | C: ctx | S: summary | {{UNKNOWN}}", prompt);
        service.resetTemplate(PromptKey.SIMPLE_CONTINUATION);
    }

    @Test
    @DisplayName("覆盖模板优先，重置后恢复默认")
    void testUpdateAndReset() {
        String original = service.getTemplate(PromptKey.SIMPLE_CONTINUATION);

        service.updateTemplate(PromptKey.SIMPLE_CONTINUATION, "Say something about {{USER_MESSAGE}}");
        assertTrue(service.isCustomized(PromptKey.SIMPLE_CONTINUATION));
        assertEquals("Say something about caches",
                service.render(PromptKey.SIMPLE_CONTINUATION, Map.of("USER_MESSAGE", "caches")));

        service.resetTemplate(PromptKey.SIMPLE_CONTINUATION);
        assertFalse(service.isCustomized(PromptKey.SIMPLE_CONTINUATION));
        assertEquals(original, service.getTemplate(PromptKey.SIMPLE_CONTINUATION));
    }

    @Test
    void testResetAll() {
        service.updateTemplate(PromptKey.QUESTION_ANALYSIS, "a");
        service.updateTemplate(PromptKey.SYNTHESIS_THINKING, "b");

        service.resetAll();

        assertTrue(service.listTemplates().stream().noneMatch(PromptTemplateView::customized));
    }

    @Test
    void testUpdate_RejectsBlankTemplate() {
        assertThrows(IllegalArgumentException.class, () -> service.updateTemplate(PromptKey.QUESTION_ANALYSIS, " "));
        assertThrows(IllegalArgumentException.class, () -> service.updateTemplate(PromptKey.QUESTION_ANALYSIS, null));
    }

    @Test
    void testListTemplates_CoversEveryKey() {
        List<PromptTemplateView> views = service.listTemplates();

        assertEquals(PromptKey.values().length, views.size());
        assertEquals("THINKING_GENERATION", views.get(0).key());
    }

    @Test
    void testFromName() {
        assertEquals(PromptKey.SIMPLE_CONTINUATION, PromptKey.fromName("simple-continuation"));
        assertEquals(PromptKey.QUESTION_ANALYSIS, PromptKey.fromName("QUESTION_ANALYSIS"));
        assertNull(PromptKey.fromName("unknown"));
        assertNull(PromptKey.fromName(null));
    }
}
