package com.smancode.companion.controller;

import com.smancode.companion.prompt.PromptKey;
import com.smancode.companion.prompt.PromptTemplateService;
import com.smancode.companion.prompt.PromptTemplateView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 提示词模板管理 API
 */
@RestController
@RequestMapping("/api/prompts")
@CrossOrigin(origins = "*")
public class PromptController {

    private final PromptTemplateService promptTemplateService;

    public PromptController(PromptTemplateService promptTemplateService) {
        this.promptTemplateService = promptTemplateService;
    }

    @GetMapping
    public ResponseEntity<List<PromptTemplateView>> list() {
        return ResponseEntity.ok(promptTemplateService.listTemplates());
    }

    @GetMapping("/{key}")
    public ResponseEntity<PromptTemplateView> get(@PathVariable String key) {
        PromptKey promptKey = PromptKey.fromName(key);
        if (promptKey == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(promptTemplateService.view(promptKey));
    }

    /**
     * 覆盖模板，请求体 {"template": "..."}
     */
    @PutMapping("/{key}")
    public ResponseEntity<?> update(@PathVariable String key, @RequestBody Map<String, String> request) {
        PromptKey promptKey = PromptKey.fromName(key);
        if (promptKey == null) {
            return ResponseEntity.notFound().build();
        }
        try {
            promptTemplateService.updateTemplate(promptKey, request.get("template"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(promptTemplateService.view(promptKey));
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<PromptTemplateView> reset(@PathVariable String key) {
        PromptKey promptKey = PromptKey.fromName(key);
        if (promptKey == null) {
            return ResponseEntity.notFound().build();
        }
        promptTemplateService.resetTemplate(promptKey);
        return ResponseEntity.ok(promptTemplateService.view(promptKey));
    }

    @DeleteMapping
    public ResponseEntity<Void> resetAll() {
        promptTemplateService.resetAll();
        return ResponseEntity.noContent().build();
    }
}
