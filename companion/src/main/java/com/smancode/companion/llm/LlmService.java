package com.smancode.companion.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smancode.companion.llm.config.LlmEndpoint;
import com.smancode.companion.llm.config.LlmPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM 调用服务（OpenAI 兼容 /chat/completions）
 * <p>
 * 功能：
 * 1. 端点池轮询（Round-Robin）
 * 2. 失败端点冷却
 * 3. 只发起单次调用，不重试：调用方（思考生成器）自带降级链
 */
@Service
public class LlmService {

    private static final Logger logger = LoggerFactory.getLogger(LlmService.class);

    private final LlmPoolConfig poolConfig;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 按端点缓存的 RestTemplate（各端点超时不同）
     */
    private final Map<LlmEndpoint, RestTemplate> restTemplates = new ConcurrentHashMap<>();

    /**
     * 测试注入的 RestTemplate，非空时所有端点共用
     */
    private final RestTemplate fixedRestTemplate;

    @Autowired
    public LlmService(LlmPoolConfig poolConfig) {
        this(poolConfig, null);
    }

    LlmService(LlmPoolConfig poolConfig, RestTemplate fixedRestTemplate) {
        this.poolConfig = poolConfig;
        this.fixedRestTemplate = fixedRestTemplate;
    }

    /**
     * 是否配置了可用端点
     */
    public boolean isConfigured() {
        return poolConfig.hasEnabledEndpoints();
    }

    /**
     * 单次文本请求（不重试）
     *
     * @param systemPrompt 系统提示词，可为 null
     * @param userPrompt   用户提示词
     * @return LLM 响应文本
     * @throws LlmException 没有可用端点或调用失败
     */
    public String requestOnce(String systemPrompt, String userPrompt) {
        LlmEndpoint endpoint = poolConfig.getNextAvailableEndpoint();
        if (endpoint == null) {
            throw new LlmException("没有可用的 LLM 端点");
        }

        long startTime = System.currentTimeMillis();
        try {
            if (systemPrompt != null && !systemPrompt.isEmpty()) {
                logger.debug("=== System Prompt:\n{}", systemPrompt);
            }
            logger.debug("=== User Prompt:\n{}", userPrompt);

            String rawApiResponse = callInternalForRawResponse(endpoint, systemPrompt, userPrompt);
            logger.debug("=== LLM 响应:\n{}", rawApiResponse);

            String content = extractContent(rawApiResponse);
            logTokensUsage(rawApiResponse, startTime);

            endpoint.markSuccess();
            return content;

        } catch (LlmException e) {
            endpoint.markFailed();
            logger.warn("端点调用失败: {}, 错误: {}", endpoint.getBaseUrl(), e.getMessage());
            throw e;
        }
    }

    /**
     * 打印 tokens 使用情况
     */
    private void logTokensUsage(String rawApiResponse, long startTime) {
        try {
            JsonNode usage = objectMapper.readTree(rawApiResponse).path("usage");
            if (!usage.isMissingNode() && usage.isObject()) {
                long elapsedTime = System.currentTimeMillis() - startTime;
                logger.debug("LLM 响应: 发送tokens={}, 接收tokens={}, 耗时{}ms",
                        usage.path("prompt_tokens").asInt(),
                        usage.path("completion_tokens").asInt(),
                        elapsedTime);
            }
        } catch (Exception e) {
            // tokens 统计只用于日志
            logger.trace("无法解析 tokens 信息: {}", e.getMessage());
        }
    }

    /**
     * 内部调用实现（返回原始 API 响应）
     */
    private String callInternalForRawResponse(LlmEndpoint endpoint, String systemPrompt, String userPrompt) {
        try {
            Map<String, Object> requestBody = buildRequestBody(endpoint, systemPrompt, userPrompt);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            if (endpoint.getApiKey() != null && !endpoint.getApiKey().isEmpty()) {
                headers.setBearerAuth(endpoint.getApiKey());
            }

            HttpEntity<Map<String, Object>> entity = new HttpEntity<>(requestBody, headers);

            ResponseEntity<String> response = restTemplateFor(endpoint).exchange(
                    endpoint.getBaseUrl() + "/chat/completions",
                    HttpMethod.POST,
                    entity,
                    String.class
            );

            if (response.getStatusCode().isError()) {
                throw new LlmException("HTTP 错误: " + response.getStatusCode());
            }
            if (response.getBody() == null || response.getBody().isEmpty()) {
                throw new LlmException("LLM 返回空响应");
            }
            return response.getBody();

        } catch (ResourceAccessException e) {
            throw new LlmException("请求超时或网络错误: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new LlmException("LLM 调用失败: " + e.getMessage(), e);
        }
    }

    private RestTemplate restTemplateFor(LlmEndpoint endpoint) {
        if (fixedRestTemplate != null) {
            return fixedRestTemplate;
        }
        return restTemplates.computeIfAbsent(endpoint, e -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout((int) Math.min(e.getTimeout(), Integer.MAX_VALUE));
            factory.setReadTimeout((int) Math.min(e.getTimeout(), Integer.MAX_VALUE));
            return new RestTemplate(factory);
        });
    }

    /**
     * 构建 LLM 请求体
     */
    Map<String, Object> buildRequestBody(LlmEndpoint endpoint, String systemPrompt, String userPrompt) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", endpoint.getModel());
        body.put("max_tokens", endpoint.getMaxTokens());
        body.put("temperature", endpoint.getTemperature());
        body.put("stream", false);

        List<Map<String, String>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", userPrompt));
        body.put("messages", messages);

        return body;
    }

    /**
     * 从 LLM 响应中提取内容
     * <p>
     * 依次尝试 OpenAI 格式（choices[0].message.content）、Ollama 原生格式（message.content）
     * 和直接的 content 字段。响应不是 JSON 时按纯文本返回。
     *
     * @throws LlmException JSON 中找不到文本内容（如 content 为 null 或是错误对象），或内容为空
     */
    String extractContent(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            logger.debug("响应不是 JSON 格式，按纯文本处理: {}", e.getOriginalMessage());
            return responseBody;
        }

        JsonNode contentNode = locateContent(root);
        if (contentNode == null || !contentNode.isTextual()) {
            throw new LlmException("LLM 响应中没有可用内容: " + abbreviate(responseBody));
        }
        String content = contentNode.asText();
        if (content.isBlank()) {
            throw new LlmException("LLM 返回空内容");
        }
        return content;
    }

    private JsonNode locateContent(JsonNode root) {
        JsonNode choicesNode = root.path("choices");
        if (choicesNode.isArray() && choicesNode.size() > 0) {
            return choicesNode.get(0).path("message").get("content");
        }
        JsonNode messageNode = root.path("message");
        if (messageNode.has("content")) {
            return messageNode.get("content");
        }
        return root.get("content");
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
