package com.smancode.companion.llm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * LLM 端点池配置
 */
@Component
@ConfigurationProperties(prefix = "llm.pool")
public class LlmPoolConfig {

    /**
     * 端点列表，为空时思考内容全部来自模板
     */
    private List<LlmEndpoint> endpoints = new ArrayList<>();

    /**
     * 失败端点的冷却时间（毫秒），冷却期内轮询会跳过它
     */
    private long cooldownMs = 30000;

    /**
     * Round-Robin 轮询索引
     */
    private final AtomicInteger roundRobinIndex = new AtomicInteger(0);

    public List<LlmEndpoint> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(List<LlmEndpoint> endpoints) {
        this.endpoints = endpoints;
    }

    public long getCooldownMs() {
        return cooldownMs;
    }

    public void setCooldownMs(long cooldownMs) {
        this.cooldownMs = cooldownMs;
    }

    /**
     * 获取下一个可用端点（Round-Robin + 故障过滤）
     *
     * @return 可用端点，全部不可用时返回 null
     */
    public LlmEndpoint getNextAvailableEndpoint() {
        List<LlmEndpoint> enabledEndpoints = getEnabledEndpoints();
        if (enabledEndpoints.isEmpty()) {
            return null;
        }

        int totalEndpoints = enabledEndpoints.size();
        for (int attempts = 0; attempts < totalEndpoints; attempts++) {
            int index = Math.floorMod(roundRobinIndex.getAndIncrement(), totalEndpoints);
            LlmEndpoint endpoint = enabledEndpoints.get(index);

            if (endpoint.isAvailable()) {
                return endpoint;
            }

            // 冷却期已过，重新放行
            if (endpoint.isCooldownOver(cooldownMs)) {
                endpoint.markSuccess();
                return endpoint;
            }
        }

        return null;
    }

    /**
     * 获取所有启用的端点
     */
    public List<LlmEndpoint> getEnabledEndpoints() {
        return endpoints.stream()
                .filter(LlmEndpoint::isEnabled)
                .toList();
    }

    public boolean hasEnabledEndpoints() {
        return !getEnabledEndpoints().isEmpty();
    }
}
