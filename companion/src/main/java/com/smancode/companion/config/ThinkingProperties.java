package com.smancode.companion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 思考模拟引擎配置
 */
@Component
@ConfigurationProperties(prefix = "companion.thinking")
public class ThinkingProperties {

    /**
     * 可中断延时的轮询时间片（毫秒）
     */
    private long pollQuantumMs = 50;

    /**
     * 逐字输出的字符间隔下限（毫秒）
     */
    private long typingDelayMinMs = 15;

    /**
     * 逐字输出的字符间隔上限（毫秒）
     */
    private long typingDelayMaxMs = 45;

    /**
     * 初始阶段两条思考之间的停顿下限（毫秒）
     */
    private long initialPauseMinMs = 400;

    /**
     * 初始阶段两条思考之间的停顿上限（毫秒）
     */
    private long initialPauseMaxMs = 800;

    /**
     * 持续阶段两条思考之间的间隔下限（毫秒）
     */
    private long continuousDelayMinMs = 2000;

    /**
     * 持续阶段两条思考之间的间隔上限（毫秒）
     */
    private long continuousDelayMaxMs = 5000;

    /**
     * 单条生成内容的最大长度（字符）
     */
    private int maxThoughtLength = 200;

    /**
     * 初始批次最少条数
     */
    private int initialBatchMinSize = 3;

    /**
     * 初始批次最多条数
     */
    private int initialBatchMaxSize = 5;

    /**
     * 从第几条思考开始在提示词中附带已有思考摘要
     */
    private int summaryAfterThoughts = 3;

    /**
     * 摘要中最多包含的最近思考条数
     */
    private int summaryThoughtCount = 3;

    /**
     * 是否调用外部服务生成思考（关闭时只使用模板）
     */
    private boolean generationEnabled = true;

    /**
     * 停机时等待活跃会话结束的最长时间（毫秒）
     */
    private long shutdownAwaitMs = 2000;

    public long getPollQuantumMs() {
        return pollQuantumMs;
    }

    public void setPollQuantumMs(long pollQuantumMs) {
        this.pollQuantumMs = pollQuantumMs;
    }

    public long getTypingDelayMinMs() {
        return typingDelayMinMs;
    }

    public void setTypingDelayMinMs(long typingDelayMinMs) {
        this.typingDelayMinMs = typingDelayMinMs;
    }

    public long getTypingDelayMaxMs() {
        return typingDelayMaxMs;
    }

    public void setTypingDelayMaxMs(long typingDelayMaxMs) {
        this.typingDelayMaxMs = typingDelayMaxMs;
    }

    public long getInitialPauseMinMs() {
        return initialPauseMinMs;
    }

    public void setInitialPauseMinMs(long initialPauseMinMs) {
        this.initialPauseMinMs = initialPauseMinMs;
    }

    public long getInitialPauseMaxMs() {
        return initialPauseMaxMs;
    }

    public void setInitialPauseMaxMs(long initialPauseMaxMs) {
        this.initialPauseMaxMs = initialPauseMaxMs;
    }

    public long getContinuousDelayMinMs() {
        return continuousDelayMinMs;
    }

    public void setContinuousDelayMinMs(long continuousDelayMinMs) {
        this.continuousDelayMinMs = continuousDelayMinMs;
    }

    public long getContinuousDelayMaxMs() {
        return continuousDelayMaxMs;
    }

    public void setContinuousDelayMaxMs(long continuousDelayMaxMs) {
        this.continuousDelayMaxMs = continuousDelayMaxMs;
    }

    public int getMaxThoughtLength() {
        return maxThoughtLength;
    }

    public void setMaxThoughtLength(int maxThoughtLength) {
        this.maxThoughtLength = maxThoughtLength;
    }

    public int getInitialBatchMinSize() {
        return initialBatchMinSize;
    }

    public void setInitialBatchMinSize(int initialBatchMinSize) {
        this.initialBatchMinSize = initialBatchMinSize;
    }

    public int getInitialBatchMaxSize() {
        return initialBatchMaxSize;
    }

    public void setInitialBatchMaxSize(int initialBatchMaxSize) {
        this.initialBatchMaxSize = initialBatchMaxSize;
    }

    public int getSummaryAfterThoughts() {
        return summaryAfterThoughts;
    }

    public void setSummaryAfterThoughts(int summaryAfterThoughts) {
        this.summaryAfterThoughts = summaryAfterThoughts;
    }

    public int getSummaryThoughtCount() {
        return summaryThoughtCount;
    }

    public void setSummaryThoughtCount(int summaryThoughtCount) {
        this.summaryThoughtCount = summaryThoughtCount;
    }

    public boolean isGenerationEnabled() {
        return generationEnabled;
    }

    public void setGenerationEnabled(boolean generationEnabled) {
        this.generationEnabled = generationEnabled;
    }

    public long getShutdownAwaitMs() {
        return shutdownAwaitMs;
    }

    public void setShutdownAwaitMs(long shutdownAwaitMs) {
        this.shutdownAwaitMs = shutdownAwaitMs;
    }
}
