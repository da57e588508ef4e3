package com.smancode.companion.thinking;

import java.util.Random;

/**
 * 可中断延时
 * <p>
 * 引擎中唯一的"等待"原语：按固定时间片轮询取消令牌，
 * 令牌一旦被取消，最多一个时间片后返回。
 */
public class InterruptibleDelay {

    /**
     * 默认轮询时间片（毫秒）
     */
    public static final long DEFAULT_QUANTUM_MS = 50;

    private final long quantumMs;

    public InterruptibleDelay() {
        this(DEFAULT_QUANTUM_MS);
    }

    public InterruptibleDelay(long quantumMs) {
        if (quantumMs <= 0) {
            throw new IllegalArgumentException("轮询时间片必须大于 0: " + quantumMs);
        }
        this.quantumMs = quantumMs;
    }

    /**
     * 休眠指定时长，期间按时间片检查取消令牌
     *
     * @param durationMs 休眠时长（毫秒），小于等于 0 时立即返回
     * @param token      取消令牌
     * @return 完整睡满返回 true；因取消或线程中断提前返回 false
     */
    public boolean delay(long durationMs, CancellationToken token) {
        if (token.isCancelled()) {
            return false;
        }
        if (durationMs <= 0) {
            return true;
        }

        long deadline = System.nanoTime() + durationMs * 1_000_000L;
        while (true) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return !token.isCancelled();
            }
            try {
                Thread.sleep(Math.min(quantumMs, remainingMs));
            } catch (InterruptedException e) {
                // 中断视为本次等待被取消，保留中断标记交给上层
                Thread.currentThread().interrupt();
                return false;
            }
            if (token.isCancelled()) {
                return false;
            }
        }
    }

    /**
     * 在 [minMs, maxMs] 区间内取随机时长
     */
    public static long randomBetween(Random random, long minMs, long maxMs) {
        if (maxMs <= minMs) {
            return Math.max(0, minMs);
        }
        return minMs + (long) (random.nextDouble() * (maxMs - minMs + 1));
    }

    public long getQuantumMs() {
        return quantumMs;
    }
}
