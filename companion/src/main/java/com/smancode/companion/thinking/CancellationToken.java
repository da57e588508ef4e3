package com.smancode.companion.thinking;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消令牌
 * <p>
 * 由会话持有，显式传入每一个可能挂起的调用点。取消只会发生一次，
 * 之后所有轮询方都会观察到 {@code isCancelled() == true}。
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * 请求取消
     *
     * @return 只有真正把令牌从未取消翻转为已取消的那一次调用返回 true
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + '}';
    }
}
