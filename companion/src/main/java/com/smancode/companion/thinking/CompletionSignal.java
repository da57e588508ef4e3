package com.smancode.companion.thinking;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 会话完成信号
 * <p>
 * 一次性广播：随会话创建，只能由所属的会话循环解决一次。
 * 外部调用方只能等待或注册回调，无法提前完成它。
 */
public final class CompletionSignal {

    private final String sessionId;

    private final CompletableFuture<Void> future = new CompletableFuture<>();

    CompletionSignal(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * 解决信号，仅第一次调用生效
     *
     * @return 本次调用是否真正完成了信号
     */
    boolean resolve() {
        return future.complete(null);
    }

    public String getSessionId() {
        return sessionId;
    }

    public boolean isResolved() {
        return future.isDone();
    }

    /**
     * 等待信号解决
     *
     * @param timeout 最长等待时间
     * @return 在超时前解决返回 true
     */
    public boolean await(Duration timeout) throws InterruptedException {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // resolve() 只会以 null 正常完成
            throw new IllegalStateException("完成信号异常完成: " + sessionId, e.getCause());
        }
    }

    /**
     * 返回一个依赖于本信号的 Future，调用方完成或取消它不影响本信号
     */
    public CompletableFuture<Void> toCompletableFuture() {
        return future.copy();
    }

    /**
     * 信号解决后执行回调（已解决则立即执行）
     */
    public void whenResolved(Runnable callback) {
        future.thenRun(callback);
    }

    @Override
    public String toString() {
        return "CompletionSignal{sessionId='" + sessionId + "', resolved=" + isResolved() + '}';
    }
}
