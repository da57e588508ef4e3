package com.smancode.companion.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置
 * <p>
 * 思考线程池：固定大小，满了就拒绝，每个思考会话独占一个线程
 */
@Configuration
public class ThreadPoolConfig {

    private static final Logger logger = LoggerFactory.getLogger(ThreadPoolConfig.class);

    @Value("${thinking.thread-pool.core-size:2}")
    private int thinkingCoreSize;

    @Value("${thinking.thread-pool.max-size:4}")
    private int thinkingMaxSize;

    @Value("${thinking.thread-pool.queue-capacity:0}")
    private int thinkingQueueCapacity;

    @Bean(name = "thinkingExecutorService", destroyMethod = "shutdown")
    public ExecutorService thinkingExecutorService() {
        logger.info("初始化思考线程池: coreSize={}, maxSize={}, queueCapacity={}",
                thinkingCoreSize, thinkingMaxSize, thinkingQueueCapacity);
        return newPool("thinking", thinkingCoreSize, thinkingMaxSize, thinkingQueueCapacity);
    }

    private static ExecutorService newPool(String prefix, int coreSize, int maxSize, int queueCapacity) {
        BlockingQueue<Runnable> queue = queueCapacity > 0
                ? new LinkedBlockingQueue<>(queueCapacity)
                : new SynchronousQueue<>();

        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                Math.max(coreSize, maxSize),
                60L, TimeUnit.SECONDS,
                queue,
                namedThreads(prefix),
                new ThreadPoolExecutor.AbortPolicy()  // 满了就拒绝
        );

        // 允许核心线程超时，便于停机
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
