package com.mysteryhub.gameservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 事件扇出线程池：负责把每个连接的发件箱排空。
 * 与业务线程分开，某个连接写得慢只占用一个扇出线程，不会拖住会话互斥区。
 */
@Configuration
public class FanoutExecutorConfig {

    @Value("${mysteryhub.fanout.pool-size:4}")
    private int poolSize;

    @Bean(name = "fanoutExecutor", destroyMethod = "shutdown")
    public ExecutorService fanoutExecutor() {
        int size = Math.max(1, poolSize);
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "fanout-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), tf);
    }

    /**
     * 归档线程池：单线程顺序写 Redis，保证同一会话的归档按提交顺序落盘。
     * 队列满时直接拒绝（由提交方记 WARN），不丢弃已排队的任务，以免删掉驱逐时的删除任务。
     */
    @Bean(name = "archiveExecutor", destroyMethod = "shutdown")
    public ExecutorService archiveExecutor() {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "session-archive");
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10_000), tf, new ThreadPoolExecutor.AbortPolicy());
    }
}
