package com.mysteryhub.gameservice.games.mystery.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 会话过期清理
 * ----------------------------------------
 * 应用启动后按固定间隔调用 {@link SessionRegistry#sweep}：
 *  - 无人在线且空闲超过 idle-ttl 的会话；
 *  - 已结束且空闲超过 finished-ttl 的会话。
 * 被移除会话的连接与归档由注册表的移除回调负责清理。
 */
@Slf4j
@Component
public class SessionExpiryJob {

    private final SessionRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    @Value("${mysteryhub.session.idle-ttl:PT30M}")
    private Duration idleTtl;

    @Value("${mysteryhub.session.finished-ttl:PT10M}")
    private Duration finishedTtl;

    @Value("${mysteryhub.session.sweep-interval:PT1M}")
    private Duration sweepInterval;

    public SessionExpiryJob(SessionRegistry registry,
                            @Qualifier("sessionSweepScheduler") ScheduledExecutorService scheduler,
                            Clock clock) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        long period = Math.max(1000L, sweepInterval.toMillis());
        scheduler.scheduleAtFixedRate(this::sweepOnce, period, period, TimeUnit.MILLISECONDS);
        log.info("会话过期清理已启动: interval={}, idleTtl={}, finishedTtl={}", sweepInterval, idleTtl, finishedTtl);
    }

    /**
     * 执行一次清理；异常只记录，保证定时任务继续运行
     */
    public List<String> sweepOnce() {
        try {
            List<String> expired = registry.sweep(clock.instant(), idleTtl, finishedTtl);
            if (!expired.isEmpty()) {
                log.info("清理过期会话: count={}, ids={}, remaining={}", expired.size(), expired, registry.size());
            }
            return expired;
        } catch (RuntimeException e) {
            log.warn("会话过期清理失败", e);
            return List.of();
        }
    }
}
