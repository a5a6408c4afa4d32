package com.mysteryhub.gameservice.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 会话过期清理的定时线程池（单线程即可），与扇出线程池分开，互不影响。
 */
@Configuration
public class SweepSchedulerConfig {

    @Bean(name = "sessionSweepScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor sessionSweepScheduler() {
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "session-sweep");
            // 非业务线程，允许JVM优雅退出时不用等它
            t.setDaemon(true);
            return t;
        }, new ThreadPoolExecutor.DiscardPolicy());
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }
}
