package com.mysteryhub.gameservice.games.mystery.config;

import com.mysteryhub.gameservice.games.mystery.service.SessionPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 会话引擎配置：策略参数与时钟
 */
@Configuration
public class MysterySessionConfig {

    @Bean
    public SessionPolicy sessionPolicy(
            @Value("${mysteryhub.session.release-character-on-disconnect:false}") boolean releaseOnDisconnect,
            @Value("${mysteryhub.chat.max-length:500}") int chatMaxLength,
            @Value("${mysteryhub.chat.history-size:50}") int chatHistorySize) {
        return new SessionPolicy(releaseOnDisconnect, chatMaxLength, chatHistorySize);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
