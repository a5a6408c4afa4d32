package com.mysteryhub.gameservice.platform.ws;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket + STOMP 配置类
 * ----------------------------------------
 * 客户端通过 /ws 端点连接，CONNECT 时带上 sessionId / playerId 两个 header。
 *
 * 用途：
 *   - /app/game.* : 客户端发送指令（如 /app/game.chat）
 *   - /user/queue/game.events : 服务端推送给本人的会话事件
 *   - /user/queue/game.errors : 本人指令失败的错误通知
 *   - /user/queue/game.replies : 搜证结果回执
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final PlayerHandshakeInterceptor handshakeInterceptor;

    public WebSocketStompConfig(PlayerHandshakeInterceptor handshakeInterceptor) {
        this.handshakeInterceptor = handshakeInterceptor;
    }

    /**
     * 心跳用 TaskScheduler；使用不同的 bean 名称避免与 Spring 自动配置冲突。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 注册 WebSocket STOMP 端点
     * ----------------------------------------
     * 前端连接地址：
     *   ws://localhost:8080/ws
     *   或 SockJS 备用: http://localhost:8080/ws
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*"); // 开发时用 *，生产建议限制域名
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }

    /**
     * 配置消息代理路由规则
     *   - 只开放 /queue（所有推送都是点对点，按连接各自排队）
     *   - setHeartbeatValue(): [客户端发送间隔, 服务端发送间隔]（毫秒）
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/queue")
                .setHeartbeatValue(new long[]{10000, 10000})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    /**
     * 入站通道拦截器：CONNECT 时校验玩家身份
     */
    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(handshakeInterceptor);
    }
}
