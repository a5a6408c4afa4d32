package com.mysteryhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

/**
 * WebSocket 断连工具类（连接被顶替、会话移除、写失败时使用）。
 */
@Slf4j
@Component
public class WebSocketDisconnectHelper {

    /** 客户端入站消息通道，用于强制断开连接 */
    private final MessageChannel clientInboundChannel;

    public WebSocketDisconnectHelper(@Qualifier("clientInboundChannel") MessageChannel clientInboundChannel) {
        this.clientInboundChannel = clientInboundChannel;
    }

    /**
     * 强制断开 WebSocket 连接。
     *
     * @param connectionId STOMP 会话ID（simpSessionId）
     */
    public void forceDisconnect(String connectionId) {
        try {
            // 发送 DISCONNECT 命令到客户端入站通道，触发框架断开连接
            StompHeaderAccessor header = StompHeaderAccessor.create(StompCommand.DISCONNECT);
            header.setSessionId(connectionId);
            header.setLeaveMutable(true);
            clientInboundChannel.send(MessageBuilder.createMessage(new byte[0], header.getMessageHeaders()));
        } catch (Exception e) {
            log.warn("强制断开连接失败: connectionId={}", connectionId, e);
        }
    }
}
