package com.mysteryhub.gameservice.platform.ws;

import com.mysteryhub.gameservice.games.mystery.service.GameSessionService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.annotation.Lazy;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * WebSocket STOMP 握手拦截器
 *
 * 在 STOMP CONNECT 阶段校验 sessionId / playerId 两个 native header，
 * 通过后设置 {@link PlayerPrincipal}，供后续消息处理与点对点推送使用。
 * 校验失败直接拒绝连接（客户端收到 ERROR 帧）。其他命令直接放行。
 */
@Slf4j
@Component
public class PlayerHandshakeInterceptor implements ChannelInterceptor {

    static final String SESSION_HEADER = "sessionId";
    static final String PLAYER_HEADER = "playerId";

    private final GameSessionService gameSessionService;

    public PlayerHandshakeInterceptor(@Lazy GameSessionService gameSessionService) {
        this.gameSessionService = gameSessionService;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        String sessionId = StringUtils.upperCase(StringUtils.trimToNull(firstHeader(accessor, SESSION_HEADER)), Locale.ROOT);
        String playerId = StringUtils.trimToNull(firstHeader(accessor, PLAYER_HEADER));
        if (sessionId == null || playerId == null) {
            throw new MessageDeliveryException("CONNECT 缺少 sessionId / playerId");
        }
        if (!gameSessionService.isMember(sessionId, playerId)) {
            log.info("拒绝 WebSocket 连接：玩家不在房间内, sessionId={}, playerId={}", sessionId, playerId);
            throw new MessageDeliveryException("玩家不在该房间内");
        }
        accessor.setUser(new PlayerPrincipal(playerId, sessionId));
        return message;
    }

    /**
     * 从 STOMP header 中提取指定 key 的第一个值
     */
    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
