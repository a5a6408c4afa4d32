package com.mysteryhub.gameservice.platform.ws;

import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.gameservice.games.mystery.service.GameSessionService;
import com.mysteryhub.gameservice.platform.hub.ConnectionHub;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * 监听 STOMP 连接/断开事件，维护连接中心的在线表，并把在线状态同步给会话引擎。
 *
 * 在线标记统一走 {@link GameSessionService#syncPresence}：在会话互斥区内读取连接中心的实时状态，
 * 旧连接断开与新连接建立并发时，以最后一次观察为准。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    private final ConnectionHub connectionHub;
    private final GameSessionService gameSessionService;

    public WebSocketSessionManager(ConnectionHub connectionHub, GameSessionService gameSessionService) {
        this.connectionHub = connectionHub;
        this.gameSessionService = gameSessionService;
    }

    /**
     * 写失败被连接中心移除的连接，同样视为掉线
     */
    @PostConstruct
    public void init() {
        connectionHub.setConnectionLostHandler(this::syncPresence);
    }

    /**
     * 连接建立后登记到连接中心（同一玩家的旧连接会被顶替），并标记上线。
     */
    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        if (!(accessor.getUser() instanceof PlayerPrincipal player)) {
            log.warn("收到 SessionConnectEvent 但缺少玩家身份，connectionId={}", accessor.getSessionId());
            return;
        }
        String connectionId = accessor.getSessionId();
        if (connectionId == null) {
            log.warn("SessionConnectEvent 缺少 connectionId，playerId={}", player.playerId());
            return;
        }
        connectionHub.register(player.sessionId(), player.playerId(), connectionId);
        log.info("玩家 WebSocket 连接: sessionId={}, playerId={}, connectionId={}",
                player.sessionId(), player.playerId(), connectionId);
        syncPresence(player.sessionId(), player.playerId());
    }

    /**
     * 连接断开时注销；被新连接顶替的旧连接断开不会影响在线状态。
     */
    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String connectionId = event.getSessionId();
        Principal principal = event.getUser();
        if (!(principal instanceof PlayerPrincipal player) || connectionId == null) {
            log.debug("断开事件缺少玩家身份: connectionId={}", connectionId);
            return;
        }
        if (connectionHub.unregister(player.sessionId(), player.playerId(), connectionId)) {
            log.info("玩家 WebSocket 断开: sessionId={}, playerId={}, connectionId={}, status={}",
                    player.sessionId(), player.playerId(), connectionId, event.getCloseStatus());
            syncPresence(player.sessionId(), player.playerId());
        }
    }

    private void syncPresence(String sessionId, String playerId) {
        try {
            gameSessionService.syncPresence(sessionId, playerId,
                    () -> connectionHub.isConnected(sessionId, playerId));
        } catch (GameException e) {
            // 会话已过期或被移除：连接层的变化无需再同步
            log.debug("同步在线状态跳过: sessionId={}, playerId={}, error={}", sessionId, playerId, e.getError());
        }
    }
}
