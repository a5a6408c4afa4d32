package com.mysteryhub.gameservice.platform.ws;

import com.mysteryhub.gameservice.platform.hub.EventTransport;
import com.mysteryhub.gameservice.platform.hub.PlayerConnection;
import com.mysteryhub.gameservice.platform.transport.Envelope;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 基于 STOMP 的事件写出：按 simpSessionId 精确推送到该连接的 /user/queue/game.events
 */
@Component
public class StompEventTransport implements EventTransport {

    public static final String EVENTS_DESTINATION = "/queue/game.events";
    public static final String ERRORS_DESTINATION = "/queue/game.errors";
    public static final String REPLIES_DESTINATION = "/queue/game.replies";

    private final SimpMessagingTemplate messagingTemplate;
    private final WebSocketDisconnectHelper disconnectHelper;

    public StompEventTransport(SimpMessagingTemplate messagingTemplate, WebSocketDisconnectHelper disconnectHelper) {
        this.messagingTemplate = messagingTemplate;
        this.disconnectHelper = disconnectHelper;
    }

    @Override
    public void send(PlayerConnection connection, Envelope<?> envelope) {
        messagingTemplate.convertAndSendToUser(connection.playerId(), EVENTS_DESTINATION, envelope,
                sessionHeaders(connection.connectionId()));
    }

    @Override
    public void close(PlayerConnection connection) {
        disconnectHelper.forceDisconnect(connection.connectionId());
    }

    /**
     * 只投递到指定 STOMP 会话的消息头
     */
    static MessageHeaders sessionHeaders(String connectionId) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(connectionId);
        headerAccessor.setLeaveMutable(true);
        return headerAccessor.getMessageHeaders();
    }
}
