package com.mysteryhub.gameservice.games.mystery.application;

import com.mysteryhub.gameservice.games.mystery.domain.model.GameSession;
import com.mysteryhub.gameservice.games.mystery.service.SessionEventListener;
import com.mysteryhub.gameservice.platform.hub.ConnectionHub;
import com.mysteryhub.gameservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 提交后扇出：把会话事件交给连接中心（只入队，不阻塞会话互斥区）
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FanoutPublisher implements SessionEventListener {

    private final ConnectionHub connectionHub;

    @Override
    public void afterCommit(GameSession session, List<Envelope<?>> events) {
        if (events.isEmpty()) {
            return;
        }
        connectionHub.broadcast(session.getId(), events);
        if (log.isDebugEnabled()) {
            log.debug("事件已入队: sessionId={}, events={}", session.getId(), events);
        }
    }

    @Override
    public void onSessionEvicted(String sessionId, String reason) {
        connectionHub.closeSession(sessionId);
    }
}
