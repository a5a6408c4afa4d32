package com.mysteryhub.gameservice.platform.ws;

import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.gameservice.games.mystery.service.GameSessionService;
import com.mysteryhub.gameservice.platform.hub.ConnectionHub;
import com.mysteryhub.gameservice.platform.hub.EventTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class WebSocketSessionManagerTest {

    private static final PlayerPrincipal HOLMES = new PlayerPrincipal("p1", "ABCDEFGH");

    private final GameSessionService service = mock(GameSessionService.class);
    private final EventTransport transport = mock(EventTransport.class);
    private ConnectionHub hub;
    private WebSocketSessionManager manager;

    @BeforeEach
    void setUp() {
        hub = new ConnectionHub(transport, Runnable::run);
        manager = new WebSocketSessionManager(hub, service);
        manager.init();
    }

    @Test
    void connectRegistersAndSyncsOnline() {
        manager.handleSessionConnect(connectEvent("c1", HOLMES));

        assertThat(hub.isConnected("ABCDEFGH", "p1")).isTrue();
        assertThat(lastLiveness().getAsBoolean()).isTrue();
    }

    @Test
    void disconnectOfCurrentConnectionSyncsOffline() {
        manager.handleSessionConnect(connectEvent("c1", HOLMES));
        manager.handleSessionDisconnect(disconnectEvent("c1", HOLMES));

        assertThat(hub.isConnected("ABCDEFGH", "p1")).isFalse();
        verify(service, times(2)).syncPresence(eq("ABCDEFGH"), eq("p1"), any());
        assertThat(lastLiveness().getAsBoolean()).isFalse();
    }

    @Test
    void staleDisconnectAfterReconnectIsIgnored() {
        manager.handleSessionConnect(connectEvent("c1", HOLMES));
        manager.handleSessionConnect(connectEvent("c2", HOLMES));
        manager.handleSessionDisconnect(disconnectEvent("c1", HOLMES));

        verify(service, times(2)).syncPresence(eq("ABCDEFGH"), eq("p1"), any());
        assertThat(hub.isConnected("ABCDEFGH", "p1")).isTrue();
    }

    @Test
    void anonymousEventsAreIgnored() {
        manager.handleSessionConnect(connectEvent("c1", null));
        manager.handleSessionDisconnect(disconnectEvent("c1", null));

        verify(service, never()).syncPresence(anyString(), anyString(), any());
    }

    @Test
    void expiredSessionDoesNotBreakListener() {
        doThrow(GameException.of(GameError.SESSION_NOT_FOUND, "gone"))
                .when(service).syncPresence(anyString(), anyString(), any());

        assertThatCode(() -> manager.handleSessionConnect(connectEvent("c1", HOLMES))).doesNotThrowAnyException();
    }

    private BooleanSupplier lastLiveness() {
        ArgumentCaptor<BooleanSupplier> captor = ArgumentCaptor.forClass(BooleanSupplier.class);
        verify(service, atLeastOnce()).syncPresence(eq("ABCDEFGH"), eq("p1"), captor.capture());
        return captor.getValue();
    }

    private static SessionConnectEvent connectEvent(String connectionId, PlayerPrincipal user) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        accessor.setSessionId(connectionId);
        if (user != null) {
            accessor.setUser(user);
        }
        Message<byte[]> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
        return new SessionConnectEvent(WebSocketSessionManagerTest.class, message, user);
    }

    private static SessionDisconnectEvent disconnectEvent(String connectionId, PlayerPrincipal user) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.DISCONNECT);
        accessor.setSessionId(connectionId);
        Message<byte[]> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
        return new SessionDisconnectEvent(WebSocketSessionManagerTest.class, message, connectionId,
                CloseStatus.NORMAL, user);
    }
}
