package com.mysteryhub.gameservice.platform.ws;

import com.mysteryhub.gameservice.games.mystery.service.GameSessionService;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.messaging.support.MessageHeaderAccessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlayerHandshakeInterceptorTest {

    private final GameSessionService service = mock(GameSessionService.class);
    private final PlayerHandshakeInterceptor interceptor = new PlayerHandshakeInterceptor(service);

    @Test
    void memberGetsPrincipal() {
        when(service.isMember("ABCDEFGH", "p1")).thenReturn(true);

        Message<?> out = interceptor.preSend(frame(StompCommand.CONNECT, " abcdefgh ", "p1"), null);

        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(out, StompHeaderAccessor.class);
        assertThat(accessor.getUser()).isEqualTo(new PlayerPrincipal("p1", "ABCDEFGH"));
        assertThat(accessor.getUser().getName()).isEqualTo("p1");
    }

    @Test
    void strangerIsRejected() {
        when(service.isMember(anyString(), anyString())).thenReturn(false);

        assertThatThrownBy(() -> interceptor.preSend(frame(StompCommand.CONNECT, "ABCDEFGH", "ghost"), null))
                .isInstanceOf(MessageDeliveryException.class);
    }

    @Test
    void missingHeadersAreRejected() {
        assertThatThrownBy(() -> interceptor.preSend(frame(StompCommand.CONNECT, null, "p1"), null))
                .isInstanceOf(MessageDeliveryException.class);
        assertThatThrownBy(() -> interceptor.preSend(frame(StompCommand.CONNECT, "ABCDEFGH", "  "), null))
                .isInstanceOf(MessageDeliveryException.class);
        verify(service, never()).isMember(anyString(), anyString());
    }

    @Test
    void otherFramesPassThrough() {
        Message<?> send = frame(StompCommand.SEND, null, null);

        assertThat(interceptor.preSend(send, null)).isSameAs(send);
        verify(service, never()).isMember(anyString(), anyString());
    }

    private static Message<byte[]> frame(StompCommand command, String sessionId, String playerId) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        if (sessionId != null) {
            accessor.setNativeHeader(PlayerHandshakeInterceptor.SESSION_HEADER, sessionId);
        }
        if (playerId != null) {
            accessor.setNativeHeader(PlayerHandshakeInterceptor.PLAYER_HEADER, playerId);
        }
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }
}
