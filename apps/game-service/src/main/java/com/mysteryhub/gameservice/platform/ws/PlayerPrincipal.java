package com.mysteryhub.gameservice.platform.ws;

import java.security.Principal;

/**
 * STOMP 连接上的玩家身份：name 即 playerId（全局唯一），同时记住所属会话
 */
public record PlayerPrincipal(String playerId, String sessionId) implements Principal {

    @Override
    public String getName() {
        return playerId;
    }
}
