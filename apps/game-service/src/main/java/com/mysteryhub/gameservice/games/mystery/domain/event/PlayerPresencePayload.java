package com.mysteryhub.gameservice.games.mystery.domain.event;

/**
 * player_joined / player_left 载荷
 *
 * @param reason joined（新成员加入）/ connected / disconnected
 */
public record PlayerPresencePayload(String playerId, String playerName, boolean connected, String reason) {

    public static final String JOINED = "joined";
    public static final String CONNECTED = "connected";
    public static final String DISCONNECTED = "disconnected";
}
