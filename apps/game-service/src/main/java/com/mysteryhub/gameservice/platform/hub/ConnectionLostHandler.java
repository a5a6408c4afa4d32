package com.mysteryhub.gameservice.platform.hub;

/**
 * 连接写失败被 Hub 移除后的回调（用于把玩家标记为离线）
 */
@FunctionalInterface
public interface ConnectionLostHandler {

    void onConnectionLost(String sessionId, String playerId);
}
