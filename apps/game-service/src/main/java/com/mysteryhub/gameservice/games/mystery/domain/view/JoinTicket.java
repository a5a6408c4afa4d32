package com.mysteryhub.gameservice.games.mystery.domain.view;

/**
 * 创建/加入房间的凭据：客户端后续所有请求都带上这两个ID
 */
public record JoinTicket(String sessionId, String playerId) {
}
