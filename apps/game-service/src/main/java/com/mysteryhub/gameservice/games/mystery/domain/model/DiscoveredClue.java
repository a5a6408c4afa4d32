package com.mysteryhub.gameservice.games.mystery.domain.model;

import java.time.Instant;

/**
 * 会话内的线索发现记录（叠加在剧本线索定义之上）
 *
 * @param clueId  剧本中的线索ID
 * @param foundBy 发现者 playerId
 * @param foundAt 发现时间
 */
public record DiscoveredClue(String clueId, String foundBy, Instant foundAt) {
}
