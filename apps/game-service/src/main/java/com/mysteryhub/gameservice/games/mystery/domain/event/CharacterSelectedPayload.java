package com.mysteryhub.gameservice.games.mystery.domain.event;

import java.util.Map;

/**
 * character_selected 载荷
 *
 * @param releasedCharacterId 本次被释放的旧角色（可空）
 * @param assignments         选角后的完整占用表 characterId -> playerId
 */
public record CharacterSelectedPayload(String playerId,
                                       String characterId,
                                       String releasedCharacterId,
                                       Map<String, String> assignments) {
}
