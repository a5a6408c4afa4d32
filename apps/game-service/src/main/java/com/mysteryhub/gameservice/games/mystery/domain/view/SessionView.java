package com.mysteryhub.gameservice.games.mystery.domain.view;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.enums.SessionStatus;
import com.mysteryhub.gameservice.games.mystery.domain.event.ChatPayload;
import com.mysteryhub.gameservice.games.mystery.domain.story.StorySolution;

import java.util.List;
import java.util.Map;

/**
 * 全量状态（按请求者投影）
 * ----------------------------------------
 * - myCharacter：只有请求者本人的角色剧本；
 * - voteTally / solution：复盘（reveal）之前为 null；
 * - lastEventSeq：客户端用它对齐增量事件，收到 seq 更大的事件再逐条应用。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(String sessionId,
                          String storyId,
                          String storyTitle,
                          SessionStatus status,
                          GamePhase phase,
                          String hostId,
                          long createdAt,
                          long lastEventSeq,
                          String narration,
                          List<PlayerView> players,
                          List<CharacterCard> characters,
                          List<ClueView> discoveredClues,
                          CharacterSheet myCharacter,
                          List<String> votedPlayerIds,
                          Map<String, Long> voteTally,
                          StorySolution solution,
                          List<ChatPayload> recentChat) {
}
