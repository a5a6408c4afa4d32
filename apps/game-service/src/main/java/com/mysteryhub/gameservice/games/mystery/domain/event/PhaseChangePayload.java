package com.mysteryhub.gameservice.games.mystery.domain.event;

import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.enums.SessionStatus;

/**
 * phase_change 载荷；narration 为剧本中该阶段的旁白（可空）
 */
public record PhaseChangePayload(GamePhase phase, GamePhase previousPhase, SessionStatus status, String narration) {
}
