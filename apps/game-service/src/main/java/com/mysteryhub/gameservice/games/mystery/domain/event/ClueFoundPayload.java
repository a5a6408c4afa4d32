package com.mysteryhub.gameservice.games.mystery.domain.event;

import com.mysteryhub.gameservice.games.mystery.domain.view.ClueView;

/**
 * clue_found 载荷
 */
public record ClueFoundPayload(String finderId, String finderName, ClueView clue) {
}
