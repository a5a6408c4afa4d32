package com.mysteryhub.gameservice.games.mystery.domain.view;

import com.mysteryhub.gameservice.games.mystery.domain.story.Story;

/**
 * 剧本列表项
 */
public record StorySummary(String id,
                           String title,
                           String titleCn,
                           String description,
                           int minPlayers,
                           int maxPlayers,
                           String difficulty,
                           int durationMinutes) {

    public static StorySummary of(Story s) {
        return new StorySummary(s.getId(), s.getTitle(), s.getTitleCn(), s.getDescription(),
                s.minPlayers(), s.maxPlayers(), s.getDifficulty(), s.getDurationMinutes());
    }
}
