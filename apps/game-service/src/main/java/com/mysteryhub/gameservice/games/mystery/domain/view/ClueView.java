package com.mysteryhub.gameservice.games.mystery.domain.view;

import com.mysteryhub.gameservice.games.mystery.domain.model.DiscoveredClue;
import com.mysteryhub.gameservice.games.mystery.domain.story.StoryClue;

/**
 * 已发现线索视图：剧本线索 + 发现记录
 */
public record ClueView(String id,
                       String name,
                       String description,
                       String location,
                       String item,
                       String foundBy,
                       long foundAt) {

    public static ClueView of(StoryClue clue, DiscoveredClue discovery) {
        return new ClueView(clue.getId(), clue.getName(), clue.getDescription(),
                clue.getLocation(), clue.getItem(),
                discovery.foundBy(), discovery.foundAt().toEpochMilli());
    }
}
