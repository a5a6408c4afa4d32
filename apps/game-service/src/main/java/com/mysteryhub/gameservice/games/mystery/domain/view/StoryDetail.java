package com.mysteryhub.gameservice.games.mystery.domain.view;

import com.mysteryhub.gameservice.games.mystery.domain.story.Story;
import com.mysteryhub.gameservice.games.mystery.domain.story.StoryLocation;

import java.util.List;
import java.util.Map;

/**
 * 剧本详情（开局前可见部分）：不含真相，不含任何角色的私密信息，也不含线索本身
 */
public record StoryDetail(StorySummary summary,
                          Map<String, Object> setting,
                          Map<String, Object> victim,
                          List<CharacterProfile> characters,
                          List<StoryLocation> locations) {

    public record CharacterProfile(String id, String name, String nameCn, String publicInfo) {
    }

    public static StoryDetail of(Story s) {
        List<CharacterProfile> characters = s.getCharacters().stream()
                .map(c -> new CharacterProfile(c.getId(), c.getName(), c.getNameCn(), c.getPublicInfo()))
                .toList();
        return new StoryDetail(StorySummary.of(s), s.getSetting(), s.getVictim(),
                characters, List.copyOf(s.getLocations()));
    }
}
