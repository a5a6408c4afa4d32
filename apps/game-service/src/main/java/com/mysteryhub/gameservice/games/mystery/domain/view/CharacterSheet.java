package com.mysteryhub.gameservice.games.mystery.domain.view;

import com.mysteryhub.gameservice.games.mystery.domain.story.StoryCharacter;

import java.util.List;
import java.util.Map;

/**
 * 角色剧本（含私密信息），只返回给持有该角色的玩家本人
 */
public record CharacterSheet(String id,
                             String name,
                             String nameCn,
                             String publicInfo,
                             String privateBackground,
                             List<String> secrets,
                             Map<String, String> relationships,
                             List<String> goals) {

    public static CharacterSheet of(StoryCharacter c) {
        return new CharacterSheet(c.getId(), c.getName(), c.getNameCn(), c.getPublicInfo(),
                c.getPrivateBackground(),
                c.getSecrets() == null ? List.of() : List.copyOf(c.getSecrets()),
                c.getRelationships() == null ? Map.of() : Map.copyOf(c.getRelationships()),
                c.getGoals() == null ? List.of() : List.copyOf(c.getGoals()));
    }
}
