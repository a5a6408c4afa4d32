package com.mysteryhub.gameservice.games.mystery.domain.view;

import com.mysteryhub.gameservice.games.mystery.domain.story.StoryCharacter;

/**
 * 角色公开信息 + 占用情况（选角界面用）
 *
 * @param takenBy 持有者 playerId，空闲为 null
 */
public record CharacterCard(String id, String name, String nameCn, String publicInfo, boolean taken, String takenBy) {

    public static CharacterCard of(StoryCharacter c, String holder) {
        return new CharacterCard(c.getId(), c.getName(), c.getNameCn(), c.getPublicInfo(), holder != null, holder);
    }
}
