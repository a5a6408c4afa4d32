package com.mysteryhub.gameservice.games.mystery.domain.repository;

import com.mysteryhub.gameservice.games.mystery.domain.story.Story;

import java.util.List;
import java.util.Optional;

/**
 * 剧本目录（只读）
 * ----------------------------------------
 * 会话引擎只通过本接口查询剧本；剧本内容的编写与校验不在本服务内。
 */
public interface StoryRepository {

    Optional<Story> findById(String storyId);

    /**
     * @throws com.mysteryhub.gameservice.games.mystery.domain.exception.GameException STORY_NOT_FOUND
     */
    Story require(String storyId);

    /** 全部剧本，按ID排序 */
    List<Story> findAll();

    /**
     * 重新加载剧本
     *
     * @return 加载成功的剧本数
     */
    int reload();
}
