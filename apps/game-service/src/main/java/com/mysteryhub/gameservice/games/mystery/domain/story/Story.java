package com.mysteryhub.gameservice.games.mystery.domain.story;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 剧本定义（只读内容，由 stories/*.json 加载）
 * ----------------------------------------
 * 会话引擎只查询，从不修改；加载完成后视为不可变。
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Story {

    private String id;
    private String title;
    private String titleCn;
    private String description;
    private PlayerCount playerCount;
    private String difficulty;
    private int durationMinutes;

    /** 背景设定（时间、地点等自由结构） */
    private Map<String, Object> setting;
    /** 死者信息（自由结构） */
    private Map<String, Object> victim;
    private List<Map<String, Object>> timeline = new ArrayList<>();

    private List<StoryCharacter> characters = new ArrayList<>();
    private List<StoryLocation> locations = new ArrayList<>();
    private List<StoryClue> clues = new ArrayList<>();
    private StorySolution solution;

    /** 各阶段旁白与提示，如 intro_narration（字符串）、discussion_prompts（列表） */
    private Map<String, Object> phases;

    public Optional<StoryCharacter> findCharacter(String characterId) {
        if (characterId == null) {
            return Optional.empty();
        }
        return characters.stream().filter(c -> characterId.equals(c.getId())).findFirst();
    }

    public boolean hasCharacter(String characterId) {
        return findCharacter(characterId).isPresent();
    }

    public Optional<StoryClue> findClue(String clueId) {
        if (clueId == null) {
            return Optional.empty();
        }
        return clues.stream().filter(c -> clueId.equals(c.getId())).findFirst();
    }

    public boolean hasClue(String clueId) {
        return findClue(clueId).isPresent();
    }

    /** 剧本中定义的全部线索ID */
    public Set<String> clueIds() {
        return clues.stream().map(StoryClue::getId).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * 按“地点 + 物品”定位线索：取剧本顺序中第一条匹配的线索，保证同一搜索总是指向同一条线索。
     * 物品为空时取该地点的第一条线索。
     */
    public Optional<StoryClue> locateClue(String locationId, String itemId) {
        if (locationId == null) {
            return Optional.empty();
        }
        return clues.stream()
                .filter(c -> locationId.equals(c.getLocation()))
                .filter(c -> c.matchesItem(itemId))
                .findFirst();
    }

    /**
     * 阶段旁白：script_reading 取 intro_narration，其余取 {phase}_narration；没有则为 null
     */
    public String narrationFor(GamePhase phase) {
        if (phases == null || phase == null) {
            return null;
        }
        String key = phase == GamePhase.SCRIPT_READING ? "intro_narration" : phase.wireName() + "_narration";
        return phases.get(key) instanceof String text ? text : null;
    }

    public int minPlayers() {
        return playerCount == null ? 1 : playerCount.getMin();
    }

    public int maxPlayers() {
        return playerCount == null ? Integer.MAX_VALUE : playerCount.getMax();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlayerCount {
        private int min;
        private int max;
    }
}
