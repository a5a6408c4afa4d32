package com.mysteryhub.gameservice.games.mystery.domain.story;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 可扮演角色。publicInfo 所有人可见；其余字段只对持有该角色的玩家可见。
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoryCharacter {

    private String id;
    private String name;
    private String nameCn;
    private String publicInfo;

    // ---- 私密信息 ----
    private String privateBackground;
    private List<String> secrets = new ArrayList<>();
    /** 角色ID/姓名 -> 关系描述 */
    private Map<String, String> relationships = new LinkedHashMap<>();
    private List<String> goals = new ArrayList<>();
}
