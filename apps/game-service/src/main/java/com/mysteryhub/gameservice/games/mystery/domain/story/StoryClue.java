package com.mysteryhub.gameservice.games.mystery.domain.story;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * 线索定义。发现记录（谁、何时）由会话引擎叠加在外层，不写回这里。
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoryClue {

    private String id;
    private String name;
    private String description;
    /** 所在地点ID */
    private String location;
    /** 所在物品ID（可空） */
    private String item;
    /** 搜证提示文本，物品未显式声明时按包含关系匹配 */
    private String discoveryHint;

    /**
     * 物品匹配：item 相等或 discoveryHint 包含该物品（均忽略大小写）；物品为空视为匹配。
     */
    public boolean matchesItem(String itemId) {
        if (StringUtils.isBlank(itemId)) {
            return true;
        }
        String wanted = itemId.trim();
        if (StringUtils.equalsIgnoreCase(item, wanted)) {
            return true;
        }
        return StringUtils.containsIgnoreCase(discoveryHint, wanted);
    }
}
