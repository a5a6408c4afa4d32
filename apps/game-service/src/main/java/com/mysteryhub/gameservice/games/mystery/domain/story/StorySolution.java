package com.mysteryhub.gameservice.games.mystery.domain.story;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 真相。只在复盘（reveal）及之后随状态下发。
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorySolution {

    private String murdererCharacterId;
    private String motive;
    private String method;
    private String explanation;
}
