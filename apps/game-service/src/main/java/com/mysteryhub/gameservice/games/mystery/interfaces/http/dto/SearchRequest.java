package com.mysteryhub.gameservice.games.mystery.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 搜证请求；itemId 为空表示搜索整个地点
 */
@Data
public class SearchRequest {
    @NotBlank
    private String playerId;
    @NotBlank
    private String locationId;
    private String itemId;
}
