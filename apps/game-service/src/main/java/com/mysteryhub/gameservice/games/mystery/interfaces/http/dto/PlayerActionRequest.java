package com.mysteryhub.gameservice.games.mystery.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 只需要玩家身份的操作（开局、推进阶段）
 */
@Data
public class PlayerActionRequest {
    @NotBlank
    private String playerId;
}
