package com.mysteryhub.gameservice.games.mystery.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChatRequest {
    @NotBlank
    private String playerId;
    private String content;
}
