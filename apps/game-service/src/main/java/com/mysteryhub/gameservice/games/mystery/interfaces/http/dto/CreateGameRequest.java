package com.mysteryhub.gameservice.games.mystery.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 创建房间请求；名字长度（去首尾空白后 1~20）由引擎统一校验
 */
@Data
public class CreateGameRequest {
    @NotBlank
    private String storyId;
    @NotBlank
    private String hostName;
}
