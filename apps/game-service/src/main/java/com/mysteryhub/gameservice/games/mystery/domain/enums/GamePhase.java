package com.mysteryhub.gameservice.games.mystery.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 对局阶段。推进顺序不在这里定义，见 {@link com.mysteryhub.gameservice.games.mystery.domain.model.PhaseTrack}。
 */
public enum GamePhase {

    LOBBY("lobby"),                       // 大厅，等待玩家加入
    CHARACTER_SELECT("character_select"), // 选角
    SCRIPT_READING("script_reading"),     // 读剧本
    INVESTIGATION("investigation"),       // 搜证（唯一允许搜证的阶段）
    DISCUSSION("discussion"),             // 讨论
    VOTING("voting"),                     // 投票
    REVEAL("reveal"),                     // 复盘揭晓
    ENDED("ended");                       // 结束（终态）

    private final String wireName;

    GamePhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static GamePhase fromWire(String value) {
        return Arrays.stream(values())
                .filter(p -> p.wireName.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知阶段: " + value));
    }
}
