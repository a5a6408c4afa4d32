package com.mysteryhub.gameservice.games.mystery.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum SessionStatus {

    WAITING("waiting"),         // 等待开始（可加入、可选角）
    IN_PROGRESS("in_progress"), // 进行中
    FINISHED("finished");       // 已结束

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知会话状态: " + value));
    }
}
