package com.mysteryhub.gameservice.platform.transport;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 广播事件类型（封闭集合，客户端按 type 分发）
 * <p>
 * 前五种是对局事件：player_joined / player_left / phase_change / clue_found / chat；
 * character_selected 是选角广播，每次占用或释放角色都会发出，附完整占用表。
 * 客户端只会收到这六种 type。
 */
public enum EventType {

    PLAYER_JOINED,      // 玩家加入 / 上线
    PLAYER_LEFT,        // 玩家离线（仍是房间成员）
    PHASE_CHANGE,       // 阶段变化
    CLUE_FOUND,         // 发现新线索
    CHAT,               // 聊天
    CHARACTER_SELECTED; // 选角结果（附完整占用表）

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
