package com.mysteryhub.gameservice.games.mystery.domain.model;

import lombok.Getter;

import java.time.Instant;

/**
 * 房间内的玩家
 * ----------------------------------------
 * 加入时创建，房间存续期间不会删除（否则角色绑定与线索归属无处挂靠）。
 * 可变字段（角色、在线）只能经由 {@link GameSession} 在会话互斥区内修改。
 */
@Getter
public class Player {

    private final String id;
    private final String name;
    private final boolean host;
    private final Instant joinedAt;

    /** 当前持有的角色ID，未选为 null */
    private String characterId;
    /** 在线标记，与成员身份无关：断线的玩家仍是玩家 */
    private boolean connected;

    Player(String id, String name, boolean host, Instant joinedAt) {
        this.id = id;
        this.name = name;
        this.host = host;
        this.joinedAt = joinedAt;
    }

    public boolean hasCharacter() {
        return characterId != null;
    }

    void setCharacterId(String characterId) {
        this.characterId = characterId;
    }

    void setConnected(boolean connected) {
        this.connected = connected;
    }
}
