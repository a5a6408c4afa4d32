package com.mysteryhub.gameservice.games.mystery.service;

/**
 * 会话引擎的策略参数
 *
 * @param releaseCharacterOnDisconnect 断线时是否释放角色（默认不释放，角色随玩家保留）
 * @param chatMaxLength                单条聊天最大字符数，超出截断
 * @param chatHistorySize              保留的最近聊天条数
 */
public record SessionPolicy(boolean releaseCharacterOnDisconnect, int chatMaxLength, int chatHistorySize) {

    public static SessionPolicy defaults() {
        return new SessionPolicy(false, 500, 50);
    }
}
