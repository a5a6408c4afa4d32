package com.mysteryhub.gameservice.games.mystery.interfaces.ws.dto;

import lombok.Data;

/**
 * STOMP 入站指令与点对点回执
 * 会话与玩家身份取自连接（PlayerPrincipal），指令里不再重复携带。
 */
public class GameCommands {

    /** /app/game.chat */
    @Data
    public static class ChatCmd {
        private String content;
    }

    /** /app/game.search */
    @Data
    public static class SearchCmd {
        private String locationId;
        private String itemId;
    }

    /** /app/game.select */
    @Data
    public static class SelectCmd {
        private String characterId;
    }

    /** /app/game.vote */
    @Data
    public static class VoteCmd {
        private String suspectCharacterId;
    }

    /**
     * 指令失败，只发给发起者（/user/queue/game.errors）
     */
    public record ErrorReply(String command, String error, String message, Object details) {
    }
}
