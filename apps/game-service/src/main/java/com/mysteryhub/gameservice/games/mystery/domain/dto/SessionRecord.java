package com.mysteryhub.gameservice.games.mystery.domain.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SessionRecord
 * -------------------------------------------------------
 * 会话归档快照（用于 Redis 持久化与服务重启恢复）。
 * - 时间统一存 epoch millis，避免序列化器对 java.time 的依赖；
 * - 枚举存 wire name（如 "script_reading"）；
 * - 不保存在线状态：恢复后所有玩家都视为离线，等待重新连接。
 * -------------------------------------------------------
 */
@Data
@NoArgsConstructor
public class SessionRecord {
    /** 房间码 */
    private String id;
    private String storyId;
    private String status;
    private String phase;
    private String hostId;
    private long createdAt;
    private long lastActivityAt;
    /** 已分配的最后一个事件序号 */
    private long eventSeq;
    /** 按加入顺序 */
    private List<PlayerRecord> players = new ArrayList<>();
    /** 按发现顺序 */
    private List<ClueRecord> discoveredClues = new ArrayList<>();
    /** voterId -> 嫌疑人 characterId */
    private Map<String, String> votes = new LinkedHashMap<>();
    private List<ChatRecord> chat = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class PlayerRecord {
        private String id;
        private String name;
        private String characterId;
        private boolean host;
        private long joinedAt;
    }

    @Data
    @NoArgsConstructor
    public static class ClueRecord {
        private String clueId;
        private String foundBy;
        private long foundAt;
    }

    @Data
    @NoArgsConstructor
    public static class ChatRecord {
        private String senderId;
        private String senderName;
        private String content;
        private long sentAt;
    }
}
