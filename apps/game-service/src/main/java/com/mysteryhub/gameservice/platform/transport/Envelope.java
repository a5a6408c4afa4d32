package com.mysteryhub.gameservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * 传输消息外壳
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：type / sessionId / seq / ts / payload
 * - seq 在会话互斥区内分配，同一会话内严格递增；客户端据此发现丢包并重新拉取全量状态
 *
 * 用法示例：
 *   Envelope<ChatPayload> msg = Envelope.of(EventType.CHAT, sessionId, seq, ts, payload);
 *
 * @param type      事件类型
 * @param sessionId 会话ID（房间码）
 * @param seq       会话内递增序号
 * @param ts        服务器时间戳（ms）
 * @param payload   事件载荷
 */
public record Envelope<T>(EventType type, String sessionId, long seq, long ts, T payload) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public Envelope {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sessionId, "sessionId");
    }

    public static <T> Envelope<T> of(EventType type, String sessionId, long seq, long ts, T payload) {
        return new Envelope<>(type, sessionId, seq, ts, payload);
    }

    @Override
    public String toString() {
        return "Envelope{" +
                "type=" + type +
                ", sessionId='" + sessionId + '\'' +
                ", seq=" + seq +
                ", ts=" + ts +
                '}';
    }
}
