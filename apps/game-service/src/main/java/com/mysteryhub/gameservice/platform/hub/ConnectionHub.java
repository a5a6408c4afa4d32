package com.mysteryhub.gameservice.platform.hub;

import com.mysteryhub.gameservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 连接中心
 * ----------------------------------------
 * 每个会话一张 playerId -> 连接 的在线表（与玩家名单分开，连接的来去不会改动游戏状态）。
 *
 * 扇出语义：
 *  - broadcast 只做入队，立即返回，调用方可在会话互斥区内调用；
 *  - 每个连接的发件箱由扇出线程池排空，某个连接写得慢不影响其他连接；
 *  - 写失败：标记连接失效、移出在线表、关闭连接，再回调 {@link ConnectionLostHandler}；
 *    broadcast 本身永远不失败。
 */
@Slf4j
@Component
public class ConnectionHub {

    private final EventTransport transport;
    private final Executor fanoutExecutor;

    /** sessionId -> (playerId -> 连接) */
    private final ConcurrentMap<String, ConcurrentMap<String, PlayerConnection>> sessions = new ConcurrentHashMap<>();

    private volatile ConnectionLostHandler connectionLostHandler = (sessionId, playerId) -> { };

    public ConnectionHub(EventTransport transport, @Qualifier("fanoutExecutor") Executor fanoutExecutor) {
        this.transport = transport;
        this.fanoutExecutor = fanoutExecutor;
    }

    public void setConnectionLostHandler(ConnectionLostHandler handler) {
        this.connectionLostHandler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * 登记连接；同一玩家已有旧连接时，旧连接被顶替并关闭
     */
    public PlayerConnection register(String sessionId, String playerId, String connectionId) {
        PlayerConnection conn = new PlayerConnection(sessionId, playerId, connectionId);
        PlayerConnection old = sessions.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>()).put(playerId, conn);
        if (old != null && !old.connectionId().equals(connectionId) && old.markDead()) {
            log.info("玩家新连接顶替旧连接: sessionId={}, playerId={}, old={}, new={}",
                    sessionId, playerId, old.connectionId(), connectionId);
            closeQuietly(old);
        }
        return conn;
    }

    /**
     * 注销连接：只有当前登记的正是该连接时才移除（被顶替的旧连接断开不影响新连接）
     *
     * @return 是否确实移除了
     */
    public boolean unregister(String sessionId, String playerId, String connectionId) {
        Map<String, PlayerConnection> room = sessions.get(sessionId);
        if (room == null) {
            return false;
        }
        PlayerConnection current = room.get(playerId);
        if (current == null || !current.connectionId().equals(connectionId)) {
            return false;
        }
        boolean removed = room.remove(playerId, current);
        if (removed) {
            current.markDead();
            sessions.computeIfPresent(sessionId, (k, v) -> v.isEmpty() ? null : v);
        }
        return removed;
    }

    /**
     * 向会话内全部在线连接广播（按给定顺序入队）
     */
    public void broadcast(String sessionId, List<? extends Envelope<?>> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        Map<String, PlayerConnection> room = sessions.get(sessionId);
        if (room == null) {
            return;
        }
        for (PlayerConnection conn : room.values()) {
            for (Envelope<?> e : events) {
                conn.enqueue(e);
            }
            scheduleDrain(conn);
        }
    }

    /**
     * 只发给某个玩家
     */
    public void sendTo(String sessionId, String playerId, Envelope<?> event) {
        Map<String, PlayerConnection> room = sessions.get(sessionId);
        PlayerConnection conn = room == null ? null : room.get(playerId);
        if (conn != null && conn.enqueue(event)) {
            scheduleDrain(conn);
        }
    }

    public boolean isConnected(String sessionId, String playerId) {
        Map<String, PlayerConnection> room = sessions.get(sessionId);
        PlayerConnection conn = room == null ? null : room.get(playerId);
        return conn != null && conn.isAlive();
    }

    public Set<String> connectedPlayers(String sessionId) {
        Map<String, PlayerConnection> room = sessions.get(sessionId);
        return room == null ? Set.of() : Set.copyOf(room.keySet());
    }

    /**
     * 关闭会话内的所有连接（会话过期或损坏时）
     */
    public void closeSession(String sessionId) {
        Map<String, PlayerConnection> room = sessions.remove(sessionId);
        if (room == null) {
            return;
        }
        List<PlayerConnection> conns = new ArrayList<>(room.values());
        for (PlayerConnection conn : conns) {
            if (conn.markDead()) {
                closeQuietly(conn);
            }
        }
        log.info("会话连接已全部关闭: sessionId={}, count={}", sessionId, conns.size());
    }

    private void scheduleDrain(PlayerConnection conn) {
        if (!conn.tryStartDrain()) {
            return;
        }
        try {
            fanoutExecutor.execute(() -> drain(conn));
        } catch (RejectedExecutionException e) {
            conn.finishDrain();
            log.warn("扇出线程池拒绝任务: {}", conn, e);
        }
    }

    private void drain(PlayerConnection conn) {
        while (true) {
            Envelope<?> next = conn.poll();
            if (next == null) {
                conn.finishDrain();
                // 释放标记后可能又有新事件入队，抢回排空权继续
                if (conn.hasPending() && conn.tryStartDrain()) {
                    continue;
                }
                return;
            }
            if (!conn.isAlive()) {
                continue;
            }
            try {
                transport.send(conn, next);
            } catch (RuntimeException e) {
                conn.finishDrain();
                onSendFailure(conn, e);
                return;
            }
        }
    }

    private void onSendFailure(PlayerConnection conn, RuntimeException cause) {
        if (!conn.markDead()) {
            return;
        }
        log.warn("连接写失败，移除该连接: sessionId={}, playerId={}, connectionId={}, cause={}",
                conn.sessionId(), conn.playerId(), conn.connectionId(), cause.toString());
        Map<String, PlayerConnection> room = sessions.get(conn.sessionId());
        boolean removed = room != null && room.remove(conn.playerId(), conn);
        closeQuietly(conn);
        if (!removed) {
            return;
        }
        try {
            connectionLostHandler.onConnectionLost(conn.sessionId(), conn.playerId());
        } catch (RuntimeException e) {
            log.warn("连接丢失回调失败: sessionId={}, playerId={}", conn.sessionId(), conn.playerId(), e);
        }
    }

    private void closeQuietly(PlayerConnection conn) {
        try {
            transport.close(conn);
        } catch (RuntimeException e) {
            log.warn("关闭连接失败: {}", conn, e);
        }
    }
}
