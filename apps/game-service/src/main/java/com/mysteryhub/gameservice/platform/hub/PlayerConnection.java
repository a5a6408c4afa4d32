package com.mysteryhub.gameservice.platform.hub;

import com.mysteryhub.gameservice.platform.transport.Envelope;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一个玩家的一条实时连接
 * ----------------------------------------
 * 自带有序发件箱：广播只入队，由扇出线程排空；
 * 同一时刻最多一个线程在排空（draining 标记），保证该连接上的事件顺序与入队顺序一致。
 */
public final class PlayerConnection {

    private final String sessionId;
    private final String playerId;
    /** 底层连接标识（STOMP 的 simpSessionId） */
    private final String connectionId;

    private final Queue<Envelope<?>> outbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean alive = new AtomicBoolean(true);

    public PlayerConnection(String sessionId, String playerId, String connectionId) {
        this.sessionId = sessionId;
        this.playerId = playerId;
        this.connectionId = connectionId;
    }

    public String sessionId() {
        return sessionId;
    }

    public String playerId() {
        return playerId;
    }

    public String connectionId() {
        return connectionId;
    }

    public boolean isAlive() {
        return alive.get();
    }

    /**
     * 标记失效
     *
     * @return 是否由本次调用完成标记（只有第一次返回 true）
     */
    boolean markDead() {
        if (alive.compareAndSet(true, false)) {
            outbox.clear();
            return true;
        }
        return false;
    }

    boolean enqueue(Envelope<?> envelope) {
        return alive.get() && outbox.offer(envelope);
    }

    Envelope<?> poll() {
        return outbox.poll();
    }

    boolean hasPending() {
        return !outbox.isEmpty();
    }

    boolean tryStartDrain() {
        return draining.compareAndSet(false, true);
    }

    void finishDrain() {
        draining.set(false);
    }

    @Override
    public String toString() {
        return "PlayerConnection{" +
                "sessionId='" + sessionId + '\'' +
                ", playerId='" + playerId + '\'' +
                ", connectionId='" + connectionId + '\'' +
                '}';
    }
}
