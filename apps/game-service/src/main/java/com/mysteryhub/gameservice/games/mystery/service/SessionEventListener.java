package com.mysteryhub.gameservice.games.mystery.service;

import com.mysteryhub.gameservice.games.mystery.domain.model.GameSession;
import com.mysteryhub.gameservice.platform.transport.Envelope;

import java.util.List;

/**
 * 会话提交后回调（notify-after-commit）
 * ----------------------------------------
 * afterCommit 在会话互斥区内、状态变更已校验通过之后调用，事件已按序号排好。
 * 实现方只能做非阻塞的事情（入队、提交到线程池），不得做同步 I/O；
 * 抛出的异常只会被记录，不会回滚状态变更。
 */
public interface SessionEventListener {

    /**
     * @param session 刚提交的会话（调用方持有其互斥锁）
     * @param events  本次变更产生的广播事件，可能为空（如投票）
     */
    void afterCommit(GameSession session, List<Envelope<?>> events);

    /**
     * 会话被注册表移除（过期或状态损坏）
     */
    default void onSessionEvicted(String sessionId, String reason) {
    }
}
