package com.mysteryhub.gameservice.games.mystery.application;

import com.mysteryhub.gameservice.games.mystery.domain.constants.GameMessages;
import com.mysteryhub.gameservice.games.mystery.domain.dto.SessionRecordConverter;
import com.mysteryhub.gameservice.games.mystery.domain.enums.SessionStatus;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.gameservice.games.mystery.domain.model.GameSession;
import com.mysteryhub.gameservice.games.mystery.domain.repository.SessionArchiveRepository;
import com.mysteryhub.gameservice.games.mystery.service.SessionEventListener;
import com.mysteryhub.gameservice.games.mystery.service.SessionPolicy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 会话注册表
 * ----------------------------------------
 * 进程内 sessionId -> GameSession 映射，只管生命周期（创建 / 查找 / 过期），不含任何游戏规则。
 *
 * - 房间码：8 位大写字母数字，去掉易混淆的 0/O/1/I，SecureRandom 生成，与活跃会话查重；
 * - 查找未命中时尝试从归档恢复（服务重启场景），恢复后所有玩家为离线；
 * - 驱逐时在会话互斥区内关闭会话，之后通知监听方（断开连接、删除归档）。
 */
@Slf4j
@Component
public class SessionRegistry {

    static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 8;
    private static final int MAX_CODE_ATTEMPTS = 32;

    private final ConcurrentMap<String, GameSession> sessions = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();

    private final Optional<SessionArchiveRepository> archive;
    private final List<SessionEventListener> listeners;
    private final SessionPolicy policy;

    public SessionRegistry(Optional<SessionArchiveRepository> archive,
                           List<SessionEventListener> listeners,
                           SessionPolicy policy) {
        this.archive = archive;
        this.listeners = listeners;
        this.policy = policy;
    }

    /**
     * 创建并登记一个空会话（尚无玩家）
     */
    public GameSession create(String storyId, Instant now) {
        for (int i = 0; i < MAX_CODE_ATTEMPTS; i++) {
            String code = nextCode();
            GameSession session = new GameSession(code, storyId, now);
            if (sessions.putIfAbsent(code, session) == null) {
                return session;
            }
            log.debug("房间码冲突，重新生成: code={}", code);
        }
        throw new IllegalStateException("无法生成唯一房间码");
    }

    /**
     * 查找会话；内存未命中时尝试从归档恢复
     */
    public Optional<GameSession> find(String sessionId) {
        String id = normalize(sessionId);
        if (id == null) {
            return Optional.empty();
        }
        GameSession live = sessions.get(id);
        if (live != null) {
            return Optional.of(live);
        }
        return restore(id);
    }

    /**
     * @throws GameException SESSION_NOT_FOUND
     */
    public GameSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> GameException.of(GameError.SESSION_NOT_FOUND,
                GameMessages.format(GameMessages.SESSION_NOT_FOUND, sessionId)));
    }

    public boolean contains(String sessionId) {
        String id = normalize(sessionId);
        return id != null && sessions.containsKey(id);
    }

    public int size() {
        return sessions.size();
    }

    /**
     * 驱逐会话：互斥区内移出注册表并标记关闭，再通知监听方
     * 已进入互斥区的变更先提交完，其归档写入排在删除之前
     *
     * @return 是否确实移除了
     */
    public boolean evict(String sessionId, String reason) {
        GameSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        boolean removed = session.exclusive(() -> retire(session));
        if (removed) {
            notifyEvicted(sessionId, reason);
        }
        return removed;
    }

    /**
     * 过期清理：
     *  - 无人在线且空闲超过 idleTtl；
     *  - 已结束且空闲超过 finishedTtl。
     * 判定与移除在同一互斥区内完成。
     *
     * @return 被移除的会话ID
     */
    public List<String> sweep(Instant now, Duration idleTtl, Duration finishedTtl) {
        List<String> expired = new ArrayList<>();
        for (GameSession session : sessions.values()) {
            boolean removed = session.exclusive(() -> isStale(session, now, idleTtl, finishedTtl) && retire(session));
            if (removed) {
                expired.add(session.getId());
            }
        }
        expired.forEach(id -> notifyEvicted(id, "expired"));
        return expired;
    }

    private static boolean isStale(GameSession session, Instant now, Duration idleTtl, Duration finishedTtl) {
        Duration idle = Duration.between(session.getLastActivityAt(), now);
        if (session.getStatus() == SessionStatus.FINISHED && idle.compareTo(finishedTtl) > 0) {
            return true;
        }
        return session.connectedCount() == 0 && idle.compareTo(idleTtl) > 0;
    }

    /** 持锁调用 */
    private boolean retire(GameSession session) {
        if (!sessions.remove(session.getId(), session)) {
            return false;
        }
        session.close();
        return true;
    }

    private void notifyEvicted(String sessionId, String reason) {
        log.info("会话已移除: sessionId={}, reason={}", sessionId, reason);
        for (SessionEventListener l : listeners) {
            try {
                l.onSessionEvicted(sessionId, reason);
            } catch (RuntimeException e) {
                log.warn("会话移除回调失败: sessionId={}, listener={}", sessionId, l.getClass().getSimpleName(), e);
            }
        }
    }

    private Optional<GameSession> restore(String id) {
        if (archive.isEmpty()) {
            return Optional.empty();
        }
        try {
            return archive.get().find(id).map(record -> {
                GameSession restored = SessionRecordConverter.toSession(record, policy.chatHistorySize());
                GameSession winner = sessions.putIfAbsent(id, restored);
                if (winner == null) {
                    log.info("会话已从归档恢复: sessionId={}", id);
                    return restored;
                }
                return winner;
            });
        } catch (RuntimeException e) {
            log.warn("从归档恢复会话失败: sessionId={}", id, e);
            return Optional.empty();
        }
    }

    private String nextCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    private static String normalize(String sessionId) {
        String trimmed = StringUtils.trimToNull(sessionId);
        return trimmed == null ? null : trimmed.toUpperCase(Locale.ROOT);
    }
}
