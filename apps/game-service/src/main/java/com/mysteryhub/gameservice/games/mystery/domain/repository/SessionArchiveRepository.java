package com.mysteryhub.gameservice.games.mystery.domain.repository;

import com.mysteryhub.gameservice.games.mystery.domain.dto.SessionRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * SessionArchiveRepository
 * ----------------------------------------
 * 会话归档仓储：尽力而为的持久化，用于服务重启后恢复房间。
 * 内存中的会话始终是权威状态，归档失败不影响对局。
 */
public interface SessionArchiveRepository {

    /**
     * 保存归档
     * @param ttl 过期时间（为空则永久）
     */
    void save(SessionRecord record, Duration ttl);

    Optional<SessionRecord> find(String sessionId);

    void delete(String sessionId);
}
