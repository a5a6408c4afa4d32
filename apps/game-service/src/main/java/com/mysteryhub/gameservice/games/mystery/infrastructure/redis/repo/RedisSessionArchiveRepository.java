package com.mysteryhub.gameservice.games.mystery.infrastructure.redis.repo;

import com.mysteryhub.gameservice.games.mystery.domain.dto.SessionRecord;
import com.mysteryhub.gameservice.games.mystery.domain.repository.SessionArchiveRepository;
import com.mysteryhub.gameservice.games.mystery.infrastructure.redis.RedisKeys;
import com.mysteryhub.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * 基于 Redis 的会话归档：一个会话一个 JSON 值，带 TTL。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mysteryhub.archive", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisSessionArchiveRepository implements SessionArchiveRepository {

    private final RedisOps redisOps;

    @Override
    public void save(SessionRecord record, Duration ttl) {
        String key = RedisKeys.session(record.getId());
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redisOps.set(key, record);
        } else {
            redisOps.setEx(key, record, ttl);
        }
    }

    @Override
    public Optional<SessionRecord> find(String sessionId) {
        return Optional.ofNullable(redisOps.get(RedisKeys.session(sessionId), SessionRecord.class));
    }

    @Override
    public void delete(String sessionId) {
        redisOps.del(RedisKeys.session(sessionId));
    }
}
