package com.mysteryhub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;

/**
 * 公用 Redis 工具类：
 * - 仅提供“原语级”方法；业务键名放在 Repo 层组织
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mysteryhub.archive", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;

    /**
     * 写入键值（无 TTL）
     */
    public boolean set(String key, Object val) {
        redis.opsForValue().set(key, val);
        return true;
    }

    /**
     * 写入键值（带 TTL）
     */
    public boolean setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
        return true;
    }

    /**
     * 获取键值并转换为指定类型；类型不符视为不存在
     */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }
}
