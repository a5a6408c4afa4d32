package com.mysteryhub.gameservice.infrastructure.redis;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * Redis 序列化配置（Key: String，Value: JSON）。
 * 只在开启会话归档时生效（mysteryhub.archive.enabled，默认开启）。
 * -------------------------------------------------------
 */
@Configuration
@ConditionalOnProperty(prefix = "mysteryhub.archive", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisConfig {

    /**
     * 通用 RedisTemplate（Key 为 String，Value 为任意对象）
     * -------------------------------------------------------
     * Value 使用 GenericJackson2JsonRedisSerializer，携带类型信息，
     * 读取时可直接还原为 SessionRecord。
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }
}
