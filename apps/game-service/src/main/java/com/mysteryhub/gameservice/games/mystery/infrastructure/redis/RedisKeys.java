package com.mysteryhub.gameservice.games.mystery.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "mysteryhub:";

    private RedisKeys() {}

    // ---- 会话归档 ----
    public static String session(String sessionId) {
        return PFX + "session:" + sessionId;
    }
}
