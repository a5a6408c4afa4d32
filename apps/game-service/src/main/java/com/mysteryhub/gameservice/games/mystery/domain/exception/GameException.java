package com.mysteryhub.gameservice.games.mystery.domain.exception;

import java.util.Collections;
import java.util.Map;

/**
 * 对局业务异常：携带错误类型与可选细节（如哪些玩家尚未选角）。
 */
public class GameException extends RuntimeException {

    private final GameError error;
    private final Map<String, Object> details;

    public GameException(GameError error, String message) {
        this(error, message, Collections.emptyMap());
    }

    public GameException(GameError error, String message, Map<String, Object> details) {
        super(message);
        this.error = error;
        this.details = details == null ? Collections.emptyMap() : Map.copyOf(details);
    }

    public GameError getError() {
        return error;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public static GameException of(GameError error, String message) {
        return new GameException(error, message);
    }
}
