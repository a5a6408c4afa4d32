package com.mysteryhub.gameservice.games.mystery.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * 业务错误类型
 * ----------------------------------------
 * 都是可预期、可恢复的情况，同步返回给请求方，不会让会话崩溃；
 * 只有 SESSION_CORRUPTED 表示单个会话内部不变量被破坏。
 */
public enum GameError {

    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND),
    STORY_NOT_FOUND(HttpStatus.NOT_FOUND),
    PLAYER_NOT_FOUND(HttpStatus.NOT_FOUND),
    CHARACTER_NOT_FOUND(HttpStatus.NOT_FOUND),

    SESSION_FULL(HttpStatus.CONFLICT),
    SESSION_ALREADY_STARTED(HttpStatus.CONFLICT),
    CHARACTER_TAKEN(HttpStatus.CONFLICT),
    PLAYERS_NOT_READY(HttpStatus.CONFLICT),
    WRONG_PHASE(HttpStatus.CONFLICT),
    INVALID_PHASE(HttpStatus.CONFLICT),

    NOT_HOST(HttpStatus.FORBIDDEN),

    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),

    SESSION_CORRUPTED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    GameError(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
