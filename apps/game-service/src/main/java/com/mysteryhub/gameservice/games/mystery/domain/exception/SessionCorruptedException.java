package com.mysteryhub.gameservice.games.mystery.domain.exception;

/**
 * 会话内部不变量被破坏（属于程序错误）。只影响当前会话：引擎捕获后驱逐该会话。
 */
public class SessionCorruptedException extends IllegalStateException {

    private final String sessionId;

    public SessionCorruptedException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
