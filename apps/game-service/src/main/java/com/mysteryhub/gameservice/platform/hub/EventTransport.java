package com.mysteryhub.gameservice.platform.hub;

import com.mysteryhub.gameservice.platform.transport.Envelope;

/**
 * 连接层的实际写出通道（STOMP 实现见 platform.ws）
 */
public interface EventTransport {

    /**
     * 向单个连接写出一条事件；失败时抛出异常，由 Hub 判定该连接失效
     */
    void send(PlayerConnection connection, Envelope<?> envelope);

    /**
     * 关闭连接（被顶替、会话移除、写失败）
     */
    void close(PlayerConnection connection);
}
