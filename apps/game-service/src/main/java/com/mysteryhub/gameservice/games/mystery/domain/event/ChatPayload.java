package com.mysteryhub.gameservice.games.mystery.domain.event;

/**
 * chat 载荷，也用作全量状态中的最近聊天记录
 *
 * @param timestamp 发送时间（epoch ms）
 */
public record ChatPayload(String senderId, String senderName, String content, long timestamp) {
}
