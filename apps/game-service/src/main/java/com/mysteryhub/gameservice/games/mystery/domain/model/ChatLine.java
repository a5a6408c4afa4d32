package com.mysteryhub.gameservice.games.mystery.domain.model;

import java.time.Instant;

/**
 * 一条聊天记录（仅用于断线重连后的当前状态同步，不属于对局状态）
 */
public record ChatLine(String senderId, String senderName, String content, Instant sentAt) {
}
