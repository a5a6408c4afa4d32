package com.mysteryhub.gameservice.games.mystery.domain.dto;

import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.enums.SessionStatus;
import com.mysteryhub.gameservice.games.mystery.domain.model.ChatLine;
import com.mysteryhub.gameservice.games.mystery.domain.model.DiscoveredClue;
import com.mysteryhub.gameservice.games.mystery.domain.model.GameSession;
import com.mysteryhub.gameservice.games.mystery.domain.model.Player;

import java.time.Instant;

/**
 * GameSession 与 SessionRecord 相互转换工具
 * 用于 Redis 归档与服务重启恢复。
 */
public final class SessionRecordConverter {

    private SessionRecordConverter() {
    }

    /** 从会话转为归档记录（调用方须处于会话互斥区内） */
    public static SessionRecord toRecord(GameSession session) {
        SessionRecord r = new SessionRecord();
        r.setId(session.getId());
        r.setStoryId(session.getStoryId());
        r.setStatus(session.getStatus().wireName());
        r.setPhase(session.getPhase().wireName());
        r.setHostId(session.getHostId());
        r.setCreatedAt(session.getCreatedAt().toEpochMilli());
        r.setLastActivityAt(session.getLastActivityAt().toEpochMilli());
        r.setEventSeq(session.getEventSeq());
        for (Player p : session.players()) {
            SessionRecord.PlayerRecord pr = new SessionRecord.PlayerRecord();
            pr.setId(p.getId());
            pr.setName(p.getName());
            pr.setCharacterId(p.getCharacterId());
            pr.setHost(p.isHost());
            pr.setJoinedAt(p.getJoinedAt().toEpochMilli());
            r.getPlayers().add(pr);
        }
        for (DiscoveredClue c : session.discoveredClues()) {
            SessionRecord.ClueRecord cr = new SessionRecord.ClueRecord();
            cr.setClueId(c.clueId());
            cr.setFoundBy(c.foundBy());
            cr.setFoundAt(c.foundAt().toEpochMilli());
            r.getDiscoveredClues().add(cr);
        }
        r.getVotes().putAll(session.votes());
        for (ChatLine line : session.chatHistory()) {
            SessionRecord.ChatRecord chat = new SessionRecord.ChatRecord();
            chat.setSenderId(line.senderId());
            chat.setSenderName(line.senderName());
            chat.setContent(line.content());
            chat.setSentAt(line.sentAt().toEpochMilli());
            r.getChat().add(chat);
        }
        return r;
    }

    /**
     * 从归档记录还原会话；所有玩家恢复为离线。
     * 记录自相矛盾时（重复角色、阶段非法等）抛出异常，由调用方丢弃该记录。
     */
    public static GameSession toSession(SessionRecord r, int chatHistorySize) {
        GameSession session = new GameSession(r.getId(), r.getStoryId(), Instant.ofEpochMilli(r.getCreatedAt()));
        session.exclusive(() -> {
            for (SessionRecord.PlayerRecord pr : r.getPlayers()) {
                session.addPlayer(pr.getId(), pr.getName(), pr.isHost(), Instant.ofEpochMilli(pr.getJoinedAt()));
                if (pr.getCharacterId() != null) {
                    session.assignCharacter(pr.getId(), pr.getCharacterId());
                }
            }
            for (SessionRecord.ClueRecord cr : r.getDiscoveredClues()) {
                session.recordClue(new DiscoveredClue(cr.getClueId(), cr.getFoundBy(), Instant.ofEpochMilli(cr.getFoundAt())));
            }
            r.getVotes().forEach(session::castVote);
            for (SessionRecord.ChatRecord chat : r.getChat()) {
                session.appendChat(new ChatLine(chat.getSenderId(), chat.getSenderName(), chat.getContent(),
                        Instant.ofEpochMilli(chat.getSentAt())), chatHistorySize);
            }
            GamePhase phase = GamePhase.fromWire(r.getPhase());
            SessionStatus status = SessionStatus.fromWire(r.getStatus());
            session.moveTo(status, phase);
            session.restoreEventSeq(r.getEventSeq());
            session.touch(Instant.ofEpochMilli(r.getLastActivityAt()));
            return null;
        });
        return session;
    }
}
