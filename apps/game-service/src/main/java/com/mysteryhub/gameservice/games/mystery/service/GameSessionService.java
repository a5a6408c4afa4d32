package com.mysteryhub.gameservice.games.mystery.service;

import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterCard;
import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterSheet;
import com.mysteryhub.gameservice.games.mystery.domain.view.ClueDiscovery;
import com.mysteryhub.gameservice.games.mystery.domain.view.JoinTicket;
import com.mysteryhub.gameservice.games.mystery.domain.view.SessionView;

import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * 剧本杀会话引擎
 * ----------------------------------------
 * 所有对会话状态的修改都经过这里：同一会话内串行执行，变更校验通过后产生广播事件，
 * 再交给 {@link SessionEventListener} 扇出。业务失败统一抛出 GameException。
 */
public interface GameSessionService {

    /**
     * 创建会话，创建者成为房主
     *
     * @throws com.mysteryhub.gameservice.games.mystery.domain.exception.GameException STORY_NOT_FOUND / INVALID_ARGUMENT
     */
    JoinTicket createSession(String storyId, String hostName);

    /**
     * 加入会话（新玩家默认离线，建立连接后才算在线）
     */
    JoinTicket joinSession(String sessionId, String playerName);

    void markConnected(String sessionId, String playerId);

    void markDisconnected(String sessionId, String playerId);

    /**
     * 按连接层的实时情况同步在线标记；liveness 在会话互斥区内求值，
     * 因此并发的上线/掉线最终以最后一次观察到的连接状态为准。
     */
    void syncPresence(String sessionId, String playerId, BooleanSupplier liveness);

    void selectCharacter(String sessionId, String playerId, String characterId);

    void startGame(String sessionId, String requesterId);

    void advancePhase(String sessionId, String requesterId);

    /**
     * 搜证
     *
     * @return 命中的线索；该地点/物品没有线索时为空
     */
    Optional<ClueDiscovery> recordClueFound(String sessionId, String finderId, String locationId, String itemId);

    void relayChat(String sessionId, String senderId, String content);

    void castVote(String sessionId, String voterId, String suspectCharacterId);

    /**
     * 全量状态（按请求者投影：私密信息只给本人）
     */
    SessionView view(String sessionId, String playerId);

    List<CharacterCard> characters(String sessionId);

    /**
     * 请求者本人的角色剧本
     */
    CharacterSheet myCharacter(String sessionId, String playerId);

    /**
     * 玩家是否属于该会话（WebSocket 握手校验用）
     */
    boolean isMember(String sessionId, String playerId);
}
