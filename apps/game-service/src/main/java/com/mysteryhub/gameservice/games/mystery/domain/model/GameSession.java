package com.mysteryhub.gameservice.games.mystery.domain.model;

import com.mysteryhub.gameservice.games.mystery.domain.constants.GameMessages;
import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.enums.SessionStatus;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.gameservice.games.mystery.domain.exception.SessionCorruptedException;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 一局游戏（会话）
 * ----------------------------------------
 * 该对象是这局游戏的唯一事实来源：玩家名单、阶段、角色绑定、已发现线索。
 *
 * 并发约定：
 *  - 所有读写都必须在 {@link #exclusive(Supplier)} 内进行；
 *  - 同一会话的操作逐个执行，不同会话之间互不影响；
 *  - 互斥区内不做任何外部 I/O。
 */
public class GameSession {

    private final String id;
    private final String storyId;
    private final Instant createdAt;

    /** 会话互斥锁（公平锁，先到先得） */
    private final ReentrantLock lock = new ReentrantLock(true);

    private SessionStatus status = SessionStatus.WAITING;
    private GamePhase phase = GamePhase.LOBBY;
    private String hostId;

    /** playerId -> Player，插入顺序即加入顺序 */
    private final Map<String, Player> players = new LinkedHashMap<>();
    /** characterId -> playerId，两个方向都是单射 */
    private final Map<String, String> characterAssignments = new LinkedHashMap<>();
    /** clueId -> 发现记录，只增不减 */
    private final Map<String, DiscoveredClue> discoveredClues = new LinkedHashMap<>();
    /** voterId -> 嫌疑人 characterId */
    private final Map<String, String> votes = new LinkedHashMap<>();
    private final Deque<ChatLine> chatHistory = new ArrayDeque<>();

    private Instant lastActivityAt;
    /** 本会话广播事件的递增序号 */
    private long eventSeq;
    /** 已被注册表驱逐（过期或状态损坏） */
    private volatile boolean closed;

    public GameSession(String id, String storyId, Instant createdAt) {
        this.id = id;
        this.storyId = storyId;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    // ====== 互斥区 ======

    /**
     * 在会话互斥区内执行一段读改写逻辑
     */
    public <T> T exclusive(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("会话 " + id + " 的状态只能在互斥区内访问");
        }
    }

    // ====== 只读访问 ======

    public String getId() {
        return id;
    }

    public String getStoryId() {
        return storyId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isClosed() {
        return closed;
    }

    public SessionStatus getStatus() {
        requireLock();
        return status;
    }

    public GamePhase getPhase() {
        requireLock();
        return phase;
    }

    public String getHostId() {
        requireLock();
        return hostId;
    }

    public Instant getLastActivityAt() {
        requireLock();
        return lastActivityAt;
    }

    public long getEventSeq() {
        requireLock();
        return eventSeq;
    }

    public List<Player> players() {
        requireLock();
        return List.copyOf(players.values());
    }

    public int playerCount() {
        requireLock();
        return players.size();
    }

    public Optional<Player> findPlayer(String playerId) {
        requireLock();
        return playerId == null ? Optional.empty() : Optional.ofNullable(players.get(playerId));
    }

    public Player requirePlayer(String playerId) {
        return findPlayer(playerId).orElseThrow(
                () -> GameException.of(GameError.PLAYER_NOT_FOUND, GameMessages.PLAYER_NOT_FOUND));
    }

    public long connectedCount() {
        requireLock();
        return players.values().stream().filter(Player::isConnected).count();
    }

    public Map<String, String> characterAssignments() {
        requireLock();
        return Map.copyOf(characterAssignments);
    }

    public Optional<String> holderOf(String characterId) {
        requireLock();
        return Optional.ofNullable(characterAssignments.get(characterId));
    }

    public Collection<DiscoveredClue> discoveredClues() {
        requireLock();
        return List.copyOf(discoveredClues.values());
    }

    public Optional<DiscoveredClue> findDiscoveredClue(String clueId) {
        requireLock();
        return Optional.ofNullable(discoveredClues.get(clueId));
    }

    public Map<String, String> votes() {
        requireLock();
        return Map.copyOf(votes);
    }

    public List<ChatLine> chatHistory() {
        requireLock();
        return List.copyOf(chatHistory);
    }

    // ====== 状态变更 ======

    /**
     * 追加玩家；host=true 时同时成为房主
     */
    public Player addPlayer(String playerId, String name, boolean host, Instant now) {
        requireLock();
        if (players.containsKey(playerId)) {
            throw new SessionCorruptedException(id, "重复的玩家ID: " + playerId);
        }
        if (host && hostId != null) {
            throw new SessionCorruptedException(id, "房主已存在: " + hostId);
        }
        Player p = new Player(playerId, name, host, now);
        players.put(playerId, p);
        if (host) {
            hostId = playerId;
        }
        return p;
    }

    /**
     * 角色绑定的原子比较并设置：角色空闲或已归本人才能成功，成功后释放本人之前的角色。
     *
     * @return 被释放的旧角色ID（没有则为空）
     * @throws GameException CHARACTER_TAKEN 角色已被其他玩家持有
     */
    public Optional<String> assignCharacter(String playerId, String characterId) {
        requireLock();
        Player p = requirePlayer(playerId);
        String holder = characterAssignments.get(characterId);
        if (holder != null && !holder.equals(playerId)) {
            throw GameException.of(GameError.CHARACTER_TAKEN, GameMessages.CHARACTER_TAKEN);
        }
        if (characterId.equals(p.getCharacterId())) {
            return Optional.empty();
        }
        String previous = p.getCharacterId();
        if (previous != null) {
            characterAssignments.remove(previous);
        }
        characterAssignments.put(characterId, playerId);
        p.setCharacterId(characterId);
        return Optional.ofNullable(previous);
    }

    /**
     * 释放玩家持有的角色
     */
    public Optional<String> releaseCharacter(String playerId) {
        requireLock();
        Player p = requirePlayer(playerId);
        String previous = p.getCharacterId();
        if (previous == null) {
            return Optional.empty();
        }
        characterAssignments.remove(previous);
        p.setCharacterId(null);
        return Optional.of(previous);
    }

    /**
     * 修改在线标记
     *
     * @return 标记是否真的发生了变化
     */
    public boolean setConnected(String playerId, boolean connected) {
        requireLock();
        Player p = requirePlayer(playerId);
        if (p.isConnected() == connected) {
            return false;
        }
        p.setConnected(connected);
        return true;
    }

    /**
     * 迁移到新的状态/阶段；阶段只能前进
     */
    public void moveTo(SessionStatus newStatus, GamePhase newPhase) {
        requireLock();
        if (newPhase != phase
                && PhaseTrack.ORDER.indexOf(newPhase) <= PhaseTrack.ORDER.indexOf(phase)) {
            throw new SessionCorruptedException(id, "阶段不能回退: " + phase + " -> " + newPhase);
        }
        this.status = newStatus;
        this.phase = newPhase;
    }

    /**
     * 记录线索发现
     *
     * @return true 表示首次发现
     */
    public boolean recordClue(DiscoveredClue clue) {
        requireLock();
        return discoveredClues.putIfAbsent(clue.clueId(), clue) == null;
    }

    /**
     * 投票（重复投票覆盖上一票）
     */
    public void castVote(String voterId, String suspectCharacterId) {
        requireLock();
        requirePlayer(voterId);
        votes.put(voterId, suspectCharacterId);
    }

    /**
     * 追加聊天记录，只保留最近 historySize 条
     */
    public void appendChat(ChatLine line, int historySize) {
        requireLock();
        chatHistory.addLast(line);
        while (chatHistory.size() > Math.max(0, historySize)) {
            chatHistory.removeFirst();
        }
    }

    public long nextEventSeq() {
        requireLock();
        return ++eventSeq;
    }

    /** 从归档恢复时回填事件序号 */
    public void restoreEventSeq(long seq) {
        requireLock();
        this.eventSeq = Math.max(this.eventSeq, seq);
    }

    public void touch(Instant now) {
        requireLock();
        if (now != null && (lastActivityAt == null || now.isAfter(lastActivityAt))) {
            lastActivityAt = now;
        }
    }

    public void close() {
        this.closed = true;
    }

    // ====== 不变量 ======

    /**
     * 校验会话不变量，失败说明存在程序错误，只影响当前会话
     *
     * @param storyClueIds 剧本中定义的全部线索ID
     */
    public void verifyInvariants(Set<String> storyClueIds) {
        requireLock();
        if (!players.isEmpty()) {
            long hosts = players.values().stream().filter(Player::isHost).count();
            Player host = hostId == null ? null : players.get(hostId);
            if (hosts != 1 || host == null || !host.isHost()) {
                throw new SessionCorruptedException(id, "房主不唯一或与 hostId 不一致");
            }
        }
        Set<String> holders = new HashSet<>();
        for (Map.Entry<String, String> e : characterAssignments.entrySet()) {
            if (!holders.add(e.getValue())) {
                throw new SessionCorruptedException(id, "玩家持有多个角色: " + e.getValue());
            }
            Player p = players.get(e.getValue());
            if (p == null || !e.getKey().equals(p.getCharacterId())) {
                throw new SessionCorruptedException(id, "角色绑定与玩家记录不一致: " + e.getKey());
            }
        }
        for (Player p : players.values()) {
            if (p.getCharacterId() != null && !p.getId().equals(characterAssignments.get(p.getCharacterId()))) {
                throw new SessionCorruptedException(id, "玩家角色未登记: " + p.getId());
            }
        }
        if (storyClueIds != null && !storyClueIds.containsAll(discoveredClues.keySet())) {
            throw new SessionCorruptedException(id, "出现剧本之外的线索");
        }
        if (phase == GamePhase.ENDED && status != SessionStatus.FINISHED) {
            throw new SessionCorruptedException(id, "ended 阶段的会话必须是 finished 状态");
        }
    }
}
