package com.mysteryhub.gameservice.games.mystery.service.impl;

import com.mysteryhub.gameservice.games.mystery.application.SessionRegistry;
import com.mysteryhub.gameservice.games.mystery.domain.constants.GameMessages;
import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.enums.SessionStatus;
import com.mysteryhub.gameservice.games.mystery.domain.event.CharacterSelectedPayload;
import com.mysteryhub.gameservice.games.mystery.domain.event.ChatPayload;
import com.mysteryhub.gameservice.games.mystery.domain.event.ClueFoundPayload;
import com.mysteryhub.gameservice.games.mystery.domain.event.PhaseChangePayload;
import com.mysteryhub.gameservice.games.mystery.domain.event.PlayerPresencePayload;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.gameservice.games.mystery.domain.exception.SessionCorruptedException;
import com.mysteryhub.gameservice.games.mystery.domain.model.ChatLine;
import com.mysteryhub.gameservice.games.mystery.domain.model.DiscoveredClue;
import com.mysteryhub.gameservice.games.mystery.domain.model.GameSession;
import com.mysteryhub.gameservice.games.mystery.domain.model.PhaseTrack;
import com.mysteryhub.gameservice.games.mystery.domain.model.Player;
import com.mysteryhub.gameservice.games.mystery.domain.repository.StoryRepository;
import com.mysteryhub.gameservice.games.mystery.domain.story.Story;
import com.mysteryhub.gameservice.games.mystery.domain.story.StoryClue;
import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterCard;
import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterSheet;
import com.mysteryhub.gameservice.games.mystery.domain.view.ClueDiscovery;
import com.mysteryhub.gameservice.games.mystery.domain.view.ClueView;
import com.mysteryhub.gameservice.games.mystery.domain.view.JoinTicket;
import com.mysteryhub.gameservice.games.mystery.domain.view.SessionView;
import com.mysteryhub.gameservice.games.mystery.service.GameSessionService;
import com.mysteryhub.gameservice.games.mystery.service.SessionEventListener;
import com.mysteryhub.gameservice.games.mystery.service.SessionPolicy;
import com.mysteryhub.gameservice.platform.transport.Envelope;
import com.mysteryhub.gameservice.platform.transport.EventType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 会话引擎实现
 * ----------------------------------------
 * 每个操作的固定流程（见 {@link #mutate}）：
 *   1. 进入会话互斥区；
 *   2. 校验前置条件（失败直接抛 GameException，此时尚未修改任何状态）；
 *   3. 修改状态并登记待广播事件；
 *   4. 校验会话不变量；
 *   5. 为事件分配序号，通知 {@link SessionEventListener}（扇出、归档）。
 *
 * 不变量被破坏属于程序错误：记录 ERROR，驱逐该会话，其它会话不受影响。
 */
@Slf4j
@Service
public class GameSessionServiceImpl implements GameSessionService {

    /** 玩家名最大长度（去首尾空白后） */
    static final int MAX_NAME_LENGTH = 20;
    /** 开局最少人数下限（剧本要求更高时取剧本要求） */
    static final int MIN_PLAYERS_TO_START = 2;

    private final StoryRepository storyRepository;
    private final SessionRegistry registry;
    private final List<SessionEventListener> listeners;
    private final SessionPolicy policy;
    private final Clock clock;

    public GameSessionServiceImpl(StoryRepository storyRepository,
                                  SessionRegistry registry,
                                  List<SessionEventListener> listeners,
                                  SessionPolicy policy,
                                  Clock clock) {
        this.storyRepository = storyRepository;
        this.registry = registry;
        this.listeners = listeners;
        this.policy = policy;
        this.clock = clock;
    }

    // ====== 生命周期 / 成员 ======

    @Override
    public JoinTicket createSession(String storyId, String hostName) {
        String name = normalizeName(hostName);
        Story story = storyRepository.require(storyId);
        GameSession session = registry.create(story.getId(), clock.instant());
        String hostId = mutate(session, story, tx -> {
            tx.markChanged();
            return session.addPlayer(newPlayerId(), name, true, tx.now).getId();
        });
        log.info("创建房间: sessionId={}, storyId={}, hostId={}", session.getId(), story.getId(), hostId);
        return new JoinTicket(session.getId(), hostId);
    }

    @Override
    public JoinTicket joinSession(String sessionId, String playerName) {
        String name = normalizeName(playerName);
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        String playerId = mutate(session, story, tx -> {
            if (session.getStatus() != SessionStatus.WAITING) {
                throw GameException.of(GameError.SESSION_ALREADY_STARTED, GameMessages.SESSION_ALREADY_STARTED);
            }
            if (session.playerCount() >= story.maxPlayers()) {
                throw GameException.of(GameError.SESSION_FULL,
                        GameMessages.format(GameMessages.SESSION_FULL, story.maxPlayers()));
            }
            Player p = session.addPlayer(newPlayerId(), name, false, tx.now);
            tx.emit(EventType.PLAYER_JOINED,
                    new PlayerPresencePayload(p.getId(), p.getName(), false, PlayerPresencePayload.JOINED));
            return p.getId();
        });
        log.info("玩家加入: sessionId={}, playerId={}, name={}", session.getId(), playerId, name);
        return new JoinTicket(session.getId(), playerId);
    }

    @Override
    public void markConnected(String sessionId, String playerId) {
        syncPresence(sessionId, playerId, () -> true);
    }

    @Override
    public void markDisconnected(String sessionId, String playerId) {
        syncPresence(sessionId, playerId, () -> false);
    }

    @Override
    public void syncPresence(String sessionId, String playerId, BooleanSupplier liveness) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        mutate(session, story, tx -> {
            Player p = session.requirePlayer(playerId);
            boolean connected = liveness.getAsBoolean();
            if (!session.setConnected(playerId, connected)) {
                return null;
            }
            if (connected) {
                tx.emit(EventType.PLAYER_JOINED,
                        new PlayerPresencePayload(p.getId(), p.getName(), true, PlayerPresencePayload.CONNECTED));
                log.debug("玩家上线: sessionId={}, playerId={}", session.getId(), playerId);
                return null;
            }
            tx.emit(EventType.PLAYER_LEFT,
                    new PlayerPresencePayload(p.getId(), p.getName(), false, PlayerPresencePayload.DISCONNECTED));
            log.debug("玩家离线: sessionId={}, playerId={}", session.getId(), playerId);
            // 开局后角色不再释放，否则“人人有角色”的开局前提会被破坏
            if (policy.releaseCharacterOnDisconnect() && session.getStatus() == SessionStatus.WAITING) {
                session.releaseCharacter(playerId).ifPresent(released -> tx.emit(EventType.CHARACTER_SELECTED,
                        new CharacterSelectedPayload(playerId, null, released, session.characterAssignments())));
            }
            return null;
        });
    }

    // ====== 选角 / 开局 ======

    @Override
    public void selectCharacter(String sessionId, String playerId, String characterId) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        mutate(session, story, tx -> {
            Player p = session.requirePlayer(playerId);
            if (session.getStatus() == SessionStatus.FINISHED || !PhaseTrack.isSelectionOpen(session.getPhase())) {
                throw GameException.of(GameError.WRONG_PHASE, GameMessages.SELECTION_CLOSED);
            }
            if (!story.hasCharacter(characterId)) {
                throw GameException.of(GameError.CHARACTER_NOT_FOUND,
                        GameMessages.format(GameMessages.CHARACTER_NOT_FOUND, characterId));
            }
            if (characterId.equals(p.getCharacterId())) {
                return null;
            }
            Optional<String> released = session.assignCharacter(playerId, characterId);
            tx.emit(EventType.CHARACTER_SELECTED, new CharacterSelectedPayload(
                    playerId, characterId, released.orElse(null), session.characterAssignments()));
            log.info("选角: sessionId={}, playerId={}, characterId={}, released={}",
                    session.getId(), playerId, characterId, released.orElse(null));
            return null;
        });
    }

    @Override
    public void startGame(String sessionId, String requesterId) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        mutate(session, story, tx -> {
            requireHost(session, requesterId, GameMessages.ONLY_HOST_CAN_START);
            if (session.getStatus() != SessionStatus.WAITING) {
                throw GameException.of(GameError.SESSION_ALREADY_STARTED, GameMessages.GAME_ALREADY_STARTED);
            }
            int required = Math.max(MIN_PLAYERS_TO_START, story.minPlayers());
            List<Player> players = session.players();
            List<String> withoutCharacter = players.stream()
                    .filter(p -> !p.hasCharacter())
                    .map(Player::getId)
                    .toList();
            if (!withoutCharacter.isEmpty() || players.size() < required) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("playersWithoutCharacter", withoutCharacter);
                details.put("playerCount", players.size());
                details.put("requiredPlayers", required);
                throw new GameException(GameError.PLAYERS_NOT_READY,
                        GameMessages.format(GameMessages.PLAYERS_NOT_READY, required), details);
            }
            transition(session, story, tx, SessionStatus.IN_PROGRESS, PhaseTrack.FIRST_GAMEPLAY_PHASE);
            return null;
        });
    }

    // ====== 阶段 / 搜证 / 聊天 / 投票 ======

    @Override
    public void advancePhase(String sessionId, String requesterId) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        mutate(session, story, tx -> {
            requireHost(session, requesterId, GameMessages.ONLY_HOST_CAN_ADVANCE);
            GamePhase current = session.getPhase();
            GameException invalid = GameException.of(GameError.INVALID_PHASE,
                    GameMessages.format(GameMessages.PHASE_NOT_ADVANCEABLE, current.wireName()));
            if (!PhaseTrack.isAdvanceable(current)) {
                throw invalid;
            }
            GamePhase next = PhaseTrack.next(current).orElseThrow(() -> invalid);
            SessionStatus status = PhaseTrack.isTerminal(next) ? SessionStatus.FINISHED : session.getStatus();
            transition(session, story, tx, status, next);
            return null;
        });
    }

    @Override
    public Optional<ClueDiscovery> recordClueFound(String sessionId, String finderId, String locationId, String itemId) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        return mutate(session, story, tx -> {
            Player finder = session.requirePlayer(finderId);
            if (session.getPhase() != GamePhase.INVESTIGATION) {
                throw GameException.of(GameError.WRONG_PHASE, GameMessages.SEARCH_ONLY_IN_INVESTIGATION);
            }
            Optional<StoryClue> located = story.locateClue(StringUtils.trimToNull(locationId), itemId);
            if (located.isEmpty()) {
                log.debug("搜证未命中: sessionId={}, location={}, item={}", session.getId(), locationId, itemId);
                return Optional.empty();
            }
            StoryClue clue = located.get();
            Optional<DiscoveredClue> existing = session.findDiscoveredClue(clue.getId());
            if (existing.isPresent()) {
                return Optional.of(new ClueDiscovery(ClueView.of(clue, existing.get()), false));
            }
            DiscoveredClue discovery = new DiscoveredClue(clue.getId(), finder.getId(), tx.now);
            session.recordClue(discovery);
            ClueView view = ClueView.of(clue, discovery);
            tx.emit(EventType.CLUE_FOUND, new ClueFoundPayload(finder.getId(), finder.getName(), view));
            log.info("发现线索: sessionId={}, clueId={}, finder={}", session.getId(), clue.getId(), finder.getId());
            return Optional.of(new ClueDiscovery(view, true));
        });
    }

    @Override
    public void relayChat(String sessionId, String senderId, String content) {
        String text = StringUtils.strip(content);
        if (StringUtils.isEmpty(text)) {
            throw GameException.of(GameError.INVALID_ARGUMENT, GameMessages.CHAT_EMPTY);
        }
        String clipped = StringUtils.truncate(text, policy.chatMaxLength());
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        mutate(session, story, tx -> {
            Player sender = session.requirePlayer(senderId);
            session.appendChat(new ChatLine(sender.getId(), sender.getName(), clipped, tx.now), policy.chatHistorySize());
            tx.emit(EventType.CHAT,
                    new ChatPayload(sender.getId(), sender.getName(), clipped, tx.now.toEpochMilli()));
            return null;
        });
    }

    @Override
    public void castVote(String sessionId, String voterId, String suspectCharacterId) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        mutate(session, story, tx -> {
            session.requirePlayer(voterId);
            if (session.getPhase() != GamePhase.VOTING) {
                throw GameException.of(GameError.WRONG_PHASE, GameMessages.VOTE_ONLY_IN_VOTING);
            }
            if (!story.hasCharacter(suspectCharacterId)) {
                throw GameException.of(GameError.CHARACTER_NOT_FOUND,
                        GameMessages.format(GameMessages.CHARACTER_NOT_FOUND, suspectCharacterId));
            }
            session.castVote(voterId, suspectCharacterId);
            tx.markChanged();
            log.debug("投票: sessionId={}, voterId={}", session.getId(), voterId);
            return null;
        });
    }

    // ====== 查询 ======

    @Override
    public SessionView view(String sessionId, String playerId) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        return read(session, () -> SessionProjector.project(session, story, playerId));
    }

    @Override
    public List<CharacterCard> characters(String sessionId) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        return read(session, () -> SessionProjector.characterCards(session, story));
    }

    @Override
    public CharacterSheet myCharacter(String sessionId, String playerId) {
        GameSession session = registry.require(sessionId);
        Story story = storyOf(session);
        String characterId = read(session, () -> session.requirePlayer(playerId).getCharacterId());
        if (characterId == null) {
            throw GameException.of(GameError.CHARACTER_NOT_FOUND, GameMessages.NO_CHARACTER_SELECTED);
        }
        return story.findCharacter(characterId)
                .map(CharacterSheet::of)
                .orElseThrow(() -> GameException.of(GameError.CHARACTER_NOT_FOUND,
                        GameMessages.format(GameMessages.CHARACTER_NOT_FOUND, characterId)));
    }

    @Override
    public boolean isMember(String sessionId, String playerId) {
        Optional<GameSession> session = registry.find(sessionId);
        return session.isPresent()
                && !session.get().isClosed()
                && session.get().exclusive(() -> session.get().findPlayer(playerId).isPresent());
    }

    // ====== 内部 ======

    /**
     * 一次状态变更（互斥区内）
     */
    private <T> T mutate(GameSession session, Story story, Function<Transition, T> work) {
        try {
            return session.exclusive(() -> {
                ensureOpen(session);
                Transition tx = new Transition(clock.instant());
                T result = work.apply(tx);
                if (!tx.changed) {
                    return result;
                }
                session.verifyInvariants(story.clueIds());
                session.touch(tx.now);
                long ts = tx.now.toEpochMilli();
                List<Envelope<?>> events = new ArrayList<>(tx.pending.size());
                for (PendingEvent e : tx.pending) {
                    events.add(Envelope.of(e.type(), session.getId(), session.nextEventSeq(), ts, e.payload()));
                }
                publish(session, events);
                return result;
            });
        } catch (SessionCorruptedException e) {
            log.error("会话状态损坏，关闭该会话: sessionId={}", session.getId(), e);
            registry.evict(session.getId(), "corrupted");
            throw GameException.of(GameError.SESSION_CORRUPTED, GameMessages.SESSION_CORRUPTED);
        }
    }

    /**
     * 只读访问（互斥区内拷贝出视图）
     */
    private <T> T read(GameSession session, Supplier<T> work) {
        return session.exclusive(() -> {
            ensureOpen(session);
            return work.get();
        });
    }

    private void publish(GameSession session, List<Envelope<?>> events) {
        for (SessionEventListener l : listeners) {
            try {
                l.afterCommit(session, events);
            } catch (RuntimeException e) {
                log.warn("提交后回调失败（状态已生效）: sessionId={}, listener={}",
                        session.getId(), l.getClass().getSimpleName(), e);
            }
        }
    }

    private void transition(GameSession session, Story story, Transition tx, SessionStatus status, GamePhase next) {
        GamePhase previous = session.getPhase();
        session.moveTo(status, next);
        tx.emit(EventType.PHASE_CHANGE, new PhaseChangePayload(next, previous, status, story.narrationFor(next)));
        log.info("阶段变化: sessionId={}, {} -> {}, status={}", session.getId(),
                previous.wireName(), next.wireName(), status.wireName());
    }

    private static void requireHost(GameSession session, String requesterId, String message) {
        if (requesterId == null || !requesterId.equals(session.getHostId())) {
            throw GameException.of(GameError.NOT_HOST, message);
        }
    }

    private static void ensureOpen(GameSession session) {
        if (session.isClosed()) {
            throw GameException.of(GameError.SESSION_NOT_FOUND,
                    GameMessages.format(GameMessages.SESSION_NOT_FOUND, session.getId()));
        }
    }

    private Story storyOf(GameSession session) {
        return storyRepository.require(session.getStoryId());
    }

    private static String normalizeName(String raw) {
        String name = StringUtils.strip(raw);
        if (StringUtils.isEmpty(name)) {
            throw GameException.of(GameError.INVALID_ARGUMENT, GameMessages.NAME_REQUIRED);
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw GameException.of(GameError.INVALID_ARGUMENT,
                    GameMessages.format(GameMessages.NAME_TOO_LONG, MAX_NAME_LENGTH));
        }
        return name;
    }

    private static String newPlayerId() {
        return UUID.randomUUID().toString();
    }

    /** 待广播事件（序号在校验通过后分配） */
    private record PendingEvent(EventType type, Object payload) {
    }

    /** 单次变更的上下文：统一的时间戳 + 待广播事件 */
    private static final class Transition {
        private final Instant now;
        private final List<PendingEvent> pending = new ArrayList<>();
        private boolean changed;

        private Transition(Instant now) {
            this.now = now;
        }

        private void emit(EventType type, Object payload) {
            pending.add(new PendingEvent(type, payload));
            changed = true;
        }

        /** 无广播但状态有变化（仍需校验与归档） */
        private void markChanged() {
            changed = true;
        }
    }
}
