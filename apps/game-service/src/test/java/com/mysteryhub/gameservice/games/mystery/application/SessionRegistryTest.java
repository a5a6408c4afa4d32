package com.mysteryhub.gameservice.games.mystery.application;

import com.mysteryhub.gameservice.games.mystery.domain.dto.SessionRecord;
import com.mysteryhub.gameservice.games.mystery.domain.dto.SessionRecordConverter;
import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.enums.SessionStatus;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.model.GameSession;
import com.mysteryhub.gameservice.games.mystery.domain.repository.SessionArchiveRepository;
import com.mysteryhub.gameservice.games.mystery.domain.view.JoinTicket;
import com.mysteryhub.gameservice.games.mystery.service.SessionEventListener;
import com.mysteryhub.gameservice.games.mystery.service.SessionPolicy;
import com.mysteryhub.gameservice.games.mystery.service.impl.GameSessionServiceImpl;
import com.mysteryhub.gameservice.games.mystery.support.RecordingListener;
import com.mysteryhub.gameservice.platform.transport.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.mysteryhub.gameservice.games.mystery.support.GameTestSupport.MANOR;
import static com.mysteryhub.gameservice.games.mystery.support.GameTestSupport.errorOf;
import static com.mysteryhub.gameservice.games.mystery.support.GameTestSupport.loadStories;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration IDLE = Duration.ofMinutes(30);
    private static final Duration FINISHED = Duration.ofMinutes(10);

    private RecordingListener listener;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
        registry = new SessionRegistry(Optional.empty(), List.of(listener), SessionPolicy.defaults());
    }

    @Test
    void codesAreShortUnambiguousAndUnique() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String code = registry.create("midnight-manor", T0).getId();
            assertThat(code).hasSize(SessionRegistry.CODE_LENGTH);
            assertThat(code.chars()).allMatch(c -> SessionRegistry.CODE_ALPHABET.indexOf(c) >= 0);
            codes.add(code);
        }
        assertThat(codes).hasSize(500);
        assertThat(registry.size()).isEqualTo(500);
    }

    @Test
    void lookupNormalizesCode() {
        GameSession s = registry.create("midnight-manor", T0);
        assertThat(registry.find("  " + s.getId().toLowerCase() + " ")).containsSame(s);
        assertThat(registry.find(null)).isEmpty();
        assertThat(errorOf(() -> registry.require("NOPE2345"))).isEqualTo(GameError.SESSION_NOT_FOUND);
    }

    @Test
    void evictClosesAndNotifiesOnce() {
        GameSession s = registry.create("midnight-manor", T0);

        assertThat(registry.evict(s.getId(), "test")).isTrue();
        assertThat(registry.evict(s.getId(), "test")).isFalse();

        assertThat(s.isClosed()).isTrue();
        assertThat(registry.contains(s.getId())).isFalse();
        assertThat(listener.evicted()).containsExactly(s.getId());
    }

    @Test
    void sweepRemovesIdleAndFinishedSessionsOnly() {
        GameSession idle = withHost(registry.create("midnight-manor", T0), false);
        GameSession online = withHost(registry.create("midnight-manor", T0), true);
        GameSession fresh = withHost(registry.create("midnight-manor", T0.plus(Duration.ofMinutes(25))), false);
        GameSession finished = withHost(registry.create("midnight-manor", T0.plus(Duration.ofMinutes(25))), true);
        finished.exclusive(() -> {
            finished.moveTo(SessionStatus.FINISHED, GamePhase.ENDED);
            return null;
        });

        List<String> expired = registry.sweep(T0.plus(Duration.ofMinutes(40)), IDLE, FINISHED);

        assertThat(expired).containsExactlyInAnyOrder(idle.getId(), finished.getId());
        assertThat(registry.contains(online.getId())).isTrue();
        assertThat(registry.contains(fresh.getId())).isTrue();
        assertThat(listener.evicted()).containsExactlyInAnyOrder(idle.getId(), finished.getId());
    }

    @Test
    void evictionWaitsForInFlightCommitAndArchiveStaysDeleted() throws Exception {
        InMemoryArchive store = new InMemoryArchive();
        SessionArchiver archiver = new SessionArchiver(store, Runnable::run, Duration.ofHours(6));
        GatedListener gate = new GatedListener();
        SessionPolicy policy = SessionPolicy.defaults();
        SessionRegistry archived = new SessionRegistry(Optional.of(store), List.of(archiver), policy);
        GameSessionServiceImpl service = new GameSessionServiceImpl(
                loadStories(), archived, List.of(gate, archiver), policy, Clock.systemUTC());
        JoinTicket host = service.createSession(MANOR, "Holmes");
        String sid = host.sessionId();
        assertThat(store.records).containsKey(sid);

        gate.arm();
        FutureTask<Void> reconnect = new FutureTask<>(() -> service.markConnected(sid, host.playerId()), null);
        new Thread(reconnect, "reconnect").start();
        assertThat(gate.entered.await(5, TimeUnit.SECONDS)).isTrue();

        FutureTask<Boolean> eviction = new FutureTask<>(() -> archived.evict(sid, "expired"));
        Thread evictor = new Thread(eviction, "evictor");
        evictor.start();
        awaitBlocked(evictor);
        assertThat(archived.contains(sid)).isTrue();

        gate.release.countDown();
        reconnect.get(5, TimeUnit.SECONDS);
        assertThat(eviction.get(5, TimeUnit.SECONDS)).isTrue();

        assertThat(store.records).doesNotContainKey(sid);
        assertThat(archived.find(sid)).isEmpty();
        assertThat(errorOf(() -> service.markConnected(sid, host.playerId()))).isEqualTo(GameError.SESSION_NOT_FOUND);
    }

    @Test
    void sweepSkipsSessionEvictedMeanwhile() {
        GameSession idle = withHost(registry.create("midnight-manor", T0), false);
        registry.evict(idle.getId(), "test");

        assertThat(registry.sweep(T0.plus(Duration.ofHours(2)), IDLE, FINISHED)).isEmpty();
        assertThat(listener.evicted()).containsExactly(idle.getId());
    }

    @Test
    void restoresFromArchiveWithEveryoneOffline() {
        GameSession original = new GameSession("RESTORE2", "midnight-manor", T0);
        SessionRecord record = original.exclusive(() -> {
            original.addPlayer("p1", "Holmes", true, T0);
            original.addPlayer("p2", "Watson", false, T0);
            original.setConnected("p1", true);
            original.assignCharacter("p1", "char-001");
            original.moveTo(SessionStatus.IN_PROGRESS, GamePhase.INVESTIGATION);
            original.nextEventSeq();
            original.nextEventSeq();
            return SessionRecordConverter.toRecord(original);
        });
        SessionArchiveRepository archive = mock(SessionArchiveRepository.class);
        when(archive.find(anyString())).thenReturn(Optional.empty());
        when(archive.find("RESTORE2")).thenReturn(Optional.of(record));
        SessionRegistry restoring = new SessionRegistry(Optional.of(archive), List.of(listener), SessionPolicy.defaults());

        GameSession restored = restoring.require("restore2");

        assertThat(restoring.require("RESTORE2")).isSameAs(restored);
        restored.exclusive(() -> {
            assertThat(restored.getPhase()).isEqualTo(GamePhase.INVESTIGATION);
            assertThat(restored.getHostId()).isEqualTo("p1");
            assertThat(restored.holderOf("char-001")).contains("p1");
            assertThat(restored.connectedCount()).isZero();
            assertThat(restored.nextEventSeq()).isEqualTo(3);
            return null;
        });
        assertThat(restoring.find("MISSING2")).isEmpty();
    }

    @Test
    void brokenArchiveRecordIsIgnored() {
        SessionArchiveRepository archive = mock(SessionArchiveRepository.class);
        when(archive.find(anyString())).thenThrow(new IllegalStateException("redis down"));
        SessionRegistry restoring = new SessionRegistry(Optional.of(archive), List.of(), SessionPolicy.defaults());

        assertThat(restoring.find("ABCDEFGH")).isEmpty();
    }

    private static GameSession withHost(GameSession session, boolean online) {
        session.exclusive(() -> {
            session.addPlayer("host", "Host", true, session.getCreatedAt());
            session.setConnected("host", online);
            return null;
        });
        return session;
    }

    private static void awaitBlocked(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.WAITING) {
            assertThat(System.nanoTime()).isLessThan(deadline);
            Thread.sleep(5);
        }
    }

    /** 提交后回调里停住，模拟正在提交的变更 */
    private static final class GatedListener implements SessionEventListener {

        private final AtomicBoolean armed = new AtomicBoolean();
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        void arm() {
            armed.set(true);
        }

        @Override
        public void afterCommit(GameSession session, List<Envelope<?>> events) {
            if (!armed.compareAndSet(true, false)) {
                return;
            }
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final class InMemoryArchive implements SessionArchiveRepository {

        private final Map<String, SessionRecord> records = new ConcurrentHashMap<>();

        @Override
        public void save(SessionRecord record, Duration ttl) {
            records.put(record.getId(), record);
        }

        @Override
        public Optional<SessionRecord> find(String sessionId) {
            return Optional.ofNullable(records.get(sessionId));
        }

        @Override
        public void delete(String sessionId) {
            records.remove(sessionId);
        }
    }
}
