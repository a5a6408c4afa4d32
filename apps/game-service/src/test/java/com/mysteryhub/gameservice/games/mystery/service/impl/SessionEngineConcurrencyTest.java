package com.mysteryhub.gameservice.games.mystery.service.impl;

import com.mysteryhub.gameservice.games.mystery.application.SessionRegistry;
import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterCard;
import com.mysteryhub.gameservice.games.mystery.domain.view.JoinTicket;
import com.mysteryhub.gameservice.games.mystery.service.SessionPolicy;
import com.mysteryhub.gameservice.games.mystery.support.RecordingListener;
import com.mysteryhub.gameservice.platform.transport.Envelope;
import com.mysteryhub.gameservice.platform.transport.EventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.mysteryhub.gameservice.games.mystery.support.GameTestSupport.MANOR;
import static com.mysteryhub.gameservice.games.mystery.support.GameTestSupport.loadStories;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * 同一会话上的并发请求
 */
class SessionEngineConcurrencyTest {

    private RecordingListener listener;
    private GameSessionServiceImpl service;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
        SessionPolicy policy = SessionPolicy.defaults();
        SessionRegistry registry = new SessionRegistry(Optional.empty(), List.of(listener), policy);
        service = new GameSessionServiceImpl(loadStories(), registry, List.of(listener), policy, Clock.systemUTC());
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @RepeatedTest(20)
    void exactlyOnePlayerWinsContestedCharacter() throws Exception {
        JoinTicket host = service.createSession(MANOR, "Host");
        String sid = host.sessionId();
        List<String> contenders = new ArrayList<>();
        contenders.add(host.playerId());
        for (int i = 1; i < 4; i++) {
            contenders.add(service.joinSession(sid, "P" + i).playerId());
        }
        listener.clear();

        CountDownLatch start = new CountDownLatch(1);
        List<Future<GameError>> results = new ArrayList<>();
        for (String playerId : contenders) {
            results.add(pool.submit(attempt(start, () -> service.selectCharacter(sid, playerId, "char-001"))));
        }
        start.countDown();

        int winners = 0;
        for (Future<GameError> f : results) {
            GameError err = f.get(5, TimeUnit.SECONDS);
            if (err == null) {
                winners++;
            } else {
                assertThat(err).isEqualTo(GameError.CHARACTER_TAKEN);
            }
        }
        assertThat(winners).isEqualTo(1);
        assertThat(listener.ofType(EventType.CHARACTER_SELECTED)).hasSize(1);
        assertThat(service.characters(sid)).filteredOn(CharacterCard::taken).hasSize(1);
    }

    @Test
    void concurrentChatGetsUniqueIncreasingSeq() throws Exception {
        JoinTicket host = service.createSession(MANOR, "Host");
        String sid = host.sessionId();
        JoinTicket guest = service.joinSession(sid, "Guest");
        listener.clear();

        CountDownLatch start = new CountDownLatch(1);
        List<Future<GameError>> results = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            String sender = i % 2 == 0 ? host.playerId() : guest.playerId();
            String text = "msg-" + i;
            results.add(pool.submit(attempt(start, () -> service.relayChat(sid, sender, text))));
        }
        start.countDown();
        for (Future<GameError> f : results) {
            assertThat(f.get(5, TimeUnit.SECONDS)).isNull();
        }

        List<Long> seqs = listener.ofType(EventType.CHAT).stream().map(Envelope::seq).toList();
        assertThat(seqs).hasSize(200).doesNotHaveDuplicates().isSorted();
        assertThat(service.view(sid, host.playerId()).lastEventSeq()).isEqualTo(seqs.get(199));
    }

    @Test
    void concurrentAdvanceNeverSkipsPhases() throws Exception {
        JoinTicket host = service.createSession(MANOR, "Host");
        String sid = host.sessionId();
        JoinTicket guest = service.joinSession(sid, "Guest");
        service.selectCharacter(sid, host.playerId(), "char-001");
        service.selectCharacter(sid, guest.playerId(), "char-002");
        service.startGame(sid, host.playerId());
        listener.clear();

        CountDownLatch start = new CountDownLatch(1);
        List<Future<GameError>> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            results.add(pool.submit(attempt(start, () -> service.advancePhase(sid, host.playerId()))));
        }
        start.countDown();
        int ok = 0;
        for (Future<GameError> f : results) {
            GameError err = f.get(5, TimeUnit.SECONDS);
            if (err == null) {
                ok++;
            } else {
                assertThat(err).isEqualTo(GameError.INVALID_PHASE);
            }
        }

        assertThat(ok).isEqualTo(5);
        assertThat(service.view(sid, host.playerId()).phase()).isEqualTo(GamePhase.ENDED);
        assertThat(listener.ofType(EventType.PHASE_CHANGE)).hasSize(5);
    }

    private static Callable<GameError> attempt(CountDownLatch start, Runnable action) {
        return () -> {
            start.await();
            try {
                action.run();
                return null;
            } catch (GameException e) {
                return e.getError();
            }
        };
    }
}
