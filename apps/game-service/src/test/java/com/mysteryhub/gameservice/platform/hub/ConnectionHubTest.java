package com.mysteryhub.gameservice.platform.hub;

import com.mysteryhub.gameservice.platform.transport.Envelope;
import com.mysteryhub.gameservice.platform.transport.EventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionHubTest {

    private static final String SID = "ROOM2345";

    private ExecutorService executor;
    private FakeTransport transport;
    private ConnectionHub hub;
    private final List<String> lost = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        transport = new FakeTransport();
        hub = new ConnectionHub(transport, executor);
        hub.setConnectionLostHandler((sessionId, playerId) -> lost.add(sessionId + "/" + playerId));
    }

    @AfterEach
    void tearDown() {
        transport.release();
        executor.shutdownNow();
    }

    @Test
    void eachConnectionSeesEventsInCommitOrder() throws Exception {
        hub.register(SID, "p1", "c1");
        hub.register(SID, "p2", "c2");

        for (int batch = 0; batch < 50; batch++) {
            hub.broadcast(SID, List.of(event(batch * 2 + 1), event(batch * 2 + 2)));
        }

        transport.awaitCount("c1", 100);
        transport.awaitCount("c2", 100);
        assertThat(transport.seqs("c1")).isSorted().hasSize(100);
        assertThat(transport.seqs("c2")).isSorted().hasSize(100);
    }

    @Test
    void slowConnectionDoesNotBlockOthers() throws Exception {
        hub.register(SID, "slow", "c-slow");
        hub.register(SID, "fast", "c-fast");
        transport.block("c-slow");

        hub.broadcast(SID, List.of(event(1)));
        hub.broadcast(SID, List.of(event(2)));

        transport.awaitCount("c-fast", 2);
        assertThat(transport.seqs("c-slow")).isEmpty();

        transport.release();
        transport.awaitCount("c-slow", 2);
        assertThat(transport.seqs("c-slow")).containsExactly(1L, 2L);
    }

    @Test
    void failedSendDropsConnectionAndReportsOnce() throws Exception {
        hub.register(SID, "p1", "c1");
        hub.register(SID, "p2", "c2");
        transport.failOn("c2");

        hub.broadcast(SID, List.of(event(1), event(2)));
        hub.broadcast(SID, List.of(event(3)));

        transport.awaitCount("c1", 3);
        transport.awaitClosed("c2");
        awaitLost(1);
        assertThat(lost).containsExactly(SID + "/p2");
        assertThat(hub.isConnected(SID, "p2")).isFalse();
        assertThat(hub.connectedPlayers(SID)).containsExactly("p1");
    }

    @Test
    void newConnectionReplacesOld() throws Exception {
        PlayerConnection first = hub.register(SID, "p1", "c1");
        hub.register(SID, "p1", "c1b");

        transport.awaitClosed("c1");
        assertThat(first.isAlive()).isFalse();

        // 旧连接迟到的断开不影响新连接
        assertThat(hub.unregister(SID, "p1", "c1")).isFalse();
        assertThat(hub.isConnected(SID, "p1")).isTrue();

        hub.sendTo(SID, "p1", event(7));
        transport.awaitCount("c1b", 1);
        assertThat(transport.seqs("c1")).isEmpty();

        assertThat(hub.unregister(SID, "p1", "c1b")).isTrue();
        assertThat(hub.connectedPlayers(SID)).isEmpty();
        assertThat(lost).isEmpty();
    }

    @Test
    void closeSessionClosesEveryConnection() throws Exception {
        hub.register(SID, "p1", "c1");
        hub.register(SID, "p2", "c2");
        hub.register("OTHER234", "p3", "c3");

        hub.closeSession(SID);

        transport.awaitClosed("c1");
        transport.awaitClosed("c2");
        assertThat(transport.closedCount("c3")).isZero();
        assertThat(hub.connectedPlayers(SID)).isEmpty();

        hub.broadcast(SID, List.of(event(1)));
        hub.broadcast("NOBODY23", List.of(event(1)));
        assertThat(transport.seqs("c1")).isEmpty();
    }

    private void awaitLost(int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (lost.size() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
    }

    private static Envelope<String> event(long seq) {
        return Envelope.of(EventType.CHAT, SID, seq, 0L, "m" + seq);
    }

    /**
     * 记录每个连接收到的事件；可让某个连接阻塞或写失败
     */
    private static final class FakeTransport implements EventTransport {

        private final Map<String, List<Long>> sent = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> closed = new ConcurrentHashMap<>();
        private final Set<String> failing = ConcurrentHashMap.newKeySet();
        private final Set<String> blocked = ConcurrentHashMap.newKeySet();
        private final CountDownLatch gate = new CountDownLatch(1);

        @Override
        public void send(PlayerConnection connection, Envelope<?> envelope) {
            String id = connection.connectionId();
            if (failing.contains(id)) {
                throw new IllegalStateException("broken pipe");
            }
            if (blocked.contains(id)) {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            sent.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(envelope.seq());
        }

        @Override
        public void close(PlayerConnection connection) {
            closed.computeIfAbsent(connection.connectionId(), k -> new AtomicInteger()).incrementAndGet();
        }

        void block(String connectionId) {
            blocked.add(connectionId);
        }

        void failOn(String connectionId) {
            failing.add(connectionId);
        }

        void release() {
            gate.countDown();
        }

        List<Long> seqs(String connectionId) {
            return new ArrayList<>(sent.getOrDefault(connectionId, List.of()));
        }

        int closedCount(String connectionId) {
            AtomicInteger n = closed.get(connectionId);
            return n == null ? 0 : n.get();
        }

        void awaitCount(String connectionId, int count) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (seqs(connectionId).size() < count && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertThat(seqs(connectionId)).hasSizeGreaterThanOrEqualTo(count);
        }

        void awaitClosed(String connectionId) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (closedCount(connectionId) == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertThat(closedCount(connectionId)).isEqualTo(1);
        }
    }
}
