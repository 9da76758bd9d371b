package io.doncoin.indexer.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.doncoin.indexer.event.EventPersistenceException;
import io.doncoin.indexer.event.HandlerResult;
import io.doncoin.indexer.event.ProjectionMutation.IncrementDonationTotal;
import io.doncoin.indexer.event.ProjectionMutation.OpenRound;
import io.doncoin.indexer.event.RawEvent;
import io.doncoin.indexer.session.ChainSession;
import io.doncoin.indexer.support.TestDatabases;
import io.doncoin.indexer.support.TestLogs;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcEventStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T00:00:00Z");

    private DataSource dataSource;
    private ChainSession session;
    private JdbcEventStore eventStore;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabases.newDatabase();
        session = TestDatabases.newSession(dataSource, "0x01");
        eventStore = new JdbcEventStore(dataSource);
    }

    @Test
    void apply_secondInsertOfSameLogDoesNotPlan() {
        AtomicInteger plans = new AtomicInteger();
        RawEvent rawEvent = rawEvent(TestLogs.txHash(1), 0L);

        Optional<HandlerResult> first = eventStore.apply(rawEvent, view -> {
            plans.incrementAndGet();
            return HandlerResult.none();
        });
        Optional<HandlerResult> second = eventStore.apply(rawEvent, view -> {
            plans.incrementAndGet();
            return HandlerResult.none();
        });

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(plans).hasValue(1);
        assertThat(eventStore.exists(TestLogs.txHash(1), 0L, session.sessionId())).isTrue();
        assertThat(eventStore.exists(TestLogs.txHash(1), 1L, session.sessionId())).isFalse();
    }

    @Test
    void apply_failedMutationRollsBackRawEvent() {
        UUID roundId = UUID.randomUUID();
        RawEvent rawEvent = rawEvent(TestLogs.txHash(2), 0L);

        assertThatThrownBy(() -> eventStore.apply(rawEvent, view -> new HandlerResult(
            List.of(
                new OpenRound(roundId, UUID.randomUUID(), NOW, NOW.plusSeconds(60)),
                new IncrementDonationTotal(UUID.randomUUID(), BigDecimal.ONE)
            ),
            null,
            roundId,
            null
        )))
            .isInstanceOf(EventPersistenceException.class)
            .hasMessageContaining(TestLogs.txHash(2));

        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM contract_events")).isZero();
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM rounds")).isZero();
    }

    @Test
    void apply_planSeesRoundsOpenedByEarlierEvents() {
        UUID roundId = UUID.randomUUID();
        eventStore.apply(rawEvent(TestLogs.txHash(3), 0L), view -> new HandlerResult(
            List.of(new OpenRound(roundId, UUID.randomUUID(), NOW, NOW.plusSeconds(60))),
            null,
            roundId,
            null
        ));

        Optional<HandlerResult> next = eventStore.apply(rawEvent(TestLogs.txHash(3), 1L), view -> {
            assertThat(view.findActiveRound()).contains(roundId);
            assertThat(view.findProposal(7L, session.sessionId())).isEmpty();
            return HandlerResult.none();
        });

        assertThat(next).isPresent();
        assertThat(TestDatabases.count(
            dataSource,
            "SELECT COUNT(*) FROM contract_events WHERE round_id = ?",
            roundId
        )).isEqualTo(1L);
    }

    @Test
    void apply_concurrentDeliveryStoresOneRow() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 20; i++) {
                RawEvent rawEvent = rawEvent(TestLogs.txHash(100 + i), 0L);
                CyclicBarrier start = new CyclicBarrier(2);
                Callable<Boolean> deliver = () -> {
                    start.await(5, TimeUnit.SECONDS);
                    try {
                        return eventStore.apply(rawEvent, view -> HandlerResult.none()).isPresent();
                    } catch (EventPersistenceException e) {
                        // the losing writer may give up on a lock conflict; the row is still unique
                        return false;
                    }
                };
                List<Future<Boolean>> results = executor.invokeAll(List.of(deliver, deliver));

                int applied = 0;
                for (Future<Boolean> result : results) {
                    if (result.get()) {
                        applied++;
                    }
                }
                assertThat(applied).isEqualTo(1);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM contract_events")).isEqualTo(20L);
    }

    private RawEvent rawEvent(String txHash, long logIndex) {
        return new RawEvent(
            session.sessionId(),
            "RoundManager.RoundStarted",
            TestLogs.ROUND_MANAGER,
            txHash,
            logIndex,
            20L,
            "0x" + "ab".repeat(32),
            NOW,
            "{}",
            NOW
        );
    }
}
