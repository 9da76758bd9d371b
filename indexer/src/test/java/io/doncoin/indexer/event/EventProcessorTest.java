package io.doncoin.indexer.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.doncoin.indexer.config.UnknownEventPolicy;
import io.doncoin.indexer.eth.EventLog;
import io.doncoin.indexer.metrics.IndexerMetrics;
import io.doncoin.indexer.session.ChainSession;
import io.doncoin.indexer.store.JdbcEventStore;
import io.doncoin.indexer.support.TestDatabases;
import io.doncoin.indexer.support.TestLogs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventProcessorTest {

    private static final String METADATA = "{\"title\":\"Clean water\",\"description\":\"Wells\",\"budget\":\"1000\"}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC);

    private DataSource dataSource;
    private ChainSession session;
    private SimpleMeterRegistry registry;
    private EventProcessor processor;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabases.newDatabase();
        session = TestDatabases.newSession(dataSource, "0x01");
        registry = new SimpleMeterRegistry();
        processor = newProcessor(UnknownEventPolicy.RECORD);
    }

    @Test
    void processBatch_grantThenDonationUpdatesProjection() {
        List<EventLog> logs = List.of(
            TestLogs.grantCreated(TestLogs.txHash(1), 0L, 10L, 7L, METADATA),
            TestLogs.donation(TestLogs.txHash(2), 1L, 12L, 7L, TestLogs.ether("2.5"))
        );

        BatchResult result = processor.processBatch(session, logs);

        assertThat(result.count(ProcessingOutcome.APPLIED)).isEqualTo(2);
        assertThat(TestDatabases.decimal(
            dataSource,
            "SELECT total_donations FROM proposals WHERE on_chain_id = ? AND session_id = ?",
            7L,
            session.sessionId()
        )).isEqualByComparingTo("2.5");
        assertThat(TestDatabases.string(dataSource, "SELECT title FROM proposals WHERE on_chain_id = 7"))
            .isEqualTo("Clean water");
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM donations")).isEqualTo(1L);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM rounds")).isEqualTo(1L);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM contract_events WHERE proposal_id IS NOT NULL"))
            .isEqualTo(2L);
        assertThat(registry.get("events.processed").counter().count()).isEqualTo(2.0);
    }

    @Test
    void processBatch_replayIsIdempotent() {
        List<EventLog> logs = List.of(
            TestLogs.grantCreated(TestLogs.txHash(1), 0L, 10L, 7L, METADATA),
            TestLogs.donation(TestLogs.txHash(2), 1L, 12L, 7L, TestLogs.ether("2.5"))
        );

        processor.processBatch(session, logs);
        BatchResult replay = processor.processBatch(session, logs);

        assertThat(replay.count(ProcessingOutcome.DUPLICATE_SKIPPED)).isEqualTo(2);
        assertThat(TestDatabases.decimal(dataSource, "SELECT total_donations FROM proposals WHERE on_chain_id = 7"))
            .isEqualByComparingTo("2.5");
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM contract_events")).isEqualTo(2L);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM donations")).isEqualTo(1L);
        assertThat(registry.get("events.duplicate").counter().count()).isEqualTo(2.0);
    }

    @Test
    void processBatch_secondProcessSeesDuplicates() {
        EventProcessor other = newProcessor(UnknownEventPolicy.RECORD);
        EventLog grant = TestLogs.grantCreated(TestLogs.txHash(1), 0L, 10L, 7L, METADATA);

        assertThat(processor.process(session, grant)).isEqualTo(ProcessingOutcome.APPLIED);
        assertThat(other.process(session, grant)).isEqualTo(ProcessingOutcome.DUPLICATE_SKIPPED);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM proposals")).isEqualTo(1L);
    }

    @Test
    void processBatch_donationForUnknownGrantIsRecordedAsInconsistent() {
        List<EventLog> logs = List.of(
            TestLogs.donation(TestLogs.txHash(2), 0L, 5L, 99L, TestLogs.ether("1")),
            TestLogs.grantCreated(TestLogs.txHash(3), 0L, 6L, 7L, METADATA)
        );

        BatchResult result = processor.processBatch(session, logs);

        assertThat(result.count(ProcessingOutcome.INCONSISTENT)).isEqualTo(1);
        assertThat(result.count(ProcessingOutcome.APPLIED)).isEqualTo(1);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM contract_events")).isEqualTo(2L);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM donations")).isZero();
        assertThat(registry.get("events.inconsistent").counter().count()).isEqualTo(1.0);
    }

    @Test
    void processBatch_keepsCallerOrder() {
        // donation delivered ahead of its grant is not reordered
        List<EventLog> logs = List.of(
            TestLogs.donation(TestLogs.txHash(2), 0L, 5L, 7L, TestLogs.ether("1")),
            TestLogs.grantCreated(TestLogs.txHash(3), 0L, 6L, 7L, METADATA)
        );

        BatchResult result = processor.processBatch(session, logs);

        assertThat(result.count(ProcessingOutcome.INCONSISTENT)).isEqualTo(1);
        assertThat(TestDatabases.decimal(dataSource, "SELECT total_donations FROM proposals WHERE on_chain_id = 7"))
            .isEqualByComparingTo("0");
    }

    @Test
    void processBatch_reusesActiveRoundAcrossGrants() {
        processor.processBatch(session, List.of(
            TestLogs.grantCreated(TestLogs.txHash(1), 0L, 10L, 7L, METADATA),
            TestLogs.grantCreated(TestLogs.txHash(1), 1L, 10L, 8L, "not json")
        ));

        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM rounds")).isEqualTo(1L);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM proposals")).isEqualTo(2L);
        assertThat(TestDatabases.string(dataSource, "SELECT title FROM proposals WHERE on_chain_id = 8"))
            .isEqualTo("Grant 8");
    }

    @Test
    void process_sessionsDoNotShareEvents() {
        ChainSession next = TestDatabases.newSession(dataSource, "0x02");
        EventLog grant = TestLogs.grantCreated(TestLogs.txHash(1), 0L, 10L, 7L, METADATA);

        assertThat(processor.process(session, grant)).isEqualTo(ProcessingOutcome.APPLIED);
        assertThat(processor.process(next, grant)).isEqualTo(ProcessingOutcome.APPLIED);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM proposals WHERE on_chain_id = 7")).isEqualTo(2L);
    }

    @Test
    void process_recordsUnhandledEventByDefault() {
        EventLog roundStarted = TestLogs.roundStarted(TestLogs.txHash(4), 0L, 20L);

        assertThat(processor.process(session, roundStarted)).isEqualTo(ProcessingOutcome.RECORDED_UNHANDLED);
        assertThat(TestDatabases.string(dataSource, "SELECT event_type FROM contract_events"))
            .isEqualTo("RoundManager.RoundStarted");
        assertThat(TestDatabases.string(dataSource, "SELECT decoded_args FROM contract_events"))
            .contains("\"startTime\":1700000000");
        assertThat(processor.process(session, roundStarted)).isEqualTo(ProcessingOutcome.DUPLICATE_SKIPPED);
    }

    @Test
    void process_skipPolicyStoresNothing() {
        EventProcessor skipping = newProcessor(UnknownEventPolicy.SKIP);

        ProcessingOutcome outcome = skipping.process(session, TestLogs.roundStarted(TestLogs.txHash(4), 0L, 20L));

        assertThat(outcome).isEqualTo(ProcessingOutcome.SKIPPED_UNHANDLED);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM contract_events")).isZero();
    }

    @Test
    void process_undecodableEventIsCountedAndSkipped() {
        EventLog broken = TestLogs.log(
            "DonationVault",
            "DonationReceived",
            TestLogs.DONATION_VAULT,
            TestLogs.txHash(5),
            0L,
            21L,
            Map.of("donor", "not-an-address", "amount", BigInteger.ONE)
        );

        BatchResult result = processor.processBatch(session, List.of(
            broken,
            TestLogs.grantCreated(TestLogs.txHash(6), 0L, 22L, 7L, METADATA)
        ));

        assertThat(result.count(ProcessingOutcome.DECODE_FAILED)).isEqualTo(1);
        assertThat(result.count(ProcessingOutcome.APPLIED)).isEqualTo(1);
        assertThat(TestDatabases.count(dataSource, "SELECT COUNT(*) FROM contract_events")).isEqualTo(1L);
        assertThat(registry.get("events.error").tag("stage", IndexerMetrics.STAGE_DECODE).counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void process_persistenceFailurePropagates() {
        EventStore failing = new EventStore() {
            @Override
            public boolean exists(String txHash, long logIndex, UUID sessionId) {
                return false;
            }

            @Override
            public Optional<HandlerResult> apply(RawEvent rawEvent, ProjectionPlanner planner) {
                throw new EventPersistenceException("database unavailable", new IllegalStateException());
            }
        };
        EventProcessor broken = new EventProcessor(
            failing,
            new EventDecoder(),
            new GrantCreatedHandler(objectMapper, clock),
            new DonationReceivedHandler(),
            UnknownEventPolicy.RECORD,
            new IndexerMetrics(registry),
            objectMapper,
            clock
        );

        assertThatThrownBy(() -> broken.process(session, TestLogs.grantCreated(TestLogs.txHash(1), 0L, 1L, 7L, METADATA)))
            .isInstanceOf(EventPersistenceException.class);
        assertThat(registry.get("events.error").tag("stage", IndexerMetrics.STAGE_PERSISTENCE).counter().count())
            .isEqualTo(1.0);
    }

    private EventProcessor newProcessor(UnknownEventPolicy policy) {
        return new EventProcessor(
            new JdbcEventStore(dataSource),
            new EventDecoder(),
            new GrantCreatedHandler(objectMapper, clock),
            new DonationReceivedHandler(),
            policy,
            new IndexerMetrics(registry),
            objectMapper,
            clock
        );
    }
}
