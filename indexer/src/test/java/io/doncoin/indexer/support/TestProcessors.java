package io.doncoin.indexer.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.doncoin.indexer.config.UnknownEventPolicy;
import io.doncoin.indexer.event.DonationReceivedHandler;
import io.doncoin.indexer.event.EventDecoder;
import io.doncoin.indexer.event.EventPersistenceException;
import io.doncoin.indexer.event.EventProcessor;
import io.doncoin.indexer.event.EventStore;
import io.doncoin.indexer.event.GrantCreatedHandler;
import io.doncoin.indexer.event.HandlerResult;
import io.doncoin.indexer.event.RawEvent;
import io.doncoin.indexer.metrics.IndexerMetrics;
import io.doncoin.indexer.store.JdbcEventStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;

public final class TestProcessors {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC);

    private TestProcessors() {
    }

    public static EventProcessor jdbc(DataSource dataSource, IndexerMetrics metrics) {
        return withStore(new JdbcEventStore(dataSource), metrics);
    }

    /**
     * Processor whose store rejects every write, as a database that is down would.
     */
    public static EventProcessor unavailableStore(IndexerMetrics metrics) {
        EventStore store = new EventStore() {
            @Override
            public boolean exists(String txHash, long logIndex, UUID sessionId) {
                return false;
            }

            @Override
            public Optional<HandlerResult> apply(RawEvent rawEvent, ProjectionPlanner planner) {
                throw new EventPersistenceException("database unavailable", new IllegalStateException("connection refused"));
            }
        };
        return withStore(store, metrics);
    }

    private static EventProcessor withStore(EventStore store, IndexerMetrics metrics) {
        ObjectMapper objectMapper = new ObjectMapper();
        return new EventProcessor(
            store,
            new EventDecoder(),
            new GrantCreatedHandler(objectMapper, CLOCK),
            new DonationReceivedHandler(),
            UnknownEventPolicy.RECORD,
            metrics,
            objectMapper,
            CLOCK
        );
    }
}
