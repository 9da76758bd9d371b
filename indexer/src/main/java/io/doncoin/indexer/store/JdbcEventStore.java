package io.doncoin.indexer.store;

import io.doncoin.indexer.event.EventPersistenceException;
import io.doncoin.indexer.event.EventStore;
import io.doncoin.indexer.event.HandlerResult;
import io.doncoin.indexer.event.ProjectionMutation;
import io.doncoin.indexer.event.ProjectionMutation.IncrementDonationTotal;
import io.doncoin.indexer.event.ProjectionMutation.OpenRound;
import io.doncoin.indexer.event.ProjectionMutation.RecordDonation;
import io.doncoin.indexer.event.ProjectionMutation.UpsertProposal;
import io.doncoin.indexer.event.ProjectionView;
import io.doncoin.indexer.event.RawEvent;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists raw events and their projection mutations, one JDBC transaction per log entry.
 * The unique key on {@code contract_events(tx_hash, log_index, session_id)} decides which writer wins
 * when two processes deliver the same log.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);
    private static final int MAX_ATTEMPTS = 2;

    private static final String EXISTS_SQL = """
        SELECT 1 FROM contract_events
        WHERE tx_hash = ? AND log_index = ? AND session_id = ?
        """;

    private static final String INSERT_RAW_EVENT_SQL = """
        INSERT INTO contract_events(
            event_id, session_id, event_type, contract_address, tx_hash, log_index,
            block_number, block_hash, block_timestamp, decoded_args, observed_at
        )
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private static final String LINK_RAW_EVENT_SQL = """
        UPDATE contract_events
        SET proposal_id = ?,
            round_id = ?
        WHERE tx_hash = ? AND log_index = ? AND session_id = ?
        """;

    private static final String INSERT_WALLET_SQL = """
        INSERT INTO wallets(wallet_id, address, created_at)
        VALUES (?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private static final String SELECT_WALLET_SQL = "SELECT wallet_id FROM wallets WHERE address = ?";

    private static final String INSERT_DONOR_SQL = """
        INSERT INTO donors(donor_id, wallet_id, username, created_at)
        VALUES (?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private static final String SELECT_DONOR_SQL = "SELECT donor_id FROM donors WHERE wallet_id = ?";

    private static final String INSERT_MATCHING_POOL_SQL = """
        INSERT INTO matching_pools(pool_id, total_funds, created_at)
        VALUES (?, 0, ?)
        """;

    private static final String INSERT_ROUND_SQL = """
        INSERT INTO rounds(round_id, matching_pool_id, start_date, end_date, status)
        VALUES (?, ?, ?, ?, 'active')
        """;

    private static final String SELECT_ACTIVE_ROUND_SQL = """
        SELECT round_id FROM rounds
        WHERE status = 'active'
        ORDER BY start_date ASC, round_id ASC
        LIMIT 1
        """;

    private static final String SELECT_PROPOSAL_SQL = """
        SELECT proposal_id, round_id FROM proposals
        WHERE on_chain_id = ? AND session_id = ?
        """;

    private static final String UPDATE_PROPOSAL_SQL = """
        UPDATE proposals
        SET title = ?,
            description = ?,
            proposer_id = ?,
            round_id = ?,
            funding_goal = ?,
            status = 'pending',
            updated_at = ?
        WHERE proposal_id = ?
        """;

    private static final String INSERT_PROPOSAL_SQL = """
        INSERT INTO proposals(
            proposal_id, session_id, on_chain_id, title, description, proposer_id, round_id,
            funding_goal, total_donations, status, created_at, updated_at
        )
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, 'pending', ?, ?)
        """;

    private static final String INSERT_DONATION_SQL = """
        INSERT INTO donations(
            donation_id, session_id, donor_id, proposal_id, amount, token_address, on_chain_round_id,
            tx_hash, log_index, description, donated_at
        )
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String INCREMENT_DONATION_TOTAL_SQL = """
        UPDATE proposals
        SET total_donations = total_donations + ?
        WHERE proposal_id = ?
        """;

    private final DataSource dataSource;

    public JdbcEventStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean exists(String txHash, long logIndex, UUID sessionId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(EXISTS_SQL)) {
            ps.setString(1, txHash);
            ps.setLong(2, logIndex);
            JdbcValues.setUuid(ps, 3, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new EventPersistenceException("Failed to check event tx=" + txHash + " logIndex=" + logIndex, e);
        }
    }

    @Override
    public Optional<HandlerResult> apply(RawEvent rawEvent, ProjectionPlanner planner) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return applyOnce(rawEvent, planner);
            } catch (SQLException e) {
                if (JdbcValues.isTransientConflict(e) && attempt < MAX_ATTEMPTS) {
                    log.warn(
                        "Transient conflict persisting tx={} logIndex={}, retrying once. sqlState={}",
                        rawEvent.txHash(),
                        rawEvent.logIndex(),
                        e.getSQLState()
                    );
                    continue;
                }
                throw persistenceFailure(rawEvent, e);
            } catch (EventPersistenceException e) {
                throw e;
            } catch (RuntimeException e) {
                throw persistenceFailure(rawEvent, e);
            }
        }
    }

    private EventPersistenceException persistenceFailure(RawEvent rawEvent, Exception cause) {
        return new EventPersistenceException(
            "Failed to persist " + rawEvent.eventType() + " tx=" + rawEvent.txHash() + " logIndex=" + rawEvent.logIndex(),
            cause
        );
    }

    private Optional<HandlerResult> applyOnce(RawEvent rawEvent, ProjectionPlanner planner) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (!insertRawEvent(conn, rawEvent)) {
                    conn.commit();
                    return Optional.empty();
                }

                HandlerResult result = planner.plan(new JdbcProjectionView(conn));
                Instant at = rawEvent.observedAt();
                for (ProjectionMutation mutation : result.mutations()) {
                    applyMutation(conn, mutation, at);
                }
                if (result.proposalId() != null || result.roundId() != null) {
                    linkRawEvent(conn, rawEvent, result);
                }

                conn.commit();
                return Optional.of(result);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn);
                throw e;
            }
        }
    }

    private boolean insertRawEvent(Connection conn, RawEvent rawEvent) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_RAW_EVENT_SQL)) {
            JdbcValues.setUuid(ps, 1, UUID.randomUUID());
            JdbcValues.setUuid(ps, 2, rawEvent.sessionId());
            ps.setString(3, rawEvent.eventType());
            ps.setString(4, rawEvent.contractAddress());
            ps.setString(5, rawEvent.txHash());
            ps.setLong(6, rawEvent.logIndex());
            ps.setLong(7, rawEvent.blockNumber());
            ps.setString(8, rawEvent.blockHash());
            JdbcValues.setInstant(ps, 9, rawEvent.blockTimestamp());
            ps.setString(10, rawEvent.decodedArgsJson());
            JdbcValues.setInstant(ps, 11, rawEvent.observedAt());
            return ps.executeUpdate() > 0;
        }
    }

    private void linkRawEvent(Connection conn, RawEvent rawEvent, HandlerResult result) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(LINK_RAW_EVENT_SQL)) {
            JdbcValues.setUuid(ps, 1, result.proposalId());
            JdbcValues.setUuid(ps, 2, result.roundId());
            ps.setString(3, rawEvent.txHash());
            ps.setLong(4, rawEvent.logIndex());
            JdbcValues.setUuid(ps, 5, rawEvent.sessionId());
            ps.executeUpdate();
        }
    }

    private void applyMutation(Connection conn, ProjectionMutation mutation, Instant at) throws SQLException {
        if (mutation instanceof OpenRound openRound) {
            openRound(conn, openRound);
        } else if (mutation instanceof UpsertProposal upsertProposal) {
            upsertProposal(conn, upsertProposal);
        } else if (mutation instanceof RecordDonation recordDonation) {
            recordDonation(conn, recordDonation, at);
        } else if (mutation instanceof IncrementDonationTotal increment) {
            incrementDonationTotal(conn, increment);
        } else {
            throw new IllegalStateException("Unsupported projection mutation: " + mutation.getClass().getSimpleName());
        }
    }

    private void openRound(Connection conn, OpenRound openRound) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_MATCHING_POOL_SQL)) {
            JdbcValues.setUuid(ps, 1, openRound.matchingPoolId());
            JdbcValues.setInstant(ps, 2, openRound.startDate());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(INSERT_ROUND_SQL)) {
            JdbcValues.setUuid(ps, 1, openRound.roundId());
            JdbcValues.setUuid(ps, 2, openRound.matchingPoolId());
            JdbcValues.setInstant(ps, 3, openRound.startDate());
            JdbcValues.setInstant(ps, 4, openRound.endDate());
            ps.executeUpdate();
        }
    }

    private void upsertProposal(Connection conn, UpsertProposal proposal) throws SQLException {
        UUID proposerId = ensureDonor(conn, proposal.proposerAddress(), proposal.timestamp());

        try (PreparedStatement ps = conn.prepareStatement(UPDATE_PROPOSAL_SQL)) {
            ps.setString(1, proposal.title());
            ps.setString(2, proposal.description());
            JdbcValues.setUuid(ps, 3, proposerId);
            JdbcValues.setUuid(ps, 4, proposal.roundId());
            ps.setBigDecimal(5, proposal.fundingGoal());
            JdbcValues.setInstant(ps, 6, proposal.timestamp());
            JdbcValues.setUuid(ps, 7, proposal.proposalId());
            if (ps.executeUpdate() > 0) {
                return;
            }
        }

        try (PreparedStatement ps = conn.prepareStatement(INSERT_PROPOSAL_SQL)) {
            JdbcValues.setUuid(ps, 1, proposal.proposalId());
            JdbcValues.setUuid(ps, 2, proposal.sessionId());
            ps.setLong(3, proposal.onChainId());
            ps.setString(4, proposal.title());
            ps.setString(5, proposal.description());
            JdbcValues.setUuid(ps, 6, proposerId);
            JdbcValues.setUuid(ps, 7, proposal.roundId());
            ps.setBigDecimal(8, proposal.fundingGoal());
            JdbcValues.setInstant(ps, 9, proposal.timestamp());
            JdbcValues.setInstant(ps, 10, proposal.timestamp());
            ps.executeUpdate();
        }
    }

    private void recordDonation(Connection conn, RecordDonation donation, Instant at) throws SQLException {
        UUID donorId = ensureDonor(conn, donation.donorAddress(), at);

        try (PreparedStatement ps = conn.prepareStatement(INSERT_DONATION_SQL)) {
            JdbcValues.setUuid(ps, 1, donation.donationId());
            JdbcValues.setUuid(ps, 2, donation.sessionId());
            JdbcValues.setUuid(ps, 3, donorId);
            JdbcValues.setUuid(ps, 4, donation.proposalId());
            ps.setBigDecimal(5, donation.amount());
            ps.setString(6, donation.tokenAddress());
            ps.setBigDecimal(7, new BigDecimal(donation.onChainRoundId()));
            ps.setString(8, donation.txHash());
            ps.setLong(9, donation.logIndex());
            ps.setString(10, donation.description());
            JdbcValues.setInstant(ps, 11, donation.donatedAt());
            ps.executeUpdate();
        }
    }

    private void incrementDonationTotal(Connection conn, IncrementDonationTotal increment) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INCREMENT_DONATION_TOTAL_SQL)) {
            ps.setBigDecimal(1, increment.amount());
            JdbcValues.setUuid(ps, 2, increment.proposalId());
            int updated = ps.executeUpdate();
            if (updated != 1) {
                throw new IllegalStateException("Proposal missing for donation total: " + increment.proposalId());
            }
        }
    }

    private UUID ensureDonor(Connection conn, String address, Instant at) throws SQLException {
        UUID walletId = getOrCreate(conn, INSERT_WALLET_SQL, SELECT_WALLET_SQL, address, (ps, id) -> {
            JdbcValues.setUuid(ps, 1, id);
            ps.setString(2, address);
            JdbcValues.setInstant(ps, 3, at);
        }, ps -> ps.setString(1, address));

        return getOrCreate(conn, INSERT_DONOR_SQL, SELECT_DONOR_SQL, address, (ps, id) -> {
            JdbcValues.setUuid(ps, 1, id);
            JdbcValues.setUuid(ps, 2, walletId);
            ps.setString(3, address);
            JdbcValues.setInstant(ps, 4, at);
        }, ps -> JdbcValues.setUuid(ps, 1, walletId));
    }

    private UUID getOrCreate(
        Connection conn,
        String insertSql,
        String selectSql,
        String address,
        InsertBinder insertBinder,
        SelectBinder selectBinder
    ) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
            insertBinder.bind(ps, UUID.randomUUID());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
            selectBinder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("Identity row missing after insert for address " + address);
                }
                return rs.getObject(1, UUID.class);
            }
        }
    }

    private void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            log.debug("Rollback failed", rollbackError);
        }
    }

    @FunctionalInterface
    private interface InsertBinder {
        void bind(PreparedStatement ps, UUID id) throws SQLException;
    }

    @FunctionalInterface
    private interface SelectBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private static final class JdbcProjectionView implements ProjectionView {

        private final Connection conn;

        private JdbcProjectionView(Connection conn) {
            this.conn = conn;
        }

        @Override
        public Optional<UUID> findActiveRound() {
            try (PreparedStatement ps = conn.prepareStatement(SELECT_ACTIVE_ROUND_SQL);
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(JdbcValues.getUuid(rs, "round_id")) : Optional.empty();
            } catch (SQLException e) {
                throw new EventPersistenceException("Failed to look up active round", e);
            }
        }

        @Override
        public Optional<ProposalRef> findProposal(long onChainId, UUID sessionId) {
            try (PreparedStatement ps = conn.prepareStatement(SELECT_PROPOSAL_SQL)) {
                ps.setLong(1, onChainId);
                JdbcValues.setUuid(ps, 2, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new ProposalRef(
                        JdbcValues.getUuid(rs, "proposal_id"),
                        JdbcValues.getUuid(rs, "round_id")
                    ));
                }
            } catch (SQLException e) {
                throw new EventPersistenceException("Failed to look up proposal onChainId=" + onChainId, e);
            }
        }
    }
}
