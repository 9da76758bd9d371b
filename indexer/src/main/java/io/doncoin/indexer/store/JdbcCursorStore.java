package io.doncoin.indexer.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;

public class JdbcCursorStore implements CursorStore {

    private static final String SELECT_CURSOR_SQL = "SELECT last_processed_block FROM indexer_cursors WHERE session_id = ?";

    private static final String UPDATE_CURSOR_SQL = """
        UPDATE indexer_cursors
        SET last_processed_block = ?,
            updated_at = ?
        WHERE session_id = ?
        """;

    private static final String INSERT_CURSOR_SQL = """
        INSERT INTO indexer_cursors(session_id, last_processed_block, updated_at)
        VALUES (?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcCursorStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<Long> loadLastProcessedBlock(UUID sessionId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_CURSOR_SQL)) {
            JdbcValues.setUuid(ps, 1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(rs.getLong(1));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load cursor for session " + sessionId, e);
        }
    }

    @Override
    public synchronized void saveLastProcessedBlock(UUID sessionId, long blockNumber) {
        try (Connection conn = dataSource.getConnection()) {
            if (update(conn, sessionId, blockNumber) > 0) {
                return;
            }
            if (insert(conn, sessionId, blockNumber) > 0) {
                return;
            }
            // another writer created the row between our update and insert
            update(conn, sessionId, blockNumber);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save cursor for session " + sessionId, e);
        }
    }

    private int update(Connection conn, UUID sessionId, long blockNumber) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPDATE_CURSOR_SQL)) {
            ps.setLong(1, blockNumber);
            JdbcValues.setInstant(ps, 2, clock.instant());
            JdbcValues.setUuid(ps, 3, sessionId);
            return ps.executeUpdate();
        }
    }

    private int insert(Connection conn, UUID sessionId, long blockNumber) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_CURSOR_SQL)) {
            JdbcValues.setUuid(ps, 1, sessionId);
            ps.setLong(2, blockNumber);
            JdbcValues.setInstant(ps, 3, clock.instant());
            return ps.executeUpdate();
        }
    }
}
