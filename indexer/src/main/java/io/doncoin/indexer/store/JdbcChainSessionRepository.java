package io.doncoin.indexer.store;

import io.doncoin.indexer.session.ChainSession;
import io.doncoin.indexer.session.ChainSessionRepository;
import io.doncoin.indexer.session.SessionResolution;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import javax.sql.DataSource;

public class JdbcChainSessionRepository implements ChainSessionRepository {

    private static final String INSERT_SESSION_SQL = """
        INSERT INTO chain_sessions(session_id, contract_address, deployment_block_number, deployment_block_hash, created_at)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private static final String SELECT_SESSION_SQL = """
        SELECT session_id, contract_address, deployment_block_number, deployment_block_hash, created_at
        FROM chain_sessions
        WHERE contract_address = ? AND deployment_block_hash = ?
        """;

    private final DataSource dataSource;

    public JdbcChainSessionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public SessionResolution getOrCreate(ChainSession candidate) {
        try (Connection conn = dataSource.getConnection()) {
            boolean inserted;
            try (PreparedStatement ps = conn.prepareStatement(INSERT_SESSION_SQL)) {
                JdbcValues.setUuid(ps, 1, candidate.sessionId());
                ps.setString(2, candidate.contractAddress());
                ps.setLong(3, candidate.deploymentBlockNumber());
                ps.setString(4, candidate.deploymentBlockHash());
                JdbcValues.setInstant(ps, 5, candidate.createdAt());
                inserted = ps.executeUpdate() > 0;
            }

            try (PreparedStatement ps = conn.prepareStatement(SELECT_SESSION_SQL)) {
                ps.setString(1, candidate.contractAddress());
                ps.setString(2, candidate.deploymentBlockHash());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalStateException(
                            "Chain session vanished after insert: " + candidate.contractAddress()
                        );
                    }
                    ChainSession stored = new ChainSession(
                        JdbcValues.getUuid(rs, "session_id"),
                        rs.getString("contract_address"),
                        rs.getLong("deployment_block_number"),
                        rs.getString("deployment_block_hash"),
                        JdbcValues.getInstant(rs, "created_at")
                    );
                    return new SessionResolution(stored, inserted);
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to resolve chain session for " + candidate.contractAddress(), e);
        }
    }
}
