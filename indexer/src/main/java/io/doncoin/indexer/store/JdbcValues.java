package io.doncoin.indexer.store;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;

final class JdbcValues {

    // serialization failure, deadlock, lock timeout, H2 concurrent update
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of("40001", "40P01", "HYT00", "90131");

    private JdbcValues() {
    }

    static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
        }
    }

    static void setUuid(PreparedStatement ps, int index, UUID value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.OTHER);
        } else {
            ps.setObject(index, value);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    static UUID getUuid(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }

    /**
     * Lock timeouts, deadlocks and serialization failures. The transaction can be retried as is.
     */
    static boolean isTransientConflict(SQLException e) {
        SQLException cursor = e;
        while (cursor != null) {
            String sqlState = cursor.getSQLState();
            if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                return true;
            }
            cursor = cursor.getNextException();
        }
        return false;
    }
}
