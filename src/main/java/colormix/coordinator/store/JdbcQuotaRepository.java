package colormix.coordinator.store;

import colormix.coordinator.repository.QuotaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;

/**
 * JDBC implementation of QuotaRepository.
 * Decrement is a guarded UPDATE so concurrent consumers can never drive a
 * quota below zero.
 */
public class JdbcQuotaRepository implements QuotaRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcQuotaRepository.class);

    private final Database db;
    private final int defaultQuota;

    public JdbcQuotaRepository(Database db, int defaultQuota) {
        this.db = db;
        this.defaultQuota = defaultQuota;
    }

    @Override
    public int getRemainingQuota(String submitterId) {
        requireId(submitterId);
        String select = "SELECT quota_remaining FROM quotas WHERE submitter_id = ?";

        try (Connection conn = db.getConnection()) {
            Integer remaining = selectQuota(conn, select, submitterId);
            if (remaining != null) {
                return remaining;
            }

            if (insertIfAbsent(conn, submitterId, defaultQuota)) {
                log.info("Registered submitter {} with quota {}", submitterId, defaultQuota);
            }
            conn.commit();
            remaining = selectQuota(conn, select, submitterId);
            return remaining != null ? remaining : defaultQuota;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read quota for: " + submitterId, e);
        }
    }

    @Override
    public boolean decrement(String submitterId) {
        requireId(submitterId);
        String sql = """
                    UPDATE quotas SET quota_remaining = quota_remaining - 1, updated_at = ?
                    WHERE submitter_id = ? AND quota_remaining > 0
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, submitterId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to decrement quota for: " + submitterId, e);
        }
    }

    @Override
    public void setQuota(String submitterId, int quota) {
        requireId(submitterId);
        if (quota < 0) {
            throw new IllegalArgumentException("quota must not be negative");
        }
        String sql = """
                    MERGE INTO quotas (submitter_id, quota_remaining, updated_at)
                    KEY (submitter_id)
                    VALUES (?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, submitterId);
            ps.setInt(2, quota);
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set quota for: " + submitterId, e);
        }
    }

    private static Integer selectQuota(Connection conn, String sql, String submitterId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, submitterId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : null;
            }
        }
    }

    private static boolean insertIfAbsent(Connection conn, String submitterId, int quota) throws SQLException {
        String sql = "INSERT INTO quotas (submitter_id, quota_remaining, updated_at) VALUES (?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, submitterId);
            ps.setInt(2, quota);
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            return ps.executeUpdate() > 0;
        } catch (SQLIntegrityConstraintViolationException e) {
            // registered concurrently
            conn.rollback();
            return false;
        }
    }

    private static void requireId(String submitterId) {
        if (submitterId == null || submitterId.isBlank()) {
            throw new IllegalArgumentException("submitterId is required");
        }
    }
}
