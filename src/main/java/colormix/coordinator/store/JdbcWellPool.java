package colormix.coordinator.store;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.repository.NoUnusedWellsException;
import colormix.coordinator.repository.WellPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JDBC implementation of WellPool.
 * "Mark used" is a conditional update, so two processes sharing the plate can
 * never both claim the same well.
 */
public class JdbcWellPool implements WellPool {

    private static final Logger log = LoggerFactory.getLogger(JdbcWellPool.class);

    static final String EMPTY = "empty";
    static final String USED = "used";

    private final Database db;
    private final String rows;
    private final int columns;

    public JdbcWellPool(Database db, CoordinatorConfig config) {
        this(db, config.plateRows(), config.plateColumns());
    }

    public JdbcWellPool(Database db, String rows, int columns) {
        if (rows == null || rows.isBlank()) {
            throw new IllegalArgumentException("plate rows are required");
        }
        if (columns <= 0) {
            throw new IllegalArgumentException("plate columns must be positive");
        }
        this.db = db;
        this.rows = rows;
        this.columns = columns;
    }

    @Override
    public List<String> findUnusedWells() {
        String sql = "SELECT well FROM wells WHERE status = ? ORDER BY row_label, col_number";

        List<String> wells = new ArrayList<>();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, EMPTY);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    wells.add(rs.getString("well"));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find unused wells", e);
        }

        if (wells.isEmpty()) {
            throw new NoUnusedWellsException();
        }
        return wells;
    }

    @Override
    public List<String> markUsed(Collection<String> wells) {
        if (wells.isEmpty()) {
            return List.of();
        }

        String sql = "UPDATE wells SET status = ?, used_at = ? WHERE well = ? AND status = ?";

        List<String> marked = new ArrayList<>();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            for (String well : wells) {
                ps.setString(1, USED);
                ps.setTimestamp(2, now);
                ps.setString(3, well);
                ps.setString(4, EMPTY);
                if (ps.executeUpdate() > 0) {
                    marked.add(well);
                }
            }
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark wells used: " + wells, e);
        }

        if (marked.size() < wells.size()) {
            log.debug("Marked {} of {} wells; the rest were already used", marked.size(), wells.size());
        }
        return marked;
    }

    @Override
    public int resetPlate() {
        String sql = """
                    MERGE INTO wells (well, row_label, col_number, status, used_at)
                    KEY (well)
                    VALUES (?, ?, ?, ?, NULL)
                """;

        int count = 0;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (char row : rows.toCharArray()) {
                for (int col = 1; col <= columns; col++) {
                    ps.setString(1, "" + row + col);
                    ps.setString(2, String.valueOf(row));
                    ps.setInt(3, col);
                    ps.setString(4, EMPTY);
                    ps.addBatch();
                    count++;
                }
            }
            ps.executeBatch();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset plate", e);
        }

        log.info("Plate reset: {} empty wells", count);
        return count;
    }

    @Override
    public int countUnused() {
        String sql = "SELECT COUNT(*) FROM wells WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, EMPTY);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count unused wells", e);
        }
    }

    /**
     * @return total number of wells known to the database
     */
    public int countAll() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM wells")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count wells", e);
        }
    }
}
