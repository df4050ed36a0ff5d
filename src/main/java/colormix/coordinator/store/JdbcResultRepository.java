package colormix.coordinator.store;

import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.TaskStatus;
import colormix.coordinator.model.Volumes;
import colormix.coordinator.protocol.DeviceMessages;
import colormix.coordinator.repository.ResultRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of ResultRepository.
 * Sensor readings are stored as a JSON document.
 */
public class JdbcResultRepository implements ResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcResultRepository.class);
    private static final TypeReference<Map<String, Object>> SENSOR_DATA = new TypeReference<>() {
    };

    private final Database db;

    public JdbcResultRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(ExperimentResult result) {
        String sql = """
                    INSERT INTO experiment_results (session_id, experiment_id, status, red, yellow, blue, well,
                                                    sensor_data, error_message, started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result.token().sessionId());
            ps.setString(2, result.token().experimentId());
            ps.setString(3, result.status().name());
            ps.setInt(4, result.volumes().red());
            ps.setInt(5, result.volumes().yellow());
            ps.setInt(6, result.volumes().blue());
            ps.setString(7, result.well());
            ps.setString(8, DeviceMessages.mapper().writeValueAsString(result.sensorData()));
            ps.setString(9, result.errorMessage());
            setTimestamp(ps, 10, result.startedAt());
            setTimestamp(ps, 11, result.finishedAt());

            ps.executeUpdate();
            conn.commit();
            log.debug("Saved result {} ({})", result.token(), result.status());
        } catch (SQLIntegrityConstraintViolationException e) {
            log.warn("Result for {} already saved, keeping the first", result.token());
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Failed to save result: " + result.token(), e);
        }
    }

    @Override
    public Optional<ExperimentResult> findByToken(SessionToken token) {
        String sql = "SELECT * FROM experiment_results WHERE session_id = ? AND experiment_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, token.sessionId());
            ps.setString(2, token.experimentId());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find result: " + token, e);
        }
    }

    @Override
    public List<ExperimentResult> findBySession(String sessionId, int limit) {
        String sql = "SELECT * FROM experiment_results WHERE session_id = ? ORDER BY finished_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            ps.setInt(2, limit);
            return mapRows(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find results for session: " + sessionId, e);
        }
    }

    @Override
    public List<ExperimentResult> findRecent(int limit) {
        String sql = "SELECT * FROM experiment_results ORDER BY finished_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return mapRows(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent results", e);
        }
    }

    private List<ExperimentResult> mapRows(PreparedStatement ps) throws SQLException {
        List<ExperimentResult> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private ExperimentResult mapRow(ResultSet rs) throws SQLException {
        return new ExperimentResult(
                new SessionToken(rs.getString("session_id"), rs.getString("experiment_id")),
                TaskStatus.valueOf(rs.getString("status")),
                new Volumes(rs.getInt("red"), rs.getInt("yellow"), rs.getInt("blue")),
                rs.getString("well"),
                readSensorData(rs.getString("sensor_data")),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at")));
    }

    private static Map<String, Object> readSensorData(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return DeviceMessages.mapper().readValue(json, SENSOR_DATA);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt sensor_data column", e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
