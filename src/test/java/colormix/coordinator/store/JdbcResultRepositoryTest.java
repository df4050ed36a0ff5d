package colormix.coordinator.store;

import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.TaskStatus;
import colormix.coordinator.model.Volumes;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcResultRepositoryTest {

    private static Database db;
    private static JdbcResultRepository results;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-results;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        results = new JdbcResultRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanResults() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM experiment_results");
            conn.commit();
        }
    }

    private static ExperimentResult completed(String sessionId, String experimentId, Instant finishedAt) {
        Map<String, Object> reading = new LinkedHashMap<>();
        reading.put("ch410", 120);
        reading.put("ch440", 250);
        return new ExperimentResult(new SessionToken(sessionId, experimentId), TaskStatus.COMPLETED,
                new Volumes(100, 50, 25), "A1", reading, null, finishedAt.minusSeconds(30), finishedAt);
    }

    @Test
    void saveAndFindByToken() {
        Instant finished = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        results.save(completed("s1", "e1", finished));

        Optional<ExperimentResult> found = results.findByToken(new SessionToken("s1", "e1"));

        assertTrue(found.isPresent());
        ExperimentResult r = found.get();
        assertEquals(TaskStatus.COMPLETED, r.status());
        assertEquals(new Volumes(100, 50, 25), r.volumes());
        assertEquals("A1", r.well());
        assertEquals(120, ((Number) r.sensorData().get("ch410")).intValue());
        assertEquals(250, ((Number) r.sensorData().get("ch440")).intValue());
        assertNull(r.errorMessage());
        assertEquals(finished, r.finishedAt());
    }

    @Test
    void failedResultKeepsMessage() {
        SessionToken token = new SessionToken("s1", "e2");
        results.save(new ExperimentResult(token, TaskStatus.TIMED_OUT, new Volumes(0, 0, 300), "B4",
                Map.of(), "Device did not respond within 165s", Instant.now(), Instant.now()));

        ExperimentResult r = results.findByToken(token).orElseThrow();

        assertEquals(TaskStatus.TIMED_OUT, r.status());
        assertEquals("Device did not respond within 165s", r.errorMessage());
        assertTrue(r.sensorData().isEmpty());
    }

    @Test
    void firstSaveWins() {
        Instant now = Instant.now();
        results.save(completed("s1", "e1", now));
        results.save(new ExperimentResult(new SessionToken("s1", "e1"), TaskStatus.ERRORED,
                new Volumes(1, 1, 1), "H12", Map.of(), "late", now, now));

        assertEquals(TaskStatus.COMPLETED, results.findByToken(new SessionToken("s1", "e1")).orElseThrow().status());
    }

    @Test
    void findBySessionIsNewestFirstAndLimited() {
        Instant base = Instant.parse("2024-03-01T10:00:00Z");
        results.save(completed("s1", "e1", base));
        results.save(completed("s1", "e2", base.plusSeconds(60)));
        results.save(completed("s1", "e3", base.plusSeconds(120)));
        results.save(completed("s2", "e4", base.plusSeconds(180)));

        List<ExperimentResult> latest = results.findBySession("s1", 2);

        assertEquals(2, latest.size());
        assertEquals("e3", latest.get(0).token().experimentId());
        assertEquals("e2", latest.get(1).token().experimentId());

        List<ExperimentResult> recent = results.findRecent(10);
        assertEquals(4, recent.size());
        assertEquals("e4", recent.get(0).token().experimentId());
    }

    @Test
    void missingTokenIsEmpty() {
        assertTrue(results.findByToken(new SessionToken("nobody", "none")).isEmpty());
        assertTrue(results.findBySession("nobody", 5).isEmpty());
    }
}
