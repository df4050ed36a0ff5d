package colormix.coordinator.store;

import colormix.coordinator.repository.NoUnusedWellsException;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWellPoolTest {

    private static Database db;
    private static JdbcWellPool pool;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-wells;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        pool = new JdbcWellPool(db, "AB", 3);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanWells() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM wells");
            conn.commit();
        }
    }

    @Test
    void resetCreatesPlateInOrder() {
        assertEquals(6, pool.resetPlate());

        assertEquals(List.of("A1", "A2", "A3", "B1", "B2", "B3"), pool.findUnusedWells());
        assertEquals(6, pool.countUnused());
        assertEquals(6, pool.countAll());
    }

    @Test
    void markUsedOnlyTransitionsUnusedWells() {
        pool.resetPlate();

        assertEquals(List.of("A1", "A2"), pool.markUsed(List.of("A1", "A2")));
        assertEquals(List.of(), pool.markUsed(List.of("A1")));
        assertEquals(List.of("B1"), pool.markUsed(List.of("A2", "B1")));

        assertEquals(List.of("A3", "B2", "B3"), pool.findUnusedWells());
    }

    @Test
    void emptyPlateThrows() {
        assertThrows(NoUnusedWellsException.class, () -> pool.findUnusedWells());

        pool.resetPlate();
        pool.markUsed(List.of("A1", "A2", "A3", "B1", "B2", "B3"));
        NoUnusedWellsException e = assertThrows(NoUnusedWellsException.class, () -> pool.findUnusedWells());
        assertEquals("No empty wells found", e.getMessage());
    }

    @Test
    void resetMakesUsedWellsEmptyAgain() {
        pool.resetPlate();
        pool.markUsed(List.of("A1"));

        pool.resetPlate();

        assertEquals(6, pool.countUnused());
        assertEquals(6, pool.countAll());
    }

    @Test
    void rejectsBadLayout() {
        assertThrows(IllegalArgumentException.class, () -> new JdbcWellPool(db, "", 12));
        assertThrows(IllegalArgumentException.class, () -> new JdbcWellPool(db, "A", 0));
    }
}
