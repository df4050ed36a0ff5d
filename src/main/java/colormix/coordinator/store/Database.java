package colormix.coordinator.store;

import colormix.coordinator.config.CoordinatorConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("colormix-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- WELLS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS wells (
                            well            VARCHAR(10) PRIMARY KEY,
                            row_label       VARCHAR(4) NOT NULL,
                            col_number      INT NOT NULL,
                            status          VARCHAR(20) DEFAULT 'empty',
                            used_at         TIMESTAMP
                        );
                    """);

            // ---------- QUOTAS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS quotas (
                            submitter_id    VARCHAR(255) PRIMARY KEY,
                            quota_remaining INT NOT NULL,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS experiment_results (
                            session_id      VARCHAR(255) NOT NULL,
                            experiment_id   VARCHAR(64) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            red             INT NOT NULL,
                            yellow          INT NOT NULL,
                            blue            INT NOT NULL,
                            well            VARCHAR(10),
                            sensor_data     CLOB,
                            error_message   VARCHAR(2048),
                            started_at      TIMESTAMP,
                            finished_at     TIMESTAMP,
                            PRIMARY KEY (session_id, experiment_id)
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_wells_status ON wells(status, row_label, col_number);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_finished ON experiment_results(finished_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
