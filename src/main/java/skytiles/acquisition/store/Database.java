package skytiles.acquisition.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.repository.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool and schema management for the state store.
 * Uses HikariCP over an embedded H2 database.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(AcquisitionConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("skytiles-state-pool");
        hikariConfig.setAutoCommit(false);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (HikariPool.PoolInitializationException e) {
            throw new StateStoreException("Cannot open state store: " + jdbcUrl, e);
        }

        log.info("State store pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if the database answers.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("State store health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_records (
                            ts              CHAR(14) PRIMARY KEY,
                            status          VARCHAR(20) NOT NULL,
                            attempts        INT DEFAULT 0,
                            last_error      VARCHAR(2048),
                            last_attempt_at TIMESTAMP WITH TIME ZONE,
                            created_at      TIMESTAMP WITH TIME ZONE,
                            finished_at     TIMESTAMP WITH TIME ZONE,
                            artifact_path   VARCHAR(1024)
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_records_status ON task_records(status, ts);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_records_attempt ON task_records(status, last_attempt_at);");

            st.executeBatch();
            conn.commit();

            log.info("State store schema initialized");
        } catch (SQLException e) {
            throw new StateStoreException("Failed to initialize state store schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("State store pool closed");
        }
    }
}
