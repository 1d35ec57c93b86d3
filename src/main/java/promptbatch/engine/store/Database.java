package promptbatch.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import promptbatch.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
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

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("promptbatch-db-pool");
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

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
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

            // ---------- CATALOG (owned by the dashboard, read here) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS organizations (
                            id               VARCHAR(64) PRIMARY KEY,
                            name             VARCHAR(256),
                            tier             VARCHAR(20) DEFAULT 'FREE',
                            subscribed       BOOLEAN DEFAULT FALSE,
                            trial_expires_at TIMESTAMP,
                            providers        VARCHAR(256),
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS prompts (
                            id          VARCHAR(64) PRIMARY KEY,
                            org_id      VARCHAR(64) NOT NULL,
                            text        CLOB NOT NULL,
                            active      BOOLEAN DEFAULT TRUE,
                            created_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- JOBS ----------
            // active_org is the org id while the job is non-terminal, NULL afterwards
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS batch_jobs (
                            id               VARCHAR(64) PRIMARY KEY,
                            org_id           VARCHAR(64) NOT NULL,
                            run_key          VARCHAR(16) NOT NULL,
                            active_org       VARCHAR(64),
                            status           VARCHAR(20) DEFAULT 'PENDING',
                            total_tasks      INT DEFAULT 0,
                            completed_tasks  INT DEFAULT 0,
                            failed_tasks     INT DEFAULT 0,
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at       TIMESTAMP,
                            finished_at      TIMESTAMP,
                            matrix_built_at  TIMESTAMP,
                            driver_active    BOOLEAN DEFAULT FALSE,
                            driver_id        VARCHAR(64),
                            driver_last_ping TIMESTAMP,
                            run_count        INT DEFAULT 0,
                            trigger_source   VARCHAR(64),
                            error_message    VARCHAR(2048),
                            CONSTRAINT ck_jobs_counters CHECK (completed_tasks >= 0 AND failed_tasks >= 0
                                AND completed_tasks + failed_tasks <= total_tasks),
                            CONSTRAINT uq_jobs_org_window UNIQUE (org_id, run_key),
                            CONSTRAINT uq_jobs_active_org UNIQUE (active_org)
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS batch_tasks (
                            id            VARCHAR(64) PRIMARY KEY,
                            job_id        VARCHAR(64) NOT NULL,
                            org_id        VARCHAR(64),
                            prompt_id     VARCHAR(64) NOT NULL,
                            provider      VARCHAR(32) NOT NULL,
                            status        VARCHAR(20) DEFAULT 'PENDING',
                            attempts      INT DEFAULT 0,
                            max_attempts  INT DEFAULT 3,
                            last_error    VARCHAR(2048),
                            error_kind    VARCHAR(32),
                            created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at    TIMESTAMP,
                            finished_at   TIMESTAMP,
                            model         VARCHAR(128),
                            raw_response  CLOB,
                            tokens_in     INT,
                            tokens_out    INT,
                            runtime_ms    BIGINT,
                            CONSTRAINT uq_tasks_triple UNIQUE (job_id, prompt_id, provider)
                        );
                    """);

            // ---------- SCHEDULER ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scheduler_runs (
                            id             VARCHAR(64) PRIMARY KEY,
                            run_key        VARCHAR(16),
                            function_name  VARCHAR(64) NOT NULL,
                            trigger_source VARCHAR(64),
                            status         VARCHAR(20) NOT NULL,
                            started_at     TIMESTAMP NOT NULL,
                            completed_at   TIMESTAMP,
                            result         CLOB,
                            error_message  VARCHAR(2048)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scheduler_state (
                            id                 VARCHAR(32) PRIMARY KEY,
                            last_daily_run_key VARCHAR(16),
                            last_daily_run_at  TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_prompts_org_active ON prompts(org_id, active);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_org_created ON batch_jobs(org_id, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status_ping ON batch_jobs(status, driver_last_ping);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_job_status ON batch_tasks(job_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_started ON scheduler_runs(started_at);");

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
