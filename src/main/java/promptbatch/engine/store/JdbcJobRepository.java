package promptbatch.engine.store;

import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.LeaseResult;
import promptbatch.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 * The lease is a conditional UPDATE on the job row; nothing here takes a lock that
 * outlives a single statement.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    static final String UNIQUE_VIOLATION = "23505";
    private static final String NON_TERMINAL = "('PENDING', 'PROCESSING')";

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean insert(BatchJob job) {
        String sql = """
                    INSERT INTO batch_jobs (id, org_id, run_key, active_org, status, total_tasks, completed_tasks,
                                            failed_tasks, created_at, trigger_source)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, job.id());
                ps.setString(2, job.orgId());
                ps.setString(3, job.runKey());
                ps.setString(4, job.isTerminal() ? null : job.orgId());
                ps.setString(5, job.status().name());
                ps.setInt(6, job.totalTasks());
                ps.setInt(7, job.completedTasks());
                ps.setInt(8, job.failedTasks());
                ps.setTimestamp(9, Timestamp.from(Objects.requireNonNull(job.createdAt(), "createdAt is required")));
                ps.setString(10, job.triggerSource());

                ps.executeUpdate();
                conn.commit();

                log.debug("Saved job: {} (org={}, window={})", job.id(), job.orgId(), job.runKey());
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    log.debug("Job for org {} window {} not created: {}", job.orgId(), job.runKey(), e.getMessage());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<BatchJob> findById(String jobId) {
        String sql = "SELECT * FROM batch_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            return first(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public Optional<BatchJob> findByOrgAndRunKey(String orgId, String runKey) {
        String sql = "SELECT * FROM batch_jobs WHERE org_id = ? AND run_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, orgId);
            ps.setString(2, runKey);
            return first(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job for org " + orgId + " window " + runKey, e);
        }
    }

    @Override
    public Optional<BatchJob> findActiveByOrg(String orgId) {
        String sql = "SELECT * FROM batch_jobs WHERE active_org = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, orgId);
            return first(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find active job for org: " + orgId, e);
        }
    }

    @Override
    public List<BatchJob> findByRunKey(String runKey) {
        String sql = "SELECT * FROM batch_jobs WHERE run_key = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runKey);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs for window: " + runKey, e);
        }
    }

    @Override
    public List<BatchJob> find(String orgId, JobStatus status, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM batch_jobs WHERE 1 = 1");
        if (orgId != null) {
            sql.append(" AND org_id = ?");
        }
        if (status != null) {
            sql.append(" AND status = ?");
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int i = 1;
            if (orgId != null) {
                ps.setString(i++, orgId);
            }
            if (status != null) {
                ps.setString(i++, status.name());
            }
            ps.setInt(i, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs", e);
        }
    }

    @Override
    public List<BatchJob> findStale(Instant staleBefore, int limit) {
        String sql = """
                    SELECT * FROM batch_jobs
                    WHERE status IN %s
                      AND ((driver_last_ping IS NOT NULL AND driver_last_ping < ?)
                        OR (driver_last_ping IS NULL AND created_at < ?))
                    ORDER BY created_at
                    LIMIT ?
                """.formatted(NON_TERMINAL);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp cutoff = Timestamp.from(staleBefore);
            ps.setTimestamp(1, cutoff);
            ps.setTimestamp(2, cutoff);
            ps.setInt(3, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale jobs", e);
        }
    }

    @Override
    public int countNonTerminal() {
        String sql = "SELECT COUNT(*) FROM batch_jobs WHERE status IN " + NON_TERMINAL;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
    }

    @Override
    public LeaseResult tryAcquireLease(String jobId, String driverId, Instant now, Instant freshAfter) {
        String sql = """
                    UPDATE batch_jobs
                    SET driver_active = TRUE, driver_id = ?, driver_last_ping = ?,
                        status = 'PROCESSING', started_at = COALESCE(started_at, ?)
                    WHERE id = ? AND status IN %s
                      AND (driver_active = FALSE OR driver_id IS NULL OR driver_id = ?
                           OR driver_last_ping IS NULL OR driver_last_ping < ?)
                """.formatted(NON_TERMINAL);

        try (Connection conn = db.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                Timestamp ts = Timestamp.from(now);
                ps.setString(1, driverId);
                ps.setTimestamp(2, ts);
                ps.setTimestamp(3, ts);
                ps.setString(4, jobId);
                ps.setString(5, driverId);
                ps.setTimestamp(6, Timestamp.from(freshAfter));
                updated = ps.executeUpdate();
            }
            conn.commit();

            if (updated > 0) {
                log.info("Driver {} claimed lease on job {}", driverId, jobId);
                return LeaseResult.CLAIMED;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim lease on job: " + jobId, e);
        }

        Optional<BatchJob> job = findById(jobId);
        if (job.isEmpty()) {
            return LeaseResult.NOT_FOUND;
        }
        if (job.get().isTerminal()) {
            return LeaseResult.JOB_TERMINAL;
        }
        log.debug("Driver {} lost lease race on job {} (held by {})", driverId, jobId, job.get().driverId());
        return LeaseResult.HELD_BY_OTHER;
    }

    @Override
    public boolean heartbeat(String jobId, String driverId, Instant now, boolean iteration) {
        String sql = """
                    UPDATE batch_jobs
                    SET driver_last_ping = ?, run_count = run_count + %d
                    WHERE id = ? AND driver_id = ? AND driver_active = TRUE AND status IN %s
                """.formatted(iteration ? 1 : 0, NON_TERMINAL);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            ps.setString(2, jobId);
            ps.setString(3, driverId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to heartbeat job: " + jobId, e);
        }
    }

    @Override
    public void releaseLease(String jobId, String driverId) {
        String sql = "UPDATE batch_jobs SET driver_active = FALSE WHERE id = ? AND driver_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, driverId);
            if (ps.executeUpdate() > 0) {
                log.debug("Driver {} released lease on job {}", driverId, jobId);
            }
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lease on job: " + jobId, e);
        }
    }

    @Override
    public boolean clearStaleLease(String jobId, Instant staleBefore) {
        String sql = """
                    UPDATE batch_jobs
                    SET driver_active = FALSE
                    WHERE id = ? AND status IN %s
                      AND (driver_active = FALSE OR driver_last_ping IS NULL OR driver_last_ping < ?)
                """.formatted(NON_TERMINAL);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setTimestamp(2, Timestamp.from(staleBefore));
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear lease on job: " + jobId, e);
        }
    }

    @Override
    public boolean finish(String jobId, JobStatus status, String errorMessage, Instant now) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }

        String sql = """
                    UPDATE batch_jobs
                    SET status = ?, finished_at = ?, active_org = NULL, driver_active = FALSE,
                        error_message = COALESCE(?, error_message)
                    WHERE id = ? AND status IN %s
                """.formatted(NON_TERMINAL);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setTimestamp(2, Timestamp.from(now));
            ps.setString(3, truncate(errorMessage));
            ps.setString(4, jobId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Job {} finished: {}", jobId, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish job: " + jobId, e);
        }
    }

    @Override
    public boolean syncCountersFromTasks(String jobId) {
        String sql = """
                    UPDATE batch_jobs
                    SET completed_tasks = GREATEST(completed_tasks,
                            (SELECT COUNT(*) FROM batch_tasks
                             WHERE batch_tasks.job_id = batch_jobs.id AND batch_tasks.status = 'COMPLETED')),
                        failed_tasks = GREATEST(failed_tasks,
                            (SELECT COUNT(*) FROM batch_tasks
                             WHERE batch_tasks.job_id = batch_jobs.id AND batch_tasks.status = 'FAILED'))
                    WHERE id = ? AND status IN %s
                      AND (completed_tasks < (SELECT COUNT(*) FROM batch_tasks
                                              WHERE batch_tasks.job_id = batch_jobs.id
                                                AND batch_tasks.status = 'COMPLETED')
                        OR failed_tasks < (SELECT COUNT(*) FROM batch_tasks
                                           WHERE batch_tasks.job_id = batch_jobs.id
                                             AND batch_tasks.status = 'FAILED'))
                """.formatted(NON_TERMINAL);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.warn("Job {} counters lagged behind task rows and were repaired", jobId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sync counters for job: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID();
    }

    // Helper methods

    private Optional<BatchJob> first(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
        }
        return Optional.empty();
    }

    private List<BatchJob> executeQuery(PreparedStatement ps) throws SQLException {
        List<BatchJob> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private BatchJob mapRow(ResultSet rs) throws SQLException {
        return BatchJob.builder()
                .id(rs.getString("id"))
                .orgId(rs.getString("org_id"))
                .runKey(rs.getString("run_key"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .totalTasks(rs.getInt("total_tasks"))
                .completedTasks(rs.getInt("completed_tasks"))
                .failedTasks(rs.getInt("failed_tasks"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .matrixBuiltAt(toInstant(rs.getTimestamp("matrix_built_at")))
                .driverActive(rs.getBoolean("driver_active"))
                .driverId(rs.getString("driver_id"))
                .driverLastPing(toInstant(rs.getTimestamp("driver_last_ping")))
                .runCount(rs.getInt("run_count"))
                .triggerSource(rs.getString("trigger_source"))
                .errorMessage(rs.getString("error_message"))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static String truncate(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }
}
