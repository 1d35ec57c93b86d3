package promptbatch.engine.store;

import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.TaskCompleteResult;
import promptbatch.engine.model.TaskFailResult;
import promptbatch.engine.model.TaskStatus;
import promptbatch.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Task transitions and job counter increments share one transaction; the task UPDATE
 * is guarded on status = 'PENDING' and the job UPDATE on a non-terminal job status.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean insertMatrix(String jobId, List<BatchTask> tasks, Instant now) {
        String lockJobSql = "SELECT status, matrix_built_at FROM batch_jobs WHERE id = ? FOR UPDATE";
        String insertSql = """
                    INSERT INTO batch_tasks (id, job_id, org_id, prompt_id, provider, status, attempts, max_attempts,
                                             created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String updateJobSql = "UPDATE batch_jobs SET total_tasks = ?, matrix_built_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try {
                try (PreparedStatement ps = conn.prepareStatement(lockJobSql)) {
                    ps.setString(1, jobId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            throw new IllegalArgumentException("Job not found: " + jobId);
                        }
                        if (rs.getTimestamp("matrix_built_at") != null
                                || JobStatus.valueOf(rs.getString("status")).isTerminal()) {
                            conn.rollback();
                            return false;
                        }
                    }
                }

                Timestamp ts = Timestamp.from(now);
                if (!tasks.isEmpty()) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        for (BatchTask task : tasks) {
                            if (!jobId.equals(task.jobId())) {
                                throw new IllegalArgumentException("Task " + task.key() + " belongs to another job");
                            }
                            ps.setString(1, task.id());
                            ps.setString(2, task.jobId());
                            ps.setString(3, task.orgId());
                            ps.setString(4, task.promptId());
                            ps.setString(5, task.provider());
                            ps.setString(6, task.status().name());
                            ps.setInt(7, task.attempts());
                            ps.setInt(8, task.maxAttempts());
                            ps.setTimestamp(9, ts);
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(updateJobSql)) {
                    ps.setInt(1, tasks.size());
                    ps.setTimestamp(2, ts);
                    ps.setString(3, jobId);
                    ps.executeUpdate();
                }

                conn.commit();
                log.debug("Inserted {} tasks for job {}", tasks.size(), jobId);
                return true;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to build task matrix for job: " + jobId, e);
        }
    }

    @Override
    public Optional<BatchTask> findById(String taskId) {
        String sql = "SELECT * FROM batch_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<BatchTask> findByJobId(String jobId) {
        String sql = "SELECT * FROM batch_tasks WHERE job_id = ? ORDER BY prompt_id, provider";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks for job: " + jobId, e);
        }
    }

    @Override
    public List<BatchTask> findPending(String jobId, int limit) {
        String sql = """
                    SELECT * FROM batch_tasks
                    WHERE job_id = ? AND status = 'PENDING'
                    ORDER BY attempts, created_at, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find pending tasks for job: " + jobId, e);
        }
    }

    @Override
    public int markDispatched(List<String> taskIds, Instant now) {
        if (taskIds.isEmpty())
            return 0;

        String sql = """
                    UPDATE batch_tasks
                    SET attempts = attempts + 1, started_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            for (String id : taskIds) {
                ps.setTimestamp(1, ts);
                ps.setString(2, id);
                ps.addBatch();
            }
            int dispatched = 0;
            for (int n : ps.executeBatch()) {
                dispatched += Math.max(n, 0);
            }
            conn.commit();
            return dispatched;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark tasks dispatched", e);
        }
    }

    @Override
    public TaskCompleteResult completeIdempotent(String taskId, String model, String rawResponse,
            Integer tokensIn, Integer tokensOut, long runtimeMs, Instant now) {
        String updateTaskSql = """
                    UPDATE batch_tasks
                    SET status = 'COMPLETED', finished_at = ?, model = ?, raw_response = ?,
                        tokens_in = ?, tokens_out = ?, runtime_ms = ?, last_error = NULL, error_kind = NULL
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection()) {
            try {
                TaskRef ref = lockTask(conn, taskId);
                if (ref == null) {
                    conn.rollback();
                    return TaskCompleteResult.NOT_FOUND;
                }
                if (ref.status != TaskStatus.PENDING) {
                    conn.rollback();
                    return TaskCompleteResult.ALREADY_TERMINAL;
                }

                Timestamp ts = Timestamp.from(now);

                // 1. Task transition; the guard makes a replayed completion a no-op
                try (PreparedStatement ps = conn.prepareStatement(updateTaskSql)) {
                    ps.setTimestamp(1, ts);
                    ps.setString(2, model);
                    ps.setString(3, rawResponse);
                    setIntOrNull(ps, 4, tokensIn);
                    setIntOrNull(ps, 5, tokensOut);
                    ps.setLong(6, runtimeMs);
                    ps.setString(7, taskId);

                    if (ps.executeUpdate() == 0) {
                        conn.rollback();
                        return TaskCompleteResult.ALREADY_TERMINAL;
                    }
                }

                // 2. Job counter, same transaction
                if (!incrementJobCounter(conn, ref.jobId, "completed_tasks")) {
                    conn.rollback();
                    log.debug("Task {} completed after job {} became terminal, discarded", taskId, ref.jobId);
                    return TaskCompleteResult.JOB_TERMINAL;
                }

                conn.commit();
                log.debug("Task {} completed, job {} completed_tasks incremented", taskId, ref.jobId);
                return TaskCompleteResult.COMPLETED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete task: " + taskId, e);
        }
    }

    @Override
    public TaskFailResult failIdempotent(String taskId, String errorKind, String errorMessage, boolean retriable,
            Instant now) {
        String retrySql = """
                    UPDATE batch_tasks
                    SET last_error = ?, error_kind = ?
                    WHERE id = ? AND status = 'PENDING'
                """;
        String failSql = """
                    UPDATE batch_tasks
                    SET status = 'FAILED', last_error = ?, error_kind = ?, finished_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection()) {
            try {
                TaskRef ref = lockTask(conn, taskId);
                if (ref == null) {
                    conn.rollback();
                    return TaskFailResult.NOT_FOUND;
                }
                if (ref.status != TaskStatus.PENDING) {
                    conn.rollback();
                    return TaskFailResult.ALREADY_TERMINAL;
                }
                if (isJobTerminal(conn, ref.jobId)) {
                    conn.rollback();
                    return TaskFailResult.JOB_TERMINAL;
                }

                String error = JdbcJobRepository.truncate(errorMessage);

                if (retriable && ref.attempts < ref.maxAttempts) {
                    // Back to the pending pool, counters untouched
                    try (PreparedStatement ps = conn.prepareStatement(retrySql)) {
                        ps.setString(1, error);
                        ps.setString(2, errorKind);
                        ps.setString(3, taskId);
                        ps.executeUpdate();
                    }
                    conn.commit();
                    log.debug("Task {} failed ({}), will retry (attempt {}/{})",
                            taskId, errorKind, ref.attempts, ref.maxAttempts);
                    return TaskFailResult.RETRIED;
                }

                try (PreparedStatement ps = conn.prepareStatement(failSql)) {
                    ps.setString(1, error);
                    ps.setString(2, errorKind);
                    ps.setTimestamp(3, Timestamp.from(now));
                    ps.setString(4, taskId);

                    if (ps.executeUpdate() == 0) {
                        conn.rollback();
                        return TaskFailResult.ALREADY_TERMINAL;
                    }
                }

                if (!incrementJobCounter(conn, ref.jobId, "failed_tasks")) {
                    conn.rollback();
                    return TaskFailResult.JOB_TERMINAL;
                }

                conn.commit();
                log.debug("Task {} permanently failed ({}), job {} failed_tasks incremented",
                        taskId, errorKind, ref.jobId);
                return TaskFailResult.FAILED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fail task: " + taskId, e);
        }
    }

    @Override
    public int cancelPending(String jobId, Instant now) {
        String sql = """
                    UPDATE batch_tasks
                    SET status = 'CANCELLED', finished_at = ?
                    WHERE job_id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            ps.setString(2, jobId);
            int cancelled = ps.executeUpdate();
            conn.commit();

            if (cancelled > 0) {
                log.info("Cancelled {} pending tasks of job {}", cancelled, jobId);
            }
            return cancelled;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel tasks for job: " + jobId, e);
        }
    }

    @Override
    public int countByJobIdAndStatus(String jobId, TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM batch_tasks WHERE job_id = ? AND status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, status.name());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks", e);
        }
    }

    @Override
    public Map<TaskStatus, Integer> countByStatus(String jobId) {
        String sql = "SELECT status, COUNT(*) FROM batch_tasks WHERE job_id = ? GROUP BY status";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(TaskStatus.valueOf(rs.getString(1)), rs.getInt(2));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks for job: " + jobId, e);
        }
    }

    // Helper methods

    private record TaskRef(String jobId, TaskStatus status, int attempts, int maxAttempts) {
    }

    private static TaskRef lockTask(Connection conn, String taskId) throws SQLException {
        String sql = "SELECT job_id, status, attempts, max_attempts FROM batch_tasks WHERE id = ? FOR UPDATE";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new TaskRef(rs.getString("job_id"), TaskStatus.valueOf(rs.getString("status")),
                        rs.getInt("attempts"), rs.getInt("max_attempts"));
            }
        }
    }

    private static boolean isJobTerminal(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT status FROM batch_jobs WHERE id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return !rs.next() || JobStatus.valueOf(rs.getString(1)).isTerminal();
            }
        }
    }

    /**
     * Increment one counter of a non-terminal job. Runs inside the caller's transaction.
     *
     * @return false if the job is missing or already terminal
     */
    private static boolean incrementJobCounter(Connection conn, String jobId, String column) throws SQLException {
        String sql = """
                    UPDATE batch_jobs
                    SET %s = %s + 1
                    WHERE id = ? AND status IN ('PENDING', 'PROCESSING')
                """.formatted(column, column);

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            return ps.executeUpdate() == 1;
        }
    }

    private List<BatchTask> executeQuery(PreparedStatement ps) throws SQLException {
        List<BatchTask> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private BatchTask mapRow(ResultSet rs) throws SQLException {
        return BatchTask.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .orgId(rs.getString("org_id"))
                .promptId(rs.getString("prompt_id"))
                .provider(rs.getString("provider"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .lastError(rs.getString("last_error"))
                .errorKind(rs.getString("error_kind"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .model(rs.getString("model"))
                .rawResponse(rs.getString("raw_response"))
                .tokensIn(getIntOrNull(rs, "tokens_in"))
                .tokensOut(getIntOrNull(rs, "tokens_out"))
                .runtimeMs(getLongOrNull(rs, "runtime_ms"))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
