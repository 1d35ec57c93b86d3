package promptbatch.engine.store;

import promptbatch.engine.model.SchedulerRun;
import promptbatch.engine.repository.SchedulerRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC implementation of SchedulerRunRepository.
 */
public class JdbcSchedulerRunRepository implements SchedulerRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchedulerRunRepository.class);

    private static final String STATE_ID = "daily";

    private final Database db;

    public JdbcSchedulerRunRepository(Database db) {
        this.db = db;
    }

    @Override
    public void start(SchedulerRun run) {
        String sql = """
                    INSERT INTO scheduler_runs (id, run_key, function_name, trigger_source, status, started_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.id());
            ps.setString(2, run.runKey());
            ps.setString(3, run.functionName());
            ps.setString(4, run.triggerSource());
            ps.setString(5, run.status());
            ps.setTimestamp(6, Timestamp.from(Objects.requireNonNull(run.startedAt(), "startedAt is required")));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record scheduler run: " + run.id(), e);
        }
    }

    @Override
    public void finish(String runId, String status, String resultJson, String errorMessage, Instant now) {
        String sql = """
                    UPDATE scheduler_runs
                    SET status = ?, completed_at = ?, result = ?, error_message = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status);
            ps.setTimestamp(2, Timestamp.from(now));
            ps.setString(3, resultJson);
            ps.setString(4, JdbcJobRepository.truncate(errorMessage));
            ps.setString(5, runId);
            if (ps.executeUpdate() == 0) {
                log.warn("Scheduler run {} not found when closing it", runId);
            }
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to close scheduler run: " + runId, e);
        }
    }

    @Override
    public List<SchedulerRun> findRecent(int limit) {
        String sql = "SELECT * FROM scheduler_runs ORDER BY started_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<SchedulerRun> runs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(new SchedulerRun(
                            rs.getString("id"),
                            rs.getString("run_key"),
                            rs.getString("function_name"),
                            rs.getString("trigger_source"),
                            rs.getString("status"),
                            toInstant(rs.getTimestamp("started_at")),
                            toInstant(rs.getTimestamp("completed_at")),
                            rs.getString("result"),
                            rs.getString("error_message")));
                }
            }
            return runs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find scheduler runs", e);
        }
    }

    @Override
    public Optional<String> lastDailyRunKey() {
        String sql = "SELECT last_daily_run_key FROM scheduler_state WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, STATE_ID);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read scheduler state", e);
        }
    }

    @Override
    public void markDailyRun(String runKey, Instant now) {
        String sql = """
                    MERGE INTO scheduler_state (id, last_daily_run_key, last_daily_run_at)
                    KEY (id)
                    VALUES (?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, STATE_ID);
            ps.setString(2, runKey);
            ps.setTimestamp(3, Timestamp.from(now));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write scheduler state", e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
