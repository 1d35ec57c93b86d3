package promptbatch.engine.repository;

import promptbatch.engine.model.SchedulerRun;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Audit log of trigger/reconciler invocations plus the global "already ran" marker.
 */
public interface SchedulerRunRepository {

    /**
     * Record the start of a run (status RUNNING).
     */
    void start(SchedulerRun run);

    /**
     * Close a run.
     *
     * @param runId        the run ID
     * @param status       COMPLETED, SKIPPED or FAILED
     * @param resultJson   JSON summary, may be null
     * @param errorMessage error, may be null
     * @param now          completion timestamp
     */
    void finish(String runId, String status, String resultJson, String errorMessage, Instant now);

    List<SchedulerRun> findRecent(int limit);

    /**
     * Run key of the last daily run that dispatched work.
     */
    Optional<String> lastDailyRunKey();

    void markDailyRun(String runKey, Instant now);
}
